package io.kubetest.junit5;

import io.kubetest.manifest.ManifestRenderer;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Renderer of the manifests of a test, the one on the method wins over the one on the class.
 * Without it manifests are rendered by {@link io.kubetest.manifest.TokenRenderer}.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Inherited
public @interface RenderManifests {

    Class<? extends ManifestRenderer> value();
}
