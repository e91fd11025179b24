package io.kubetest.junit5;

import io.kubetest.manifest.ManifestRenderer;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Creates the objects of a manifest file before the test runs. Class level manifests are applied before method level ones.
 * <p>
 * The location is a file system path or a class path resource relative to the test class. Unless another renderer is
 * chosen, the tokens {@code ${namespace}}, {@code ${test_name}} and {@code ${test_node_id}} are replaced before parsing.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Repeatable(ApplyManifest.List.class)
public @interface ApplyManifest {

    String value();

    /**
     * Renderer of this manifest, by default the one of {@link RenderManifests}.
     */
    Class<? extends ManifestRenderer> renderer() default ManifestRenderer.class;

    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Inherited
    @interface List {
        ApplyManifest[] value();
    }
}
