package io.kubetest.junit5;

import io.kubetest.manifest.ManifestRenderer;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Creates the objects of every manifest in a directory before the test runs, {@code ${dir_path}} renders to the directory.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Repeatable(ApplyManifests.List.class)
public @interface ApplyManifests {

    /**
     * Directory, resolved like {@link ApplyManifest#value()}.
     */
    String value();

    /**
     * Files of the directory to apply in this order, empty applies all {@code .yaml} and {@code .yml} files sorted by name.
     */
    String[] files() default {};

    /**
     * Renderer of this manifest, by default the one of {@link RenderManifests}.
     */
    Class<? extends ManifestRenderer> renderer() default ManifestRenderer.class;

    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Inherited
    @interface List {
        ApplyManifests[] value();
    }
}
