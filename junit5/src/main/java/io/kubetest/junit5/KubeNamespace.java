package io.kubetest.junit5;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Overrides the generated test namespace.
 * <p>
 * With {@code create = true} the namespace is created and deleted by the harness, a blank name is generated.
 * With {@code create = false} the namespace must already exist and is left in place, a blank name means {@code default}.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Inherited
public @interface KubeNamespace {

    String name() default "";

    boolean create() default true;
}
