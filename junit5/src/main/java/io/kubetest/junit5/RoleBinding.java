package io.kubetest.junit5;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a Role or ClusterRole inside the test namespace for the duration of the test.
 * Without a subject the binding applies to all users and service accounts.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Repeatable(RoleBinding.List.class)
public @interface RoleBinding {

    /**
     * {@code Role} or {@code ClusterRole}.
     */
    String kind();

    String name();

    String subjectKind() default "";

    String subjectName() default "";

    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Inherited
    @interface List {
        RoleBinding[] value();
    }
}
