package io.kubetest.rbac;

import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBindingBuilder;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import io.fabric8.kubernetes.api.model.rbac.RoleBindingBuilder;
import io.fabric8.kubernetes.api.model.rbac.Subject;
import io.fabric8.kubernetes.api.model.rbac.SubjectBuilder;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Builds the RoleBindings and ClusterRoleBindings that grant a test's workloads access to roles.
 * Without an explicit subject the binding applies to all authenticated and unauthenticated users and all service accounts.
 */
public final class RbacBindings {

    public static final String API_GROUP = "rbac.authorization.k8s.io";
    public static final String NAME_PREFIX = "kubetest:";

    private RbacBindings() {
    }

    /**
     * Name of the n-th binding of a test, the first one carries no index.
     */
    public static String bindingName(String testName, int index) {
        return index == 0 ? NAME_PREFIX + testName : NAME_PREFIX + testName + "-" + index;
    }

    /**
     * @param roleKind {@code Role} or {@code ClusterRole}
     */
    public static RoleBinding roleBinding(String name, String namespace, String roleKind, String roleName,
                                          String subjectKind, String subjectName) {
        return new RoleBindingBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                .endMetadata()
                .withNewRoleRef(API_GROUP, roleKind, roleName)
                .withSubjects(subjects(namespace, subjectKind, subjectName))
                .build();
    }

    public static ClusterRoleBinding clusterRoleBinding(String name, String namespace, String clusterRoleName,
                                                        String subjectKind, String subjectName) {
        return new ClusterRoleBindingBuilder()
                .withNewMetadata()
                    .withName(name)
                .endMetadata()
                .withNewRoleRef(API_GROUP, "ClusterRole", clusterRoleName)
                .withSubjects(subjects(namespace, subjectKind, subjectName))
                .build();
    }

    /**
     * The custom subject when kind and name are given, the default subjects when neither is.
     *
     * @throws IllegalArgumentException when only one of kind and name is given
     */
    public static List<Subject> subjects(String namespace, String subjectKind, String subjectName) {
        List<Subject> custom = customSubject(namespace, subjectKind, subjectName);
        return custom.isEmpty() ? defaultSubjects(namespace) : custom;
    }

    public static List<Subject> customSubject(String namespace, String kind, String name) {
        boolean hasKind = kind != null && !kind.isEmpty();
        boolean hasName = name != null && !name.isEmpty();
        if (hasKind != hasName) {
            throw new IllegalArgumentException("One of subject kind and subject name was specified, "
                    + "but both must be specified when defining a custom subject");
        }
        if (!hasKind) {
            return Collections.emptyList();
        }
        return Collections.singletonList(subject(namespace, kind, name));
    }

    public static List<Subject> defaultSubjects(String namespace) {
        return Arrays.asList(
                subject(namespace, "Group", "system:authenticated"),
                subject(namespace, "Group", "system:unauthenticated"),
                subject(namespace, "Group", "system:serviceaccounts"));
    }

    private static Subject subject(String namespace, String kind, String name) {
        return new SubjectBuilder()
                .withApiGroup(API_GROUP)
                .withNamespace(namespace)
                .withKind(kind)
                .withName(name)
                .build();
    }
}
