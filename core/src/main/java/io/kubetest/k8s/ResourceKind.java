package io.kubetest.k8s;

import io.fabric8.kubernetes.api.Pluralize;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Identifies a kind of cluster object independently of any model class.
 * Every document the harness handles is addressed by kind, namespace and name.
 */
public final class ResourceKind {

    private static final Map<String, ResourceKind> KNOWN = new LinkedHashMap<>();

    public static final ResourceKind POD = known("v1", "Pod", "pods", true);
    public static final ResourceKind SERVICE = known("v1", "Service", "services", true);
    public static final ResourceKind CONFIG_MAP = known("v1", "ConfigMap", "configmaps", true);
    public static final ResourceKind SECRET = known("v1", "Secret", "secrets", true);
    public static final ResourceKind SERVICE_ACCOUNT = known("v1", "ServiceAccount", "serviceaccounts", true);
    public static final ResourceKind PERSISTENT_VOLUME_CLAIM = known("v1", "PersistentVolumeClaim", "persistentvolumeclaims", true);
    public static final ResourceKind ENDPOINTS = known("v1", "Endpoints", "endpoints", true);
    public static final ResourceKind EVENT = known("v1", "Event", "events", true);
    public static final ResourceKind NAMESPACE = known("v1", "Namespace", "namespaces", false);
    public static final ResourceKind NODE = known("v1", "Node", "nodes", false);
    public static final ResourceKind PERSISTENT_VOLUME = known("v1", "PersistentVolume", "persistentvolumes", false);
    public static final ResourceKind DEPLOYMENT = known("apps/v1", "Deployment", "deployments", true);
    public static final ResourceKind STATEFUL_SET = known("apps/v1", "StatefulSet", "statefulsets", true);
    public static final ResourceKind DAEMON_SET = known("apps/v1", "DaemonSet", "daemonsets", true);
    public static final ResourceKind REPLICA_SET = known("apps/v1", "ReplicaSet", "replicasets", true);
    public static final ResourceKind JOB = known("batch/v1", "Job", "jobs", true);
    public static final ResourceKind INGRESS = known("networking.k8s.io/v1", "Ingress", "ingresses", true);
    public static final ResourceKind ROLE = known("rbac.authorization.k8s.io/v1", "Role", "roles", true);
    public static final ResourceKind ROLE_BINDING = known("rbac.authorization.k8s.io/v1", "RoleBinding", "rolebindings", true);
    public static final ResourceKind CLUSTER_ROLE = known("rbac.authorization.k8s.io/v1", "ClusterRole", "clusterroles", false);
    public static final ResourceKind CLUSTER_ROLE_BINDING = known("rbac.authorization.k8s.io/v1", "ClusterRoleBinding", "clusterrolebindings", false);
    public static final ResourceKind STORAGE_CLASS = known("storage.k8s.io/v1", "StorageClass", "storageclasses", false);
    public static final ResourceKind CSI_DRIVER = known("storage.k8s.io/v1", "CSIDriver", "csidrivers", false);
    public static final ResourceKind CUSTOM_RESOURCE_DEFINITION = known("apiextensions.k8s.io/v1", "CustomResourceDefinition", "customresourcedefinitions", false);

    private final String apiVersion;
    private final String kind;
    private final String plural;
    private final boolean namespaced;

    private ResourceKind(String apiVersion, String kind, String plural, boolean namespaced) {
        this.apiVersion = Objects.requireNonNull(apiVersion, "apiVersion");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.plural = Objects.requireNonNull(plural, "plural");
        this.namespaced = namespaced;
    }

    private static ResourceKind known(String apiVersion, String kind, String plural, boolean namespaced) {
        ResourceKind result = new ResourceKind(apiVersion, kind, plural, namespaced);
        KNOWN.put(key(apiVersion, kind), result);
        return result;
    }

    private static String key(String apiVersion, String kind) {
        return apiVersion + "/" + kind;
    }

    /**
     * Kind with an explicit plural and scope, for custom resources.
     */
    public static ResourceKind of(String apiVersion, String kind, String plural, boolean namespaced) {
        return new ResourceKind(apiVersion, kind, plural, namespaced);
    }

    /**
     * Known kind or a namespaced kind whose plural is derived from the kind name.
     */
    public static ResourceKind of(String apiVersion, String kind) {
        ResourceKind result = KNOWN.get(key(apiVersion, kind));
        if (result != null) {
            return result;
        }
        return new ResourceKind(apiVersion, kind, Pluralize.toPlural(kind.toLowerCase(Locale.ROOT)), true);
    }

    /**
     * Kind of an object, typed model classes carry their plural and scope, generic documents fall back to {@link #of(String, String)}.
     */
    public static ResourceKind of(HasMetadata resource) {
        if (resource.getApiVersion() == null || resource.getKind() == null) {
            throw new IllegalArgumentException(String.format("Object %s has no apiVersion or kind",
                    resource.getMetadata() == null ? "<unnamed>" : resource.getMetadata().getName()));
        }
        ResourceKind result = KNOWN.get(key(resource.getApiVersion(), resource.getKind()));
        if (result != null) {
            return result;
        }
        if (resource instanceof GenericKubernetesResource) {
            return of(resource.getApiVersion(), resource.getKind());
        }
        return new ResourceKind(resource.getApiVersion(), resource.getKind(), HasMetadata.getPlural(resource.getClass()),
                resource instanceof Namespaced);
    }

    public static Map<String, ResourceKind> knownKinds() {
        return Collections.unmodifiableMap(KNOWN);
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public String getKind() {
        return kind;
    }

    public String getPlural() {
        return plural;
    }

    public boolean isNamespaced() {
        return namespaced;
    }

    /**
     * @return api group, empty for the core group
     */
    public String getGroup() {
        int slash = apiVersion.indexOf('/');
        return slash < 0 ? "" : apiVersion.substring(0, slash);
    }

    public String getVersion() {
        int slash = apiVersion.indexOf('/');
        return slash < 0 ? apiVersion : apiVersion.substring(slash + 1);
    }

    ResourceDefinitionContext toContext() {
        return new ResourceDefinitionContext.Builder()
                .withGroup(getGroup())
                .withVersion(getVersion())
                .withKind(kind)
                .withPlural(plural)
                .withNamespaced(namespaced)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceKind)) {
            return false;
        }
        ResourceKind that = (ResourceKind) o;
        return apiVersion.equals(that.apiVersion) && kind.equals(that.kind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(apiVersion, kind);
    }

    @Override
    public String toString() {
        return kind + "." + apiVersion;
    }
}
