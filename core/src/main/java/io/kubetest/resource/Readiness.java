package io.kubetest.resource;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.kubetest.k8s.KubeClient;
import io.kubetest.k8s.ResourceKind;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Readiness predicates evaluated over generic documents, so any kind can be waited on without a model class.
 */
public final class Readiness {

    private Readiness() {
    }

    /**
     * Default readiness of a kind, kinds without a notion of readiness are ready once they exist.
     */
    public static Predicate<GenericKubernetesResource> forKind(ResourceKind kind) {
        switch (kind.getKind()) {
            case "Pod":
                return Readiness::isPodReady;
            case "Deployment":
                return r -> replicasReady(r, "availableReplicas") && replicasReady(r, "updatedReplicas");
            case "StatefulSet":
            case "ReplicaSet":
                return r -> replicasReady(r, "readyReplicas");
            case "DaemonSet":
                return Readiness::isDaemonSetReady;
            case "Job":
                return r -> hasCondition("Complete", "True").test(r) || number(r, "status", "succeeded") > 0;
            case "PersistentVolumeClaim":
                return hasPhase("Bound");
            case "Namespace":
                return hasPhase("Active");
            default:
                return exists();
        }
    }

    public static Predicate<GenericKubernetesResource> exists() {
        return Objects::nonNull;
    }

    /**
     * {@code status.phase} equals the given value.
     */
    public static Predicate<GenericKubernetesResource> hasPhase(String phase) {
        return r -> phase.equals(field(r, "status", "phase"));
    }

    /**
     * {@code status.conditions} holds a condition of the given type with the given status.
     */
    public static Predicate<GenericKubernetesResource> hasCondition(String type, String status) {
        return r -> {
            Object conditions = field(r, "status", "conditions");
            if (!(conditions instanceof List)) {
                return false;
            }
            for (Object condition : (List<?>) conditions) {
                if (condition instanceof Map) {
                    Map<?, ?> c = (Map<?, ?>) condition;
                    if (type.equals(c.get("type")) && status.equals(String.valueOf(c.get("status")))) {
                        return true;
                    }
                }
            }
            return false;
        };
    }

    /**
     * A load balancer address was assigned, {@code status.loadBalancer.ingress} is not empty. Applies to Ingresses
     * and Services of type LoadBalancer.
     */
    public static Predicate<GenericKubernetesResource> hasLoadBalancerIngress() {
        return r -> {
            Object ingress = field(r, "status", "loadBalancer", "ingress");
            return ingress instanceof List && !((List<?>) ingress).isEmpty();
        };
    }

    /**
     * Field at {@code path} has the given value, compared by string form so numbers and booleans match too.
     */
    public static Predicate<GenericKubernetesResource> fieldEquals(Object expected, String... path) {
        return r -> {
            Object actual = field(r, path);
            return actual != null && String.valueOf(expected).equals(String.valueOf(actual));
        };
    }

    /**
     * Navigate the document, {@code metadata} is resolved as well.
     *
     * @return value at path or null when any step is missing
     */
    public static Object field(GenericKubernetesResource resource, String... path) {
        if (resource == null || path.length == 0) {
            return null;
        }
        Object current;
        int start;
        if ("metadata".equals(path[0])) {
            current = resource.getMetadata() == null ? null : KubeClient.convert(resource.getMetadata(), Map.class);
            start = 1;
        } else {
            current = resource.getAdditionalProperties();
            start = 0;
        }
        for (int i = start; i < path.length && current != null; i++) {
            current = current instanceof Map ? ((Map<?, ?>) current).get(path[i]) : null;
        }
        return current;
    }

    static long number(GenericKubernetesResource resource, String... path) {
        Object value = field(resource, path);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    private static boolean replicasReady(GenericKubernetesResource resource, String statusField) {
        Object desired = field(resource, "spec", "replicas");
        long wanted = desired == null ? 1 : number(resource, "spec", "replicas");
        return number(resource, "status", statusField) >= wanted;
    }

    private static boolean isDaemonSetReady(GenericKubernetesResource resource) {
        if (field(resource, "status", "desiredNumberScheduled") == null) {
            return false;
        }
        return number(resource, "status", "numberReady") >= number(resource, "status", "desiredNumberScheduled");
    }

    private static boolean isPodReady(GenericKubernetesResource resource) {
        return hasPhase("Succeeded").test(resource) || hasCondition("Ready", "True").test(resource);
    }
}
