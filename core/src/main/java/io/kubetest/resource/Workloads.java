package io.kubetest.resource;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.kubetest.k8s.KubeClient;
import io.kubetest.k8s.ResourceKind;
import io.kubetest.k8s.Selectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Helpers for workload kinds (Deployment, StatefulSet, DaemonSet, ReplicaSet, Job).
 */
public final class Workloads {
    private static final Logger LOGGER = LogManager.getLogger(Workloads.class);

    private Workloads() {
    }

    /**
     * Pods belonging to a workload: candidates are selected with the workload {@code spec.selector}
     * and kept only when their owner references lead back to the workload, directly or through a ReplicaSet or Job.
     */
    public static List<GenericKubernetesResource> ownedPods(KubeClient client, ResourceHandle workload) {
        LOGGER.info("Getting pods for {} {}", workload.getKind().getKind(), workload.getName());
        String workloadUid = workload.getUid();
        if (workloadUid == null) {
            workload.refresh();
            workloadUid = workload.getUid();
        }
        String selector = Selectors.selectorString(selector(workload.getObserved()));
        if (selector == null) {
            LOGGER.debug("No selector found for {}", workload.getName());
        }
        List<GenericKubernetesResource> pods = client.list(ResourceKind.POD, workload.getNamespace(), selector);

        Map<String, List<OwnerReference>> owners = new HashMap<>();
        owners.putAll(ownerMap(client.list(ResourceKind.REPLICA_SET, workload.getNamespace(), (String) null)));
        owners.putAll(ownerMap(client.list(ResourceKind.JOB, workload.getNamespace(), (String) null)));

        String uid = workloadUid;
        List<GenericKubernetesResource> owned = pods.stream()
                .filter(pod -> ownerReferences(pod).stream().anyMatch(ref -> isOwnedBy(ref.getUid(), uid, owners, new HashSet<>())))
                .collect(Collectors.toList());
        LOGGER.debug("Owned pods: {}", owned.stream().map(p -> p.getMetadata().getName()).collect(Collectors.toList()));
        return owned;
    }

    static LabelSelector selector(GenericKubernetesResource workload) {
        Object selector = Readiness.field(workload, "spec", "selector");
        if (!(selector instanceof Map)) {
            return null;
        }
        return KubeClient.convert(selector, LabelSelector.class);
    }

    private static Map<String, List<OwnerReference>> ownerMap(List<GenericKubernetesResource> items) {
        Map<String, List<OwnerReference>> result = new HashMap<>();
        for (GenericKubernetesResource item : items) {
            if (item.getMetadata() != null && item.getMetadata().getUid() != null) {
                result.put(item.getMetadata().getUid(), ownerReferences(item));
            }
        }
        return result;
    }

    private static List<OwnerReference> ownerReferences(GenericKubernetesResource item) {
        if (item.getMetadata() == null || item.getMetadata().getOwnerReferences() == null) {
            return Collections.emptyList();
        }
        return item.getMetadata().getOwnerReferences();
    }

    private static boolean isOwnedBy(String uid, String workloadUid, Map<String, List<OwnerReference>> owners, Set<String> visited) {
        if (uid == null || !visited.add(uid)) {
            return false;
        }
        if (uid.equals(workloadUid)) {
            return true;
        }
        for (OwnerReference ref : owners.getOrDefault(uid, Collections.emptyList())) {
            if (isOwnedBy(ref.getUid(), workloadUid, owners, visited)) {
                return true;
            }
        }
        return false;
    }
}
