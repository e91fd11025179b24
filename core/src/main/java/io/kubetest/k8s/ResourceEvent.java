package io.kubetest.k8s;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.Watcher;

/**
 * One change delivered by a {@link ResourceEventStream}.
 */
public class ResourceEvent {

    private final Watcher.Action action;
    private final GenericKubernetesResource resource;

    public ResourceEvent(Watcher.Action action, GenericKubernetesResource resource) {
        this.action = action;
        this.resource = resource;
    }

    public Watcher.Action getAction() {
        return action;
    }

    public GenericKubernetesResource getResource() {
        return resource;
    }

    public boolean isDeleted() {
        return action == Watcher.Action.DELETED;
    }

    @Override
    public String toString() {
        return action + " " + (resource == null || resource.getMetadata() == null ? "<unknown>" : resource.getMetadata().getName());
    }
}
