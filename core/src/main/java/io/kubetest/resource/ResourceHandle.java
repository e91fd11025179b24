package io.kubetest.resource;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.kubetest.k8s.KubeClient;
import io.kubetest.k8s.ResourceKind;
import io.kubetest.k8s.ResourceNotFoundException;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * One cluster object created by a test.
 * <p>
 * The observed state is a cache refreshed only by {@link #refresh()} (or by a wait delivering a newer state),
 * {@link #isReady(Predicate)} never goes to the cluster.
 */
public class ResourceHandle {

    private final KubeClient client;
    private final ResourceKind kind;
    private final String namespace;
    private final String name;
    private final GenericKubernetesResource desired;
    private final Instant creationTimestamp;
    private volatile GenericKubernetesResource observed;
    private volatile boolean deletionRequested;

    public ResourceHandle(KubeClient client, ResourceKind kind, String namespace, GenericKubernetesResource desired, GenericKubernetesResource created) {
        this.client = client;
        this.kind = kind;
        this.namespace = kind.isNamespaced() ? namespace : null;
        this.name = created.getMetadata().getName();
        this.desired = desired;
        this.observed = created;
        this.creationTimestamp = Instant.now();
    }

    /**
     * Re-read the live object.
     *
     * @throws ResourceNotFoundException if the object no longer exists
     */
    public ResourceHandle refresh() {
        observed = client.get(kind, namespace, name);
        return this;
    }

    /**
     * Store a state delivered by other means than {@link #refresh()}, e.g. a watch event.
     */
    public void update(GenericKubernetesResource state) {
        if (state != null) {
            String stateName = state.getMetadata() == null ? null : state.getMetadata().getName();
            if (!name.equals(stateName)) {
                throw new IllegalArgumentException(String.format("State of %s does not belong to %s", stateName, name));
            }
        }
        observed = state;
    }

    /**
     * Evaluate a predicate over the last refreshed state.
     */
    public boolean isReady(Predicate<GenericKubernetesResource> predicate) {
        GenericKubernetesResource state = observed;
        return state != null && predicate.test(state);
    }

    /**
     * Evaluate the default readiness of this kind over the last refreshed state.
     */
    public boolean isReady() {
        return isReady(Readiness.forKind(kind));
    }

    public ResourceKind getKind() {
        return kind;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    public GenericKubernetesResource getDesired() {
        return desired;
    }

    public GenericKubernetesResource getObserved() {
        return observed;
    }

    /**
     * @return uid assigned by the API server, null if it was never reported
     */
    public String getUid() {
        GenericKubernetesResource state = observed;
        return state == null || state.getMetadata() == null ? null : state.getMetadata().getUid();
    }

    public String getResourceVersion() {
        GenericKubernetesResource state = observed;
        return state == null || state.getMetadata() == null ? null : state.getMetadata().getResourceVersion();
    }

    public Instant getCreationTimestamp() {
        return creationTimestamp;
    }

    public boolean isDeletionRequested() {
        return deletionRequested;
    }

    public void markDeletionRequested() {
        this.deletionRequested = true;
    }

    public Key key() {
        return new Key(kind, namespace, name);
    }

    @Override
    public String toString() {
        return key().toString();
    }

    /**
     * Identity of a live object.
     */
    public static final class Key {
        private final ResourceKind kind;
        private final String namespace;
        private final String name;

        public Key(ResourceKind kind, String namespace, String name) {
            this.kind = kind;
            this.namespace = namespace;
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Key)) {
                return false;
            }
            Key key = (Key) o;
            return kind.equals(key.kind) && Objects.equals(namespace, key.namespace) && name.equals(key.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, namespace, name);
        }

        @Override
        public String toString() {
            return namespace == null ? String.format("%s/%s", kind.getKind(), name) : String.format("%s/%s/%s", kind.getKind(), namespace, name);
        }
    }
}
