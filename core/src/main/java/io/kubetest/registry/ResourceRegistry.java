package io.kubetest.registry;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.kubetest.k8s.KubeClient;
import io.kubetest.k8s.ResourceKind;
import io.kubetest.namespace.TestNamespace;
import io.kubetest.resource.ResourceHandle;
import io.kubetest.resource.Readiness;
import io.kubetest.wait.ConditionWaiter;
import io.kubetest.wait.WaitOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Tracks every object created on behalf of one test and deletes them, newest first, when the test is over.
 */
public class ResourceRegistry {
    private static final Logger LOGGER = LogManager.getLogger(ResourceRegistry.class);

    private final String owner;
    private final KubeClient client;
    private final TestNamespace namespace;
    private final ConditionWaiter waiter;
    private final List<ResourceHandle> handles = new ArrayList<>();
    private final Set<ResourceHandle.Key> deleted = ConcurrentHashMap.newKeySet();
    private final AtomicReference<RegistryState> state = new AtomicReference<>(RegistryState.OPEN);

    public ResourceRegistry(String owner, KubeClient client, TestNamespace namespace, ConditionWaiter waiter) {
        this.owner = owner;
        this.client = client;
        this.namespace = namespace;
        this.waiter = waiter;
    }

    public ResourceHandle create(HasMetadata spec) {
        return create(ResourceKind.of(spec), KubeClient.toGeneric(spec));
    }

    /**
     * Create an object and start tracking it, namespaced kinds without an explicit namespace go to the test namespace.
     * The call does not wait for the object to become ready.
     *
     * @throws RegistryClosedException if teardown has already begun
     * @throws IllegalStateException if an object with the same identity was deleted through this registry
     */
    public ResourceHandle create(ResourceKind kind, GenericKubernetesResource spec) {
        checkOpen();
        String explicit = spec.getMetadata() == null ? null : spec.getMetadata().getNamespace();
        String target = kind.isNamespaced() ? (explicit == null ? namespace.getName() : explicit) : null;
        String name = spec.getMetadata() == null ? null : spec.getMetadata().getName();
        if (name != null && deleted.contains(new ResourceHandle.Key(kind, target, name))) {
            throw new IllegalStateException(String.format("%s %s was deleted by %s and cannot be created again", kind.getKind(), name, owner));
        }
        LOGGER.info("Create of {} {} in namespace {}", kind.getKind(), name, target == null ? "(not set)" : target);
        GenericKubernetesResource created = client.create(kind, target, spec);
        ResourceHandle handle = new ResourceHandle(client, kind, target, spec, created);
        synchronized (handles) {
            handles.add(handle);
        }
        return handle;
    }

    /**
     * Create objects in the given order.
     */
    public List<ResourceHandle> createAll(List<? extends HasMetadata> specs) {
        List<ResourceHandle> result = new ArrayList<>();
        for (HasMetadata spec : specs) {
            result.add(create(spec));
        }
        return result;
    }

    /**
     * Delete a tracked object before teardown, teardown skips it afterwards.
     * An object whose deletion failed stays tracked and is deleted again at teardown.
     */
    public void delete(ResourceHandle handle) {
        LOGGER.info("Delete of {} {} in namespace {}", handle.getKind().getKind(), handle.getName(),
                handle.getNamespace() == null ? "(not set)" : handle.getNamespace());
        client.delete(handle.getKind(), handle.getNamespace(), handle.getName());
        handle.markDeletionRequested();
        deleted.add(handle.key());
    }

    public GenericKubernetesResource waitUntil(ResourceHandle handle, Predicate<GenericKubernetesResource> predicate) {
        return waiter.waitUntil(handle, predicate);
    }

    public GenericKubernetesResource waitUntil(ResourceHandle handle, Predicate<GenericKubernetesResource> predicate, WaitOptions options) {
        return waiter.waitUntil(handle, predicate, options);
    }

    public GenericKubernetesResource waitUntilReady(ResourceHandle handle) {
        return waitUntilReady(handle, WaitOptions.defaults());
    }

    public GenericKubernetesResource waitUntilReady(ResourceHandle handle, WaitOptions options) {
        return waiter.waitUntil(handle, Readiness.forKind(handle.getKind()), options);
    }

    /**
     * Wait until every tracked object exists.
     */
    public void waitUntilCreated() {
        for (ResourceHandle handle : live()) {
            waiter.waitUntil(handle, Readiness.exists());
        }
    }

    /**
     * Wait until every tracked object satisfies the default readiness of its kind.
     */
    public void waitUntilAllReady() {
        for (ResourceHandle handle : live()) {
            waitUntilReady(handle);
        }
    }

    public List<ResourceHandle> handles() {
        synchronized (handles) {
            return new ArrayList<>(handles);
        }
    }

    public Optional<ResourceHandle> find(ResourceKind kind, String name) {
        return handles().stream()
                .filter(h -> h.getKind().equals(kind) && h.getName().equals(name))
                .findFirst();
    }

    public RegistryState state() {
        return state.get();
    }

    public String getOwner() {
        return owner;
    }

    public TestNamespace getNamespace() {
        return namespace;
    }

    public ConditionWaiter getWaiter() {
        return waiter;
    }

    /**
     * Limit all waits of this registry to end before {@code deadline}.
     */
    public void setDeadline(Instant deadline) {
        waiter.setDeadline(deadline);
    }

    public void cancelWaits() {
        waiter.cancelAll();
    }

    /**
     * Delete every tracked object in reverse creation order. Failures are logged and collected, never thrown.
     * Calling it again returns an empty report.
     */
    public TeardownReport teardown() {
        TeardownReport report = new TeardownReport(owner);
        if (!state.compareAndSet(RegistryState.OPEN, RegistryState.CLOSING)) {
            LOGGER.debug("Registry of {} is already {}", owner, state.get());
            return report;
        }
        waiter.cancelAll();
        List<ResourceHandle> tracked = handles();
        LOGGER.info("----------------------------------------------");
        LOGGER.info("Going to clear all resources for {}", owner);
        LOGGER.info("----------------------------------------------");
        if (tracked.isEmpty()) {
            LOGGER.info("Nothing to delete");
        }
        for (int i = tracked.size() - 1; i >= 0; i--) {
            ResourceHandle handle = tracked.get(i);
            if (handle.isDeletionRequested()) {
                continue;
            }
            try {
                delete(handle);
                report.deleted(handle);
            } catch (Exception e) {
                LOGGER.warn("Failed to delete {}, it may be leaked: {}", handle, e.getMessage());
                report.failed(handle, e);
            }
        }
        state.set(RegistryState.CLOSED);
        LOGGER.info(report.summary());
        return report;
    }

    private List<ResourceHandle> live() {
        List<ResourceHandle> result = handles();
        result.removeIf(ResourceHandle::isDeletionRequested);
        return result;
    }

    private void checkOpen() {
        RegistryState current = state.get();
        if (current != RegistryState.OPEN) {
            throw new RegistryClosedException(owner, current);
        }
    }
}
