package io.kubetest.namespace;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Namespace a single test runs in.
 */
public class TestNamespace {

    private final String name;
    private final boolean managed;
    private final AtomicReference<NamespacePhase> phase;

    public TestNamespace(String name, boolean managed, NamespacePhase phase) {
        this.name = name;
        this.managed = managed;
        this.phase = new AtomicReference<>(phase);
    }

    public String getName() {
        return name;
    }

    /**
     * @return false for a namespace the harness did not create, it is never deleted by the harness
     */
    public boolean isManaged() {
        return managed;
    }

    public NamespacePhase getPhase() {
        return phase.get();
    }

    /**
     * Move to {@code next} unless the namespace is already there or further.
     *
     * @return true if the phase changed
     */
    public boolean advance(NamespacePhase next) {
        NamespacePhase current;
        do {
            current = phase.get();
            if (current.compareTo(next) >= 0) {
                return false;
            }
        } while (!phase.compareAndSet(current, next));
        return true;
    }

    @Override
    public String toString() {
        return name + " (" + phase.get() + (managed ? "" : ", unmanaged") + ")";
    }
}
