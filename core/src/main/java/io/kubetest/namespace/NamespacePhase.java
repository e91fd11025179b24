package io.kubetest.namespace;

/**
 * Lifecycle of a test namespace as seen by the harness, phases only ever move forward.
 */
public enum NamespacePhase {
    PENDING,
    ACTIVE,
    TERMINATING,
    GONE;

    public boolean isTerminal() {
        return this == GONE;
    }
}
