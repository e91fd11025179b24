package io.kubetest.registry;

public enum RegistryState {
    OPEN,
    CLOSING,
    CLOSED
}
