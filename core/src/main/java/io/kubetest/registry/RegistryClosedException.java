package io.kubetest.registry;

import io.kubetest.KubeTestException;

/**
 * Raised when a resource is created after teardown of its registry has begun.
 */
public class RegistryClosedException extends KubeTestException {

    public RegistryClosedException(String owner, RegistryState state) {
        super(String.format("Registry of %s is %s, no more resources can be created", owner, state));
    }
}
