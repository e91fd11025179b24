package io.kubetest.namespace;

import io.kubetest.KubeTestException;

public class NamespaceCreationException extends KubeTestException {

    public NamespaceCreationException(String message) {
        super(message);
    }

    public NamespaceCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
