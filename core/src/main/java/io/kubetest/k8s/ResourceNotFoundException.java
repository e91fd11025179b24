package io.kubetest.k8s;

import io.kubetest.KubeTestException;

public class ResourceNotFoundException extends KubeTestException {

    public ResourceNotFoundException(ResourceKind kind, String namespace, String name) {
        super(String.format("%s %s not found in namespace %s", kind.getKind(), name, namespace == null ? "(not set)" : namespace));
    }
}
