package io.kubetest.k8s;

import io.kubetest.KubeTestException;

/**
 * The watch can not be resumed, the API server no longer has the requested resourceVersion.
 */
public class WatchExpiredException extends KubeTestException {

    public WatchExpiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
