package io.kubetest.k8s;

import io.kubetest.KubeTestException;

/**
 * Thrown by {@link BackOff#delayMs()} when no attempt is left.
 */
public class MaxAttemptsExceededException extends KubeTestException {

    public MaxAttemptsExceededException() {
        super("Maximum number of attempts exceeded");
    }
}
