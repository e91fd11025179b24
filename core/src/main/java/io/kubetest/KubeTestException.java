package io.kubetest;

/**
 * Base of every failure raised by the harness.
 */
public class KubeTestException extends RuntimeException {

    public KubeTestException(String message) {
        super(message);
    }

    public KubeTestException(String message, Throwable cause) {
        super(message, cause);
    }
}
