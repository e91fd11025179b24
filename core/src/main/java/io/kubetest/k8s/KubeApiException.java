package io.kubetest.k8s;

import io.kubetest.KubeTestException;

/**
 * Transport or protocol failure talking to the cluster API.
 */
public class KubeApiException extends KubeTestException {

    private final int code;

    public KubeApiException(String message, int code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public KubeApiException(String message, int code) {
        super(message);
        this.code = code;
    }

    /**
     * @return HTTP status returned by the API server, 0 when no response was received
     */
    public int getCode() {
        return code;
    }

    public boolean isTransient() {
        return KubeClient.isTransient(code);
    }
}
