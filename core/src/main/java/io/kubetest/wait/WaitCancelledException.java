package io.kubetest.wait;

import io.kubetest.KubeTestException;

/**
 * A wait was aborted before it finished, usually because the owning test ran out of time.
 */
public class WaitCancelledException extends KubeTestException {

    public WaitCancelledException(String message) {
        super(message);
    }

    public WaitCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
