package io.kubetest.wait;

/**
 * What a wait does when its condition did not become true in time.
 */
public enum OnTimeout {
    /**
     * Raise {@link ConditionTimeoutException}.
     */
    FAIL,
    /**
     * Return the last observed state and let the caller decide.
     */
    RETURN_LAST_STATE
}
