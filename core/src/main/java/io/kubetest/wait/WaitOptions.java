package io.kubetest.wait;

import io.kubetest.Environment;

import java.time.Duration;
import java.util.Objects;

/**
 * Interval, timeout and timeout behaviour of a single wait.
 */
public final class WaitOptions {

    private final Duration interval;
    private final Duration timeout;
    private final OnTimeout onTimeout;

    private WaitOptions(Duration interval, Duration timeout, OnTimeout onTimeout) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Wait interval must be positive, was " + interval);
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Wait timeout must not be negative, was " + timeout);
        }
        this.interval = interval;
        this.timeout = timeout;
        this.onTimeout = Objects.requireNonNull(onTimeout, "onTimeout");
    }

    /**
     * Options configured through {@link Environment#WAIT_POLL_INTERVAL_MS} and {@link Environment#WAIT_TIMEOUT_MS}.
     */
    public static WaitOptions defaults() {
        return new WaitOptions(Duration.ofMillis(Environment.WAIT_POLL_INTERVAL_MS), Duration.ofMillis(Environment.WAIT_TIMEOUT_MS), OnTimeout.FAIL);
    }

    public static WaitOptions of(Duration interval, Duration timeout) {
        return new WaitOptions(interval, timeout, OnTimeout.FAIL);
    }

    public WaitOptions withInterval(Duration interval) {
        return new WaitOptions(interval, timeout, onTimeout);
    }

    public WaitOptions withTimeout(Duration timeout) {
        return new WaitOptions(interval, timeout, onTimeout);
    }

    public WaitOptions withOnTimeout(OnTimeout onTimeout) {
        return new WaitOptions(interval, timeout, onTimeout);
    }

    public Duration getInterval() {
        return interval;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public OnTimeout getOnTimeout() {
        return onTimeout;
    }

    @Override
    public String toString() {
        return String.format("interval %d ms, timeout %d ms, on timeout %s", interval.toMillis(), timeout.toMillis(), onTimeout);
    }
}
