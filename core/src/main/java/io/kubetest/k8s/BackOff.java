package io.kubetest.k8s;

import io.kubetest.Environment;

/**
 * <p>Computes delays for an exponential back-off, when a cluster call has to be retried.
 * The {@link #delayMs()} method returns an increasing delay to be used between attempts.</p>
 * <pre>{@literal
 *     |<-attempt->    |<-attempt->        |<-attempt->|*fail*
 *     |<-- delayMs -->|<---- delayMs ---->|           |}</pre>
 * <p>The delay before the 0th attempt is always 0ms, the remaining delays are</p>
 * <pre>  delayMs(n) = scaleMs * base ^ (n - 1)</pre>
 * <p>An instance is stateful, create one per retried operation.</p>
 */
public class BackOff {

    private static final int DEFAULT_BASE = 2;

    private final long scaleMs;
    private final int base;
    private final int maxAttempts;
    private int attempt = 0;

    /**
     * Delays of {@code API_RETRY_SCALE_MS * 2^n} for {@code API_RETRY_ATTEMPTS} attempts.
     */
    public BackOff() {
        this(Environment.API_RETRY_SCALE_MS, DEFAULT_BASE, Environment.API_RETRY_ATTEMPTS);
    }

    public BackOff(long scaleMs, int base, int maxAttempts) {
        if (scaleMs < 0) {
            throw new IllegalArgumentException("scaleMs must not be negative");
        }
        if (base <= 0) {
            throw new IllegalArgumentException("base must be positive");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.scaleMs = scaleMs;
        this.base = base;
        this.maxAttempts = maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Return the next delay to use, in milliseconds.
     * @throws MaxAttemptsExceededException if the next attempt would exceed the configured number of attempts.
     */
    public long delayMs() {
        if (attempt == maxAttempts) {
            throw new MaxAttemptsExceededException();
        }
        return delay(attempt++);
    }

    /**
     * @return whether the next call to {@link #delayMs()} will throw MaxAttemptsExceededException.
     */
    public boolean done() {
        return attempt >= maxAttempts;
    }

    private long delay(int n) {
        if (n == 0) {
            return 0L;
        }
        long pow = 1;
        while (n-- > 1) {
            pow *= base;
        }
        return scaleMs * pow;
    }

    /**
     * The total possible delay for this BackOff.
     */
    public long totalDelayMs() {
        long total = 0;
        for (int i = 0; i < maxAttempts; i++) {
            total += delay(i);
        }
        return total;
    }
}
