package io.kubetest.wait;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.kubetest.KubeTestException;
import io.kubetest.TestUtils;
import io.kubetest.k8s.KubeClient;
import io.kubetest.k8s.ResourceEvent;
import io.kubetest.k8s.ResourceEventStream;
import io.kubetest.k8s.ResourceNotFoundException;
import io.kubetest.resource.ResourceHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Waits for predicates over the state of a {@link ResourceHandle}.
 * <p>
 * Every wait is bounded by its timeout, which is itself clamped to the deadline of the owning test when one is set.
 * Each wait is tracked until it finishes so {@link #cancelAll()} can abort it from another thread.
 */
public class ConditionWaiter {
    private static final Logger LOGGER = LogManager.getLogger(ConditionWaiter.class);

    private final KubeClient client;
    private final ScheduledExecutorService scheduler;
    private final Executor workers;
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile Instant deadline;

    public ConditionWaiter(KubeClient client) {
        this(client, TestUtils.scheduler(), TestUtils.workers());
    }

    /**
     * @param scheduler timer of the poll ticks and the wait expiry, never blocked
     * @param workers runs the cluster reads of each tick
     */
    public ConditionWaiter(KubeClient client, ScheduledExecutorService scheduler, Executor workers) {
        this.client = client;
        this.scheduler = scheduler;
        this.workers = workers;
    }

    /**
     * Clamp all following waits to end no later than {@code deadline}, null removes the limit.
     */
    public void setDeadline(Instant deadline) {
        this.deadline = deadline;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public GenericKubernetesResource waitUntil(ResourceHandle handle, Predicate<GenericKubernetesResource> predicate) {
        return waitUntil(handle, predicate, WaitOptions.defaults());
    }

    /**
     * Poll the object until {@code predicate} holds.
     *
     * @return the state that satisfied the predicate, or the last observed state when the options ask for it on timeout
     * @throws ConditionTimeoutException when the predicate stayed false and the options say {@link OnTimeout#FAIL}
     * @throws WaitCancelledException when the wait was cancelled or the calling thread interrupted
     */
    public GenericKubernetesResource waitUntil(ResourceHandle handle, Predicate<GenericKubernetesResource> predicate, WaitOptions options) {
        return await(asyncWaitUntil(handle, predicate, options), handle);
    }

    public CompletableFuture<GenericKubernetesResource> asyncWaitUntil(ResourceHandle handle, Predicate<GenericKubernetesResource> predicate, WaitOptions options) {
        return poll("condition on " + handle, handle, predicate, false, options);
    }

    /**
     * Wait until the object no longer exists.
     */
    public void waitUntilGone(ResourceHandle handle, WaitOptions options) {
        await(poll("deletion of " + handle, handle, r -> false, true, options), handle);
    }

    public void waitUntilGone(ResourceHandle handle) {
        waitUntilGone(handle, WaitOptions.defaults());
    }

    /**
     * Like {@link #waitUntil(ResourceHandle, Predicate, WaitOptions)}, but the predicate is evaluated on every change
     * event of the object. When the event stream terminates before the condition holds the wait falls back to polling
     * for the rest of its budget.
     */
    public GenericKubernetesResource waitUntilWatched(ResourceHandle handle, Predicate<GenericKubernetesResource> predicate, WaitOptions options) {
        String description = "watched condition on " + handle;
        Duration timeout = clamp(options.getTimeout());
        long end = System.currentTimeMillis() + timeout.toMillis();
        CompletableFuture<Void> token = new CompletableFuture<>();
        inFlight.add(token);
        try (ResourceEventStream stream = client.watch(handle.getKind(), handle.getNamespace(), handle.getName(), null)) {
            token.whenComplete((r, e) -> stream.close());
            LOGGER.info("Waiting for {}", description);
            try {
                handle.refresh();
                if (handle.isReady(predicate)) {
                    return handle.getObserved();
                }
            } catch (ResourceNotFoundException e) {
                LOGGER.debug("{} does not exist yet", handle);
            }
            long timeLeft;
            while ((timeLeft = end - System.currentTimeMillis()) > 0) {
                ResourceEvent event;
                try {
                    event = stream.next(Math.min(options.getInterval().toMillis(), timeLeft));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new WaitCancelledException("Interrupted while waiting for " + description, e);
                } catch (KubeTestException e) {
                    LOGGER.warn("Event stream for {} failed, falling back to polling: {}", description, e.getMessage());
                    return waitUntil(handle, predicate, options.withTimeout(Duration.ofMillis(Math.max(0, end - System.currentTimeMillis()))));
                }
                if (token.isDone()) {
                    throw new WaitCancelledException("Wait for " + description + " was cancelled");
                }
                if (event != null && !event.isDeleted()) {
                    handle.update(event.getResource());
                    if (handle.isReady(predicate)) {
                        return handle.getObserved();
                    }
                } else if (event == null && stream.isTerminated()) {
                    LOGGER.warn("Event stream for {} ended, falling back to polling", description);
                    return waitUntil(handle, predicate, options.withTimeout(Duration.ofMillis(Math.max(0, end - System.currentTimeMillis()))));
                }
            }
            return timedOut(description, timeout, handle, options);
        } finally {
            inFlight.remove(token);
            token.complete(null);
        }
    }

    /**
     * Abort every wait in flight, blocked callers get {@link WaitCancelledException}.
     */
    public void cancelAll() {
        List<CompletableFuture<?>> waits = new ArrayList<>(inFlight);
        if (!waits.isEmpty()) {
            LOGGER.info("Cancelling {} waits in flight", waits.size());
        }
        waits.forEach(f -> f.completeExceptionally(new WaitCancelledException("Wait was cancelled")));
        inFlight.removeAll(waits);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private CompletableFuture<GenericKubernetesResource> poll(String description, ResourceHandle handle, Predicate<GenericKubernetesResource> predicate,
                                                             boolean untilGone, WaitOptions options) {
        Duration timeout = clamp(options.getTimeout());
        long pollIntervalMs = options.getInterval().toMillis();
        long end = System.currentTimeMillis() + timeout.toMillis();
        CompletableFuture<GenericKubernetesResource> future = new CompletableFuture<>();
        inFlight.add(future);
        future.whenComplete((r, e) -> inFlight.remove(future));
        LOGGER.info("Waiting for {} ({})", description, options);
        // a tick stuck in a slow read must not hold the caller past the timeout
        ScheduledFuture<?> expiry = scheduler.schedule(() -> {
            if (!future.isDone()) {
                try {
                    future.complete(timedOut(description, timeout, handle, options));
                } catch (ConditionTimeoutException e) {
                    future.completeExceptionally(e);
                }
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        future.whenComplete((r, e) -> expiry.cancel(false));
        Runnable tick = new Runnable() {
            @Override
            public void run() {
                if (future.isDone()) {
                    return;
                }
                boolean done;
                try {
                    handle.refresh();
                    done = !untilGone && handle.isReady(predicate);
                } catch (ResourceNotFoundException e) {
                    done = untilGone;
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                    return;
                }
                long timeLeft = end - System.currentTimeMillis();
                if (done) {
                    future.complete(handle.getObserved());
                } else if (timeLeft > 0) {
                    if (LOGGER.isTraceEnabled()) {
                        LOGGER.trace("{} not met, will try again ({}ms till timeout)", description, timeLeft);
                    }
                    TestUtils.runLater(scheduler, workers, this, Math.min(pollIntervalMs, timeLeft));
                } else {
                    try {
                        future.complete(timedOut(description, timeout, handle, options));
                    } catch (ConditionTimeoutException e) {
                        future.completeExceptionally(e);
                    }
                }
            }
        };
        workers.execute(tick);
        return future;
    }

    private static GenericKubernetesResource timedOut(String description, Duration timeout, ResourceHandle handle, WaitOptions options) {
        if (options.getOnTimeout() == OnTimeout.RETURN_LAST_STATE) {
            LOGGER.warn("Waiting for {} timed out after {} ms, returning last observed state", description, timeout.toMillis());
            return handle.getObserved();
        }
        throw new ConditionTimeoutException(description, timeout, handle.getObserved());
    }

    private Duration clamp(Duration timeout) {
        Instant limit = deadline;
        if (limit == null) {
            return timeout;
        }
        Duration left = Duration.between(Instant.now(), limit);
        if (left.isNegative()) {
            return Duration.ZERO;
        }
        return left.compareTo(timeout) < 0 ? left : timeout;
    }

    private static <T> T await(CompletableFuture<T> future, ResourceHandle handle) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.completeExceptionally(new WaitCancelledException("Interrupted"));
            Thread.currentThread().interrupt();
            throw new WaitCancelledException("Interrupted while waiting on " + handle, e);
        } catch (CancellationException e) {
            throw new WaitCancelledException("Wait on " + handle + " was cancelled", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new KubeTestException(e.getCause().getMessage(), e.getCause());
        }
    }
}
