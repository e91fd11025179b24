package io.kubetest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Test utils contains static help methods
 */
public class TestUtils {
    private static final Logger LOGGER = LogManager.getLogger(TestUtils.class);

    private static final ScheduledExecutorService SCHEDULER = Executors.newScheduledThreadPool(1, daemonThreadFactory("kubetest-timer"));
    private static final ExecutorService WORKERS = Executors.newCachedThreadPool(daemonThreadFactory("kubetest-wait"));

    private TestUtils() {
    }

    /**
     * @return thread factory producing named daemon threads, background work must never keep the JVM alive
     */
    public static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory defaultThreadFactory = Executors.defaultThreadFactory();
        return r -> {
            Thread result = defaultThreadFactory.newThread(r);
            result.setName(prefix + "-" + counter.incrementAndGet());
            result.setDaemon(true);
            return result;
        };
    }

    /**
     * Shared timer. Tasks run on it must not block, use {@link #runLater(Runnable, long)} for cluster calls.
     */
    public static ScheduledExecutorService scheduler() {
        return SCHEDULER;
    }

    /**
     * Pool running the blocking part of poll loops.
     */
    public static ExecutorService workers() {
        return WORKERS;
    }

    /**
     * Run {@code task} on the worker pool once {@code delayMs} elapsed.
     */
    public static void runLater(Runnable task, long delayMs) {
        runLater(SCHEDULER, WORKERS, task, delayMs);
    }

    public static void runLater(ScheduledExecutorService scheduler, Executor workers, Runnable task, long delayMs) {
        scheduler.schedule(() -> workers.execute(task), delayMs, TimeUnit.MILLISECONDS);
    }

    public static void waitFor(String description, long pollIntervalMs, long timeoutMs, BooleanSupplier ready) {
        try {
            asyncWaitFor(description, pollIntervalMs, timeoutMs, ready).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KubeTestException("Interrupted while waiting for " + description, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new KubeTestException(e.getCause().getMessage(), e.getCause());
        }
    }

    /**
     * Polls {@code ready} until it returns true. The returned future fails with {@link TimeoutException}
     * once {@code timeoutMs} elapsed, cancelling the future stops the polling.
     */
    public static CompletableFuture<Void> asyncWaitFor(String description, long pollIntervalMs, long timeoutMs, BooleanSupplier ready) {
        LOGGER.info("Waiting for {}", description);
        long deadline = System.currentTimeMillis() + timeoutMs;
        CompletableFuture<Void> future = new CompletableFuture<>();
        Runnable r = new Runnable() {
            @Override
            public void run() {
                if (future.isDone()) {
                    return;
                }
                boolean result;
                try {
                    result = ready.getAsBoolean();
                } catch (Exception e) {
                    future.completeExceptionally(e);
                    return;
                }
                long timeLeft = deadline - System.currentTimeMillis();
                if (result) {
                    future.complete(null);
                } else if (timeLeft > 0) {
                    if (LOGGER.isTraceEnabled()) {
                        LOGGER.trace("{} not ready, will try again ({}ms till timeout)", description, timeLeft);
                    }
                    runLater(this, Math.min(pollIntervalMs, timeLeft));
                } else {
                    future.completeExceptionally(new TimeoutException(String.format("Waiting for %s timeout %s exceeded", description, timeoutMs)));
                }
            }
        };
        WORKERS.execute(r);
        return future;
    }

    public static Path getLogPath(String folderName, String testClassName, String testMethod) {
        Path path = Environment.LOG_DIR.resolve(Paths.get(folderName, testClassName));
        if (testMethod != null) {
            path = path.resolve(testMethod.replace("(", "").replace(")", ""));
        }
        return path;
    }

    public static void logWithSeparator(String pattern, String text) {
        LOGGER.info("=======================================================================");
        LOGGER.info(pattern, text);
        LOGGER.info("=======================================================================");
    }
}
