package io.kubetest.k8s;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import io.kubetest.KubeTestException;
import io.kubetest.TestUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

/**
 * Unbounded sequence of change events of a watched kind.
 * <p>
 * The underlying watch is opened on the first {@link #next(long)} call. When the server closes it, the watch is
 * re-opened from the last seen resourceVersion until the back-off is exhausted. An HTTP 410 (resourceVersion too old)
 * terminates the stream with {@link WatchExpiredException}. {@link #close()} cancels it.
 */
public class ResourceEventStream implements Closeable {
    private static final Logger LOGGER = LogManager.getLogger(ResourceEventStream.class);

    private static final ResourceEvent END = new ResourceEvent(null, null);

    private final String description;
    private final BiFunction<String, Watcher<GenericKubernetesResource>, Watch> opener;
    private final BackOff backOff;
    private final BlockingQueue<ResourceEvent> events = new LinkedBlockingQueue<>();

    private volatile String resourceVersion;
    private volatile Watch watch;
    private volatile boolean closed;
    private volatile KubeTestException failure;
    private boolean started;

    /**
     * @param opener opens a watch from the given resourceVersion (null for "now") delivering to the given watcher
     */
    public ResourceEventStream(String description, String resourceVersion, BackOff backOff,
                               BiFunction<String, Watcher<GenericKubernetesResource>, Watch> opener) {
        this.description = description;
        this.resourceVersion = resourceVersion;
        this.backOff = backOff;
        this.opener = opener;
    }

    /**
     * Next event, waiting at most {@code timeoutMs}.
     *
     * @return the event or null when none arrived in time or the stream was closed
     * @throws WatchExpiredException when the stream can not be resumed
     * @throws KubeApiException when re-opening the watch failed too many times
     */
    public ResourceEvent next(long timeoutMs) throws InterruptedException {
        start();
        ResourceEvent event = events.poll(timeoutMs, TimeUnit.MILLISECONDS);
        if (event == END) {
            events.offer(END);
            if (failure != null) {
                throw failure;
            }
            return null;
        }
        return event;
    }

    public boolean isTerminated() {
        return closed || failure != null;
    }

    /**
     * @return resourceVersion of the last delivered event
     */
    public String getResourceVersion() {
        return resourceVersion;
    }

    private synchronized void start() {
        if (!started && !isTerminated()) {
            started = true;
            open();
        }
    }

    private synchronized void open() {
        if (isTerminated()) {
            return;
        }
        LOGGER.debug("Opening watch of {} from resourceVersion {}", description, resourceVersion);
        try {
            watch = opener.apply(resourceVersion, new StreamWatcher());
        } catch (KubeTestException e) {
            terminate(e);
        }
    }

    private synchronized void restart(WatcherException cause) {
        if (isTerminated()) {
            return;
        }
        if (cause != null && cause.isHttpGone()) {
            terminate(new WatchExpiredException(String.format("Watch of %s expired at resourceVersion %s", description, resourceVersion), cause));
            return;
        }
        if (backOff.done()) {
            terminate(new KubeApiException(String.format("Watch of %s closed and could not be re-opened", description),
                    cause == null ? 0 : cause.asClientException().getCode(), cause));
            return;
        }
        long delay = backOff.delayMs();
        LOGGER.info("Watch of {} closed, re-opening in {} ms", description, delay);
        TestUtils.runLater(this::open, delay);
    }

    private void terminate(KubeTestException cause) {
        LOGGER.warn("Watch of {} terminated: {}", description, cause.getMessage());
        failure = cause;
        events.offer(END);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (watch != null) {
            watch.close();
        }
        events.offer(END);
    }

    private class StreamWatcher implements Watcher<GenericKubernetesResource> {

        @Override
        public void eventReceived(Action action, GenericKubernetesResource resource) {
            if (resource != null && resource.getMetadata() != null && resource.getMetadata().getResourceVersion() != null) {
                resourceVersion = resource.getMetadata().getResourceVersion();
            }
            if (action == Action.BOOKMARK || action == Action.ERROR) {
                LOGGER.debug("Skipping {} event of {}", action, description);
                return;
            }
            events.offer(new ResourceEvent(action, resource));
        }

        @Override
        public void onClose() {
            restart(null);
        }

        @Override
        public void onClose(WatcherException cause) {
            restart(cause);
        }
    }
}
