package io.kubetest.namespace;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.kubetest.Environment;
import io.kubetest.KubeTestException;
import io.kubetest.TestUtils;
import io.kubetest.k8s.KubeClient;
import io.kubetest.k8s.ResourceKind;
import io.kubetest.resource.Readiness;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Creates an isolated namespace per test and reclaims it afterwards.
 */
public class NamespaceManager {
    private static final Logger LOGGER = LogManager.getLogger(NamespaceManager.class);

    public static final String MANAGED_LABEL = "kubetest/managed";
    public static final String TEST_NAME_ANNOTATION = "kubetest/test-name";

    private final KubeClient client;
    private final NamespaceNames names;
    private final Duration readyTimeout;
    private final Duration deletionGrace;
    private final boolean awaitDeletion;
    private final long pollIntervalMs;

    public NamespaceManager(KubeClient client) {
        this(client, new NamespaceNames(), Duration.ofMillis(Environment.NAMESPACE_READY_TIMEOUT_MS),
                Duration.ofMillis(Environment.NAMESPACE_DELETION_GRACE_MS), Environment.AWAIT_NAMESPACE_DELETION,
                Environment.WAIT_POLL_INTERVAL_MS);
    }

    public NamespaceManager(KubeClient client, NamespaceNames names, Duration readyTimeout, Duration deletionGrace,
                            boolean awaitDeletion, long pollIntervalMs) {
        this.client = client;
        this.names = names;
        this.readyTimeout = readyTimeout;
        this.deletionGrace = deletionGrace;
        this.awaitDeletion = awaitDeletion;
        this.pollIntervalMs = pollIntervalMs;
    }

    /**
     * Create a fresh namespace for {@code testName} and block until it is Active.
     *
     * @throws NamespaceCreationException when the namespace could not be created or did not become Active in time
     */
    public TestNamespace acquire(String testName) {
        return create(names.next(testName), testName);
    }

    /**
     * Create a namespace with a fixed name for {@code testName} and block until it is Active.
     *
     * @throws NamespaceCreationException when the namespace could not be created or did not become Active in time
     */
    public TestNamespace create(String name, String testName) {
        TestNamespace namespace = new TestNamespace(name, true, NamespacePhase.PENDING);
        Namespace spec = new NamespaceBuilder()
                .withNewMetadata()
                    .withName(name)
                    .addToLabels(MANAGED_LABEL, "true")
                    .addToAnnotations(TEST_NAME_ANNOTATION, testName == null ? "" : testName)
                .endMetadata()
                .build();
        LOGGER.info("Creating namespace {} for {}", name, testName);
        try {
            client.create(ResourceKind.NAMESPACE, null, KubeClient.toGeneric(spec));
        } catch (KubeTestException e) {
            names.forget(name);
            throw new NamespaceCreationException(String.format("Cannot create namespace %s: %s", name, e.getMessage()), e);
        }
        try {
            TestUtils.waitFor("namespace " + name + " to be Active", pollIntervalMs, readyTimeout.toMillis(),
                    () -> client.find(ResourceKind.NAMESPACE, null, name).map(Readiness.hasPhase("Active")::test).orElse(false));
        } catch (KubeTestException e) {
            LOGGER.warn("Namespace {} did not become Active, deleting it", name);
            release(namespace);
            throw new NamespaceCreationException(String.format("Namespace %s did not become Active within %d ms", name, readyTimeout.toMillis()), e);
        }
        namespace.advance(NamespacePhase.ACTIVE);
        return namespace;
    }

    /**
     * Run in an existing namespace, the harness will not delete it.
     */
    public TestNamespace use(String name) {
        LOGGER.info("Using existing namespace {}", name);
        if (!client.namespaceExists(name)) {
            throw new NamespaceCreationException(String.format("Namespace %s does not exist", name));
        }
        return new TestNamespace(name, false, NamespacePhase.ACTIVE);
    }

    /**
     * Request deletion of a managed namespace. Unless deletion is awaited the call returns right away and a background
     * check marks the namespace {@link NamespacePhase#GONE} or logs a warning when it still exists after the grace period.
     *
     * @return completes when the namespace is gone, fails when it outlived the grace period
     */
    public CompletableFuture<Void> release(TestNamespace namespace) {
        if (!namespace.isManaged()) {
            LOGGER.info("Namespace {} is not managed, leaving it in place", namespace.getName());
            return CompletableFuture.completedFuture(null);
        }
        if (!namespace.advance(NamespacePhase.TERMINATING)) {
            return CompletableFuture.completedFuture(null);
        }
        String name = namespace.getName();
        LOGGER.info("Deleting namespace {}", name);
        try {
            client.delete(ResourceKind.NAMESPACE, null, name);
        } catch (KubeTestException e) {
            LOGGER.warn("Deletion of namespace {} failed: {}", name, e.getMessage());
            CompletableFuture<Void> failed = new CompletableFuture<>();
            failed.completeExceptionally(e);
            return failed;
        }
        CompletableFuture<Void> gone = TestUtils.asyncWaitFor("deletion of namespace " + name, pollIntervalMs, deletionGrace.toMillis(),
                () -> !client.namespaceExists(name))
                .whenComplete((r, e) -> {
                    if (e == null) {
                        namespace.advance(NamespacePhase.GONE);
                        names.forget(name);
                        LOGGER.debug("Namespace {} is gone", name);
                    } else {
                        LOGGER.warn("Namespace {} still present {} ms after deletion: {}", name, deletionGrace.toMillis(), e.getMessage());
                    }
                });
        if (awaitDeletion) {
            try {
                gone.join();
            } catch (CompletionException e) {
                LOGGER.debug("Awaited deletion of namespace {} did not complete", name, e);
            }
        }
        return gone;
    }
}
