package io.kubetest.k8s;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ListOptions;
import io.fabric8.kubernetes.api.model.ListOptionsBuilder;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.VersionInfo;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.utils.KubernetesSerialization;
import io.kubetest.Environment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Abstraction over the fabric8 client addressing every object by kind, namespace and name.
 * <p>
 * Transient failures (no response, 429, 5xx) are retried with an exponential {@link BackOff},
 * any other failure is surfaced immediately as {@link KubeApiException}.
 * Instances hold no per-test state and may be shared between concurrently running tests.
 */
public class KubeClient implements Closeable {
    private static final Logger LOGGER = LogManager.getLogger(KubeClient.class);

    private static final KubernetesSerialization SERIALIZATION = new KubernetesSerialization();

    private static KubeClient instance;

    private final KubernetesClient client;
    private final Supplier<BackOff> backOffs;

    public KubeClient(KubernetesClient client) {
        this(client, BackOff::new);
    }

    public KubeClient(KubernetesClient client, Supplier<BackOff> backOffs) {
        this.client = client;
        this.backOffs = backOffs;
    }

    /**
     * Return singleton of kube client connected with {@link Environment#KUBE_CONFIG}
     */
    public static synchronized KubeClient getInstance() {
        if (instance == null) {
            instance = connect(Environment.KUBE_CONFIG);
        }
        return instance;
    }

    /**
     * Connect with the given kubeconfig file, null uses $KUBECONFIG or ~/.kube/config.
     */
    public static KubeClient connect(String kubeconfig) {
        Config config;
        if (kubeconfig == null || kubeconfig.isBlank()) {
            LOGGER.info("Connecting to cluster with default kubeconfig");
            config = Config.autoConfigure(null);
        } else {
            Path path = Paths.get(kubeconfig.replaceFirst("^~", System.getProperty("user.home")));
            LOGGER.info("Connecting to cluster with kubeconfig {}", path);
            try {
                config = Config.fromKubeconfig(Files.readString(path));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read kubeconfig " + path, e);
            }
        }
        config.setConnectionTimeout(30_000);
        // retries are driven by BackOff
        config.setRequestRetryBackoffLimit(0);
        return new KubeClient(new KubernetesClientBuilder().withConfig(config).build());
    }

    public KubernetesClient client() {
        return this.client;
    }

    /**
     * Create the object described by {@code spec}, namespaced kinds are placed in {@code namespace}.
     *
     * @return the object as stored by the API server
     */
    public GenericKubernetesResource create(ResourceKind kind, String namespace, GenericKubernetesResource spec) {
        GenericKubernetesResource item = toGeneric(spec);
        if (item.getMetadata() == null) {
            item.setMetadata(new ObjectMeta());
        }
        if (kind.isNamespaced()) {
            item.getMetadata().setNamespace(namespace);
        }
        String description = String.format("create of %s %s", kind.getKind(), describe(namespace, item.getMetadata().getName()));
        LOGGER.debug("Issuing {}", description);
        return execute(description, () -> scoped(kind, namespace).resource(item).create());
    }

    /**
     * @throws ResourceNotFoundException when the object does not exist
     */
    public GenericKubernetesResource get(ResourceKind kind, String namespace, String name) {
        return find(kind, namespace, name).orElseThrow(() -> new ResourceNotFoundException(kind, namespace, name));
    }

    public Optional<GenericKubernetesResource> find(ResourceKind kind, String namespace, String name) {
        String description = String.format("get of %s %s", kind.getKind(), describe(namespace, name));
        return Optional.ofNullable(execute(description, () -> scoped(kind, namespace).withName(name).get()));
    }

    /**
     * Delete an object, absence is not an error.
     *
     * @return true if the object existed
     */
    public boolean delete(ResourceKind kind, String namespace, String name) {
        String description = String.format("delete of %s %s", kind.getKind(), describe(namespace, name));
        LOGGER.debug("Issuing {}", description);
        return execute(description, () -> !scoped(kind, namespace).withName(name).delete().isEmpty());
    }

    public List<GenericKubernetesResource> list(ResourceKind kind, String namespace, Map<String, ?> labels) {
        String selector = Selectors.selectorString(labels);
        return list(kind, namespace, selector.isEmpty() ? null : selector);
    }

    /**
     * @param labelSelector selector string, null lists everything
     */
    public List<GenericKubernetesResource> list(ResourceKind kind, String namespace, String labelSelector) {
        ListOptions options = new ListOptionsBuilder().withLabelSelector(labelSelector).build();
        String description = String.format("list of %s in namespace %s", kind.getPlural(), namespace);
        return execute(description, () -> scoped(kind, namespace).list(options).getItems());
    }

    /**
     * Watch every object of a kind in a namespace.
     *
     * @param resourceVersion version to resume from, null starts from the current state
     */
    public ResourceEventStream watch(ResourceKind kind, String namespace, String resourceVersion) {
        String description = String.format("%s in namespace %s", kind.getPlural(), namespace);
        return new ResourceEventStream(description, resourceVersion, backOffs.get(), (version, watcher) ->
                execute("watch of " + description, () -> scoped(kind, namespace).watch(watchOptions(version), watcher)));
    }

    /**
     * Watch a single object.
     */
    public ResourceEventStream watch(ResourceKind kind, String namespace, String name, String resourceVersion) {
        String description = String.format("%s %s", kind.getKind(), describe(namespace, name));
        return new ResourceEventStream(description, resourceVersion, backOffs.get(), (version, watcher) ->
                execute("watch of " + description, () -> scoped(kind, namespace).withName(name).watch(watchOptions(version), watcher)));
    }

    public ClusterVersion version() {
        VersionInfo info = execute("get of cluster version", client::getKubernetesVersion);
        return new ClusterVersion(info.getGitVersion(), info.getMajor(), info.getMinor());
    }

    public boolean namespaceExists(String namespace) {
        return find(ResourceKind.NAMESPACE, null, namespace).isPresent();
    }

    @Override
    public void close() {
        client.close();
    }

    private static ListOptions watchOptions(String resourceVersion) {
        return new ListOptionsBuilder().withResourceVersion(resourceVersion).withAllowWatchBookmarks(true).build();
    }

    private NonNamespaceOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> scoped(ResourceKind kind, String namespace) {
        if (kind.isNamespaced()) {
            if (namespace == null) {
                throw new IllegalArgumentException(String.format("%s is namespaced, a namespace is required", kind.getKind()));
            }
            return client.genericKubernetesResources(kind.toContext()).inNamespace(namespace);
        }
        return client.genericKubernetesResources(kind.toContext());
    }

    <T> T execute(String description, Supplier<T> call) {
        BackOff backOff = backOffs.get();
        while (true) {
            sleep(backOff.delayMs(), description);
            try {
                return call.get();
            } catch (KubernetesClientException e) {
                int code = e.getCode();
                if (!isTransient(code)) {
                    throw new KubeApiException(String.format("%s failed: %s", description, e.getMessage()), code, e);
                }
                if (backOff.done()) {
                    throw new KubeApiException(String.format("%s failed after %d attempts: %s", description, backOff.maxAttempts(), e.getMessage()), code, e);
                }
                LOGGER.warn("{} failed with code {}, will retry: {}", description, code, e.getMessage());
            }
        }
    }

    private static void sleep(long delayMs, String description) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KubeApiException("Interrupted while retrying " + description, 0, e);
        }
    }

    /**
     * @return true for failures worth retrying: no response at all, throttling or a server side error
     */
    static boolean isTransient(int code) {
        return code <= 0 || code == 429 || code >= 500;
    }

    private static String describe(String namespace, String name) {
        return String.format("%s in namespace %s", name, namespace == null ? "(not set)" : namespace);
    }

    /**
     * Copy of any model object as a generic document.
     */
    public static GenericKubernetesResource toGeneric(HasMetadata resource) {
        return SERIALIZATION.convertValue(resource, GenericKubernetesResource.class);
    }

    public static <T> T convert(Object value, Class<T> type) {
        return SERIALIZATION.convertValue(value, type);
    }

    public static String toYaml(Object resource) {
        return SERIALIZATION.asYaml(resource);
    }
}
