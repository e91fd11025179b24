package io.kubetest.junit5;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.kubetest.k8s.KubeClient;
import io.kubetest.k8s.ResourceKind;
import io.kubetest.manifest.ManifestLoader;
import io.kubetest.manifest.ManifestRenderer;
import io.kubetest.namespace.TestNamespace;
import io.kubetest.registry.ResourceRegistry;
import io.kubetest.resource.ResourceHandle;
import io.kubetest.resource.Workloads;
import io.kubetest.wait.WaitOptions;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Everything a test method needs to work with the cluster: its namespace, its registry and the shared client.
 * Objects created through the context are deleted after the test.
 */
public class KubeTestContext {

    private final KubeClient client;
    private final TestNamespace namespace;
    private final ResourceRegistry registry;
    private final ManifestLoader loader;
    private final Map<String, String> renderContext;
    private final Class<?> anchor;

    KubeTestContext(KubeClient client, TestNamespace namespace, ResourceRegistry registry, ManifestRenderer renderer,
                    Map<String, String> renderContext, Class<?> anchor) {
        this.client = client;
        this.namespace = namespace;
        this.registry = registry;
        this.loader = new ManifestLoader(client.client(), renderer);
        this.renderContext = renderContext;
        this.anchor = anchor;
    }

    public String namespace() {
        return namespace.getName();
    }

    public TestNamespace testNamespace() {
        return namespace;
    }

    public KubeClient client() {
        return client;
    }

    public ResourceRegistry registry() {
        return registry;
    }

    public ResourceHandle create(HasMetadata spec) {
        return registry.create(spec);
    }

    public ResourceHandle create(ResourceKind kind, GenericKubernetesResource spec) {
        return registry.create(kind, spec);
    }

    /**
     * Parse a manifest rendered with the test's context without creating anything.
     */
    public List<HasMetadata> load(String location) {
        return loader.load(ManifestLoader.resolve(location, anchor), renderContext);
    }

    /**
     * Parse every manifest of a directory, or only {@code files} in the given order.
     */
    public List<HasMetadata> loadDirectory(String location, String... files) {
        Path dir = ManifestLoader.resolve(location, anchor);
        return loader.loadDirectory(dir, Arrays.asList(files), renderContext);
    }

    /**
     * Load a manifest and create its objects in document order.
     */
    public List<ResourceHandle> apply(String location) {
        return registry.createAll(load(location));
    }

    public void delete(ResourceHandle handle) {
        registry.delete(handle);
    }

    public GenericKubernetesResource waitUntil(ResourceHandle handle, Predicate<GenericKubernetesResource> predicate) {
        return registry.waitUntil(handle, predicate);
    }

    public GenericKubernetesResource waitUntil(ResourceHandle handle, Predicate<GenericKubernetesResource> predicate, WaitOptions options) {
        return registry.waitUntil(handle, predicate, options);
    }

    public GenericKubernetesResource waitUntilReady(ResourceHandle handle) {
        return registry.waitUntilReady(handle);
    }

    public GenericKubernetesResource waitUntilReady(ResourceHandle handle, WaitOptions options) {
        return registry.waitUntilReady(handle, options);
    }

    public void waitUntilGone(ResourceHandle handle) {
        registry.getWaiter().waitUntilGone(handle);
    }

    public void waitUntilCreated() {
        registry.waitUntilCreated();
    }

    public void waitUntilAllReady() {
        registry.waitUntilAllReady();
    }

    /**
     * Objects of a kind in the test namespace, cluster scoped kinds are listed cluster wide.
     */
    public List<GenericKubernetesResource> list(ResourceKind kind, Map<String, String> labels) {
        return client.list(kind, kind.isNamespaced() ? namespace() : null, labels);
    }

    public List<GenericKubernetesResource> list(ResourceKind kind) {
        return client.list(kind, kind.isNamespaced() ? namespace() : null, (String) null);
    }

    public List<GenericKubernetesResource> ownedPods(ResourceHandle workload) {
        return Workloads.ownedPods(client, workload);
    }
}
