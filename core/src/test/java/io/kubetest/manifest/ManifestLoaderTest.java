package io.kubetest.manifest;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.kubetest.KubeTestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@EnableKubernetesMockClient(crud = true)
public class ManifestLoaderTest {

    static KubernetesClient client;

    private ManifestLoader loader;
    private Map<String, String> context;

    @BeforeEach
    void setUp() {
        loader = new ManifestLoader(client);
        context = ManifestLoader.context("kubetest-ns", "testLoad()", "ManifestLoaderTest#testLoad()");
    }

    private static List<String> names(List<HasMetadata> items) {
        return items.stream().map(i -> i.getMetadata().getName()).collect(Collectors.toList());
    }

    @Test
    void testLoadRendersContext() {
        List<HasMetadata> items = loader.load(ManifestLoader.resolve("manifests/multi.yaml", ManifestLoaderTest.class), context);

        assertThat(names(items), contains("settings", "credentials"));
        assertThat(items.get(0), instanceOf(ConfigMap.class));
        assertThat(items.get(1), instanceOf(Secret.class));
        ConfigMap cm = (ConfigMap) items.get(0);
        assertEquals("kubetest-ns", cm.getMetadata().getNamespace());
        assertEquals("testLoad()", cm.getMetadata().getLabels().get("test"));
        assertEquals("ManifestLoaderTest#testLoad()", cm.getData().get("node"));
    }

    @Test
    void testUnknownKindIsGeneric() {
        List<HasMetadata> items = loader.load(ManifestLoader.resolve("manifests/widget.yaml", ManifestLoaderTest.class), context);

        assertEquals(1, items.size());
        assertThat(items.get(0), instanceOf(GenericKubernetesResource.class));
        assertEquals("Widget", items.get(0).getKind());
        assertEquals("example.com/v1", items.get(0).getApiVersion());
    }

    @Test
    void testLoadDirectory() {
        Path dir = ManifestLoader.resolve("manifests/app", ManifestLoaderTest.class);

        List<HasMetadata> items = loader.loadDirectory(dir, Collections.emptyList(), context);

        assertThat(names(items), contains("app-config", "app"));
        ConfigMap cm = (ConfigMap) items.get(0);
        assertEquals(dir.toAbsolutePath().toString(), cm.getData().get("location"));
        assertEquals("testLoad()", cm.getData().get("owner"));
    }

    @Test
    void testLoadSelectedFilesInGivenOrder() {
        Path dir = ManifestLoader.resolve("manifests/app", ManifestLoaderTest.class);

        List<HasMetadata> items = loader.loadDirectory(dir, List.of("b-service.yml", "a-configmap.yaml"), context);

        assertThat(names(items), contains("app", "app-config"));
    }

    @Test
    void testCustomRenderer() {
        ManifestRenderer renderer = (template, ctx) -> new ByteArrayInputStream(new String(template.readAllBytes(), StandardCharsets.UTF_8)
                .replace("@@NAMESPACE@@", ctx.get(ManifestLoader.NAMESPACE))
                .getBytes(StandardCharsets.UTF_8));

        List<HasMetadata> items = loader.withRenderer(renderer).load(ManifestLoader.resolve("manifests/custom.yaml", ManifestLoaderTest.class), context);

        ConfigMap cm = (ConfigMap) items.get(0);
        assertEquals("kubetest-ns", cm.getMetadata().getNamespace());
        assertEquals("${namespace}", cm.getData().get("untouched"));
    }

    @Test
    void testRendererFailure() {
        ManifestRenderer broken = (template, ctx) -> {
            throw new IOException("template error");
        };

        KubeTestException e = assertThrows(KubeTestException.class,
                () -> loader.withRenderer(broken).load(ManifestLoader.resolve("manifests/custom.yaml", ManifestLoaderTest.class), context));
        assertThat(e.getCause(), instanceOf(IOException.class));
    }

    @Test
    void testMissingManifest() {
        assertThrows(KubeTestException.class, () -> ManifestLoader.resolve("manifests/missing.yaml", ManifestLoaderTest.class));
    }
}
