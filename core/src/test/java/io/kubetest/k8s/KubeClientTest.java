package io.kubetest.k8s;

import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableKubernetesMockClient(crud = true)
public class KubeClientTest {

    static KubernetesClient client;

    private KubeClient kubeClient;

    @BeforeEach
    void setUp() {
        kubeClient = new KubeClient(client, () -> new BackOff(0, 2, 3));
    }

    private static GenericKubernetesResource configMap(String name, String app) {
        return KubeClient.toGeneric(new ConfigMapBuilder()
                .withNewMetadata()
                    .withName(name)
                    .addToLabels("app", app)
                .endMetadata()
                .addToData("key", "value")
                .build());
    }

    @Test
    void testCreateAndGet() {
        GenericKubernetesResource created = kubeClient.create(ResourceKind.CONFIG_MAP, "test", configMap("cm", "web"));

        assertEquals("test", created.getMetadata().getNamespace());
        assertNotNull(created.getMetadata().getResourceVersion());

        GenericKubernetesResource fetched = kubeClient.get(ResourceKind.CONFIG_MAP, "test", "cm");
        assertEquals("cm", fetched.getMetadata().getName());
        assertEquals(Collections.singletonMap("key", "value"), fetched.getAdditionalProperties().get("data"));
    }

    @Test
    void testCreateDoesNotModifyInput() {
        GenericKubernetesResource spec = configMap("untouched", "web");
        kubeClient.create(ResourceKind.CONFIG_MAP, "test", spec);
        assertNull(spec.getMetadata().getNamespace());
    }

    @Test
    void testGetMissingObject() {
        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                () -> kubeClient.get(ResourceKind.CONFIG_MAP, "test", "missing"));
        assertTrue(e.getMessage().contains("missing"));
        assertFalse(kubeClient.find(ResourceKind.CONFIG_MAP, "test", "missing").isPresent());
    }

    @Test
    void testDeleteIsIdempotent() {
        kubeClient.create(ResourceKind.CONFIG_MAP, "test", configMap("to-delete", "web"));

        assertTrue(kubeClient.delete(ResourceKind.CONFIG_MAP, "test", "to-delete"));
        assertFalse(kubeClient.delete(ResourceKind.CONFIG_MAP, "test", "to-delete"));
        assertFalse(kubeClient.find(ResourceKind.CONFIG_MAP, "test", "to-delete").isPresent());
    }

    @Test
    void testListByLabels() {
        kubeClient.create(ResourceKind.CONFIG_MAP, "listing", configMap("one", "web"));
        kubeClient.create(ResourceKind.CONFIG_MAP, "listing", configMap("two", "web"));
        kubeClient.create(ResourceKind.CONFIG_MAP, "listing", configMap("three", "db"));

        List<String> web = kubeClient.list(ResourceKind.CONFIG_MAP, "listing", Collections.singletonMap("app", "web")).stream()
                .map(r -> r.getMetadata().getName())
                .collect(Collectors.toList());
        assertThat(web, containsInAnyOrder("one", "two"));
        assertEquals(3, kubeClient.list(ResourceKind.CONFIG_MAP, "listing", (String) null).size());
    }

    @Test
    void testClusterScopedKindIgnoresNamespace() {
        kubeClient.create(ResourceKind.NAMESPACE, "ignored",
                KubeClient.toGeneric(new NamespaceBuilder().withNewMetadata().withName("scoped").endMetadata().build()));

        assertTrue(kubeClient.namespaceExists("scoped"));
        assertFalse(kubeClient.namespaceExists("other"));
    }

    @Test
    void testNamespacedKindRequiresNamespace() {
        assertThrows(IllegalArgumentException.class, () -> kubeClient.get(ResourceKind.POD, null, "pod"));
    }

    @Test
    void testTransientCodes() {
        assertTrue(KubeClient.isTransient(0));
        assertTrue(KubeClient.isTransient(429));
        assertTrue(KubeClient.isTransient(500));
        assertTrue(KubeClient.isTransient(503));
        assertFalse(KubeClient.isTransient(400));
        assertFalse(KubeClient.isTransient(403));
        assertFalse(KubeClient.isTransient(404));
        assertFalse(KubeClient.isTransient(409));
    }
}
