package io.kubetest.junit5;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.kubetest.KubeTestException;
import io.kubetest.TestUtils;
import io.kubetest.k8s.BackOff;
import io.kubetest.k8s.KubeApiException;
import io.kubetest.k8s.KubeClient;
import io.kubetest.k8s.ResourceKind;
import io.kubetest.manifest.ManifestLoader;
import io.kubetest.manifest.ManifestRenderer;
import io.kubetest.manifest.TokenRenderer;
import io.kubetest.namespace.NamespaceCreationException;
import io.kubetest.namespace.TestNamespace;
import io.kubetest.registry.ResourceRegistry;
import io.kubetest.resource.Readiness;
import io.kubetest.resource.ResourceHandle;
import io.kubetest.wait.WaitOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.junit.platform.engine.TestExecutionResult;
import org.junit.platform.engine.reporting.ReportEntry;
import org.junit.platform.testkit.engine.EngineExecutionResults;
import org.junit.platform.testkit.engine.EngineTestKit;
import org.opentest4j.AssertionFailedError;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import static org.junit.platform.engine.discovery.DiscoverySelectors.selectClass;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

@EnableKubernetesMockClient(crud = true)
public class KubeTestExtensionTest {

    static KubernetesClient client;

    static KubeClient kubeClient;

    @BeforeEach
    void setUp() {
        if (client.namespaces().withName("default").get() == null) {
            client.namespaces().resource(new NamespaceBuilder().withNewMetadata().withName("default").endMetadata().build()).create();
        }
        kubeClient = new KubeClient(client, () -> new BackOff(0, 2, 3));
    }

    private static ConfigMap configMap(String name) {
        return new ConfigMapBuilder()
                .withNewMetadata().withName(name).endMetadata()
                .addToData("state", "new")
                .build();
    }

    private static EngineExecutionResults run(Class<?> sample) {
        return EngineTestKit.engine("junit-jupiter").selectors(selectClass(sample)).execute();
    }

    private static Throwable failure(EngineExecutionResults results) {
        return results.testEvents().failed().stream()
                .map(event -> event.getPayload(TestExecutionResult.class).flatMap(TestExecutionResult::getThrowable))
                .findFirst()
                .flatMap(t -> t)
                .orElseThrow(() -> new AssertionError("no failed test"));
    }

    private ConfigMap configMapInDefault(String name) {
        return client.configMaps().inNamespace("default").withName(name).get();
    }

    @Test
    void testObjectsAreCreatedBeforeAndDeletedAfterTheTest() {
        EngineExecutionResults results = run(LifecycleSample.class);

        results.testEvents().assertStatistics(stats -> stats.started(1).succeeded(1));
        assertNull(configMapInDefault("app-config"));
        assertNull(configMapInDefault("extra"));
        assertNull(client.secrets().inNamespace("default").withName("app-secret").get());
        assertNull(client.rbac().roleBindings().inNamespace("default").withName("kubetest:testCreatesObjects").get());
        assertNotNull(client.namespaces().withName("default").get());
    }

    @Test
    void testFailedTestIsTornDownAndItsStateCollected() throws Exception {
        EngineExecutionResults results = run(FailingSample.class);

        results.testEvents().assertStatistics(stats -> stats.started(1).failed(1));
        assertThat(failure(results), instanceOf(AssertionFailedError.class));
        assertNull(configMapInDefault("doomed"));

        Path logPath = TestUtils.getLogPath(LogCollector.FOLDER, FailingSample.class.getName(), "testFails");
        assertTrue(Files.exists(logPath.resolve("configmap-doomed.yml")));
        assertThat(Files.readString(logPath.resolve("configmap-doomed.yml")), containsString("doomed"));
        assertTrue(Files.exists(logPath.resolve("events.log")));
    }

    @Test
    void testTimeoutCancelsWaitsAndProceedsToTeardown() {
        long start = System.nanoTime();
        EngineExecutionResults results = run(TimeoutSample.class);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        results.testEvents().assertStatistics(stats -> stats.started(1).failed(1));
        assertThat(failure(results), instanceOf(KubeTestException.class));
        assertThat(elapsedMs, lessThan(10_000L));
        assertNull(configMapInDefault("slow"));
    }

    @Test
    void testParametersAreResolved() {
        run(ParameterSample.class).testEvents().assertStatistics(stats -> stats.started(1).succeeded(1));
    }

    @Test
    void testMissingNamespaceFailsSetup() {
        EngineExecutionResults results = run(MissingNamespaceSample.class);

        results.testEvents().assertStatistics(stats -> stats.started(1).failed(1));
        assertThat(failure(results), instanceOf(NamespaceCreationException.class));
    }

    @Test
    void testHalfSpecifiedSubjectFailsSetupAndCleansUp() {
        EngineExecutionResults results = run(BadSubjectSample.class);

        results.testEvents().assertStatistics(stats -> stats.started(1).failed(1));
        assertThat(failure(results), instanceOf(IllegalArgumentException.class));
        assertNull(client.rbac().roleBindings().inNamespace("default").withName("kubetest:testNeverRuns").get());
    }

    @Test
    void testDirectoryManifestsAndClusterBindings() {
        run(DirectorySample.class).testEvents().assertStatistics(stats -> stats.started(1).succeeded(1));

        assertNull(client.serviceAccounts().inNamespace("default").withName("stack").get());
        assertNull(client.rbac().clusterRoleBindings().withName("kubetest:testAppliesDirectory-1").get());
    }

    @Test
    void testLeakedObjectsArePublished() {
        kubeClient = spy(kubeClient);
        doThrow(new KubeApiException("forbidden", 403)).when(kubeClient).delete(eq(ResourceKind.SECRET), any(), any());

        EngineExecutionResults results = run(LifecycleSample.class);

        results.testEvents().assertStatistics(stats -> stats.started(1).succeeded(1));
        List<String> leaked = results.allEvents().reportingEntryPublished().stream()
                .map(event -> event.getPayload(ReportEntry.class).orElseThrow().getKeyValuePairs())
                .filter(entries -> entries.containsKey(KubeTestExtension.LEAKED_REPORT_KEY))
                .map(entries -> entries.get(KubeTestExtension.LEAKED_REPORT_KEY))
                .collect(Collectors.toList());
        assertEquals(1, leaked.size());
        assertThat(leaked.get(0), containsString("app-secret"));
        assertNull(configMapInDefault("app-config"));
        assertNotNull(client.secrets().inNamespace("default").withName("app-secret").get());
        client.secrets().inNamespace("default").withName("app-secret").delete();
    }

    @Test
    void testManifestsUseTheChosenRenderer() {
        run(RendererSample.class).testEvents().assertStatistics(stats -> stats.started(1).succeeded(1));

        assertNull(configMapInDefault("marker-testRendersManifests"));
        assertNull(configMapInDefault("app-config"));
    }

    @KubeNamespace(name = "default", create = false)
    @RoleBinding(kind = "ClusterRole", name = "view")
    static class LifecycleSample {
        @RegisterExtension
        static KubeTestExtension kube = new KubeTestExtension(() -> kubeClient);

        @Test
        @ApplyManifest("manifests/app.yaml")
        void testCreatesObjects(KubeTestContext context) {
            assertEquals("default", context.namespace());
            ResourceHandle config = context.registry().find(ResourceKind.CONFIG_MAP, "app-config").orElseThrow();
            assertEquals("testCreatesObjects", Readiness.field(config.getObserved(), "data", "test"));
            assertTrue(context.registry().find(ResourceKind.SECRET, "app-secret").isPresent());
            assertTrue(context.registry().find(ResourceKind.ROLE_BINDING, "kubetest:testCreatesObjects").isPresent());

            ResourceHandle extra = context.create(configMap("extra"));
            context.waitUntilCreated();
            assertEquals("default", extra.getNamespace());
            assertEquals(2, context.list(ResourceKind.CONFIG_MAP).size());
        }
    }

    @KubeNamespace(name = "default", create = false)
    static class FailingSample {
        @RegisterExtension
        static KubeTestExtension kube = new KubeTestExtension(() -> kubeClient);

        @Test
        void testFails(KubeTestContext context) {
            context.create(configMap("doomed"));
            fail("expected failure");
        }
    }

    @KubeNamespace(name = "default", create = false)
    static class TimeoutSample {
        @RegisterExtension
        static KubeTestExtension kube = new KubeTestExtension(() -> kubeClient).withTestTimeout(Duration.ofMillis(500));

        @Test
        void testWaitsTooLong(KubeTestContext context) {
            ResourceHandle handle = context.create(configMap("slow"));
            context.waitUntil(handle, Readiness.fieldEquals("never", "data", "state"),
                    WaitOptions.of(Duration.ofMillis(50), Duration.ofSeconds(30)));
        }
    }

    @KubeNamespace(name = "default", create = false)
    static class ParameterSample {
        @RegisterExtension
        static KubeTestExtension kube = new KubeTestExtension(() -> kubeClient);

        @Test
        void testResolves(KubeTestContext context, KubeClient client, TestNamespace namespace, ResourceRegistry registry) {
            assertSame(context.client(), client);
            assertSame(context.testNamespace(), namespace);
            assertSame(context.registry(), registry);
            assertFalse(namespace.isManaged());
        }
    }

    @KubeNamespace(name = "missing", create = false)
    static class MissingNamespaceSample {
        @RegisterExtension
        static KubeTestExtension kube = new KubeTestExtension(() -> kubeClient);

        @Test
        void testNeverRuns() {
            fail("setup should have failed");
        }
    }

    @KubeNamespace(name = "default", create = false)
    @RoleBinding(kind = "Role", name = "reader")
    @RoleBinding(kind = "Role", name = "writer", subjectKind = "User")
    static class BadSubjectSample {
        @RegisterExtension
        static KubeTestExtension kube = new KubeTestExtension(() -> kubeClient);

        @Test
        void testNeverRuns() {
            fail("setup should have failed");
        }
    }

    @KubeNamespace(name = "default", create = false)
    static class DirectorySample {
        @RegisterExtension
        static KubeTestExtension kube = new KubeTestExtension(() -> kubeClient);

        @Test
        @RoleBinding(kind = "ClusterRole", name = "edit")
        @ClusterRoleBinding(name = "view", subjectKind = "ServiceAccount", subjectName = "stack")
        @ApplyManifests("manifests/stack")
        void testAppliesDirectory(KubeTestContext context) {
            List<ResourceHandle> handles = context.registry().handles();
            assertEquals(4, handles.size());
            assertEquals(ResourceKind.ROLE_BINDING, handles.get(0).getKind());
            assertEquals(ResourceKind.CLUSTER_ROLE_BINDING, handles.get(1).getKind());
            assertEquals("kubetest:testAppliesDirectory-1", handles.get(1).getName());
            assertEquals(ResourceKind.SERVICE_ACCOUNT, handles.get(2).getKind());
            assertThat(String.valueOf(Readiness.field(handles.get(3).getObserved(), "data", "source")), containsString("stack"));
        }
    }

    public static class MarkerRenderer implements ManifestRenderer {
        @Override
        public InputStream render(InputStream template, Map<String, String> context) throws IOException {
            String rendered = new String(template.readAllBytes(), StandardCharsets.UTF_8)
                    .replace("@@TEST@@", context.get(ManifestLoader.TEST_NAME));
            return new ByteArrayInputStream(rendered.getBytes(StandardCharsets.UTF_8));
        }
    }

    @KubeNamespace(name = "default", create = false)
    @RenderManifests(MarkerRenderer.class)
    static class RendererSample {
        @RegisterExtension
        static KubeTestExtension kube = new KubeTestExtension(() -> kubeClient);

        @Test
        @ApplyManifest("manifests/marker.yaml")
        @ApplyManifest(value = "manifests/app.yaml", renderer = TokenRenderer.class)
        void testRendersManifests(KubeTestContext context) {
            ResourceHandle marker = context.registry().find(ResourceKind.CONFIG_MAP, "marker-testRendersManifests").orElseThrow();
            assertEquals("${test_name}", Readiness.field(marker.getObserved(), "data", "token"));
            ResourceHandle config = context.registry().find(ResourceKind.CONFIG_MAP, "app-config").orElseThrow();
            assertEquals("testRendersManifests", Readiness.field(config.getObserved(), "data", "test"));
            assertEquals("marker-testRendersManifests", context.load("manifests/marker.yaml").get(0).getMetadata().getName());
        }
    }
}
