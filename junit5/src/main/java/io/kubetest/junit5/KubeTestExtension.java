package io.kubetest.junit5;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.kubetest.Environment;
import io.kubetest.TestUtils;
import io.kubetest.k8s.KubeClient;
import io.kubetest.manifest.ManifestLoader;
import io.kubetest.manifest.ManifestRenderer;
import io.kubetest.manifest.TokenRenderer;
import io.kubetest.namespace.NamespaceManager;
import io.kubetest.namespace.NamespaceNames;
import io.kubetest.namespace.TestNamespace;
import io.kubetest.rbac.RbacBindings;
import io.kubetest.registry.ResourceRegistry;
import io.kubetest.registry.TeardownReport;
import io.kubetest.wait.ConditionWaiter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.junit.platform.commons.support.AnnotationSupport;
import org.junit.platform.commons.support.ReflectionSupport;

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Method;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * jUnit5 extension which gives every test method its own namespace and resource registry.
 * <p>
 * Before each test the namespace is prepared, role bindings are created and manifests are applied. After each test,
 * whatever its outcome, waits are cancelled, the tracked objects are deleted newest first and the namespace is released.
 * <p>
 * Registered through {@link KubeTest} it connects with the {@code kubetest.kube-config} configuration parameter and
 * shares one client for the whole run. Registered through {@code @RegisterExtension} it can be given its own client.
 */
public class KubeTestExtension implements BeforeAllCallback, AfterAllCallback, BeforeEachCallback, AfterEachCallback, ParameterResolver {
    private static final Logger LOGGER = LogManager.getLogger(KubeTestExtension.class);

    public static final String KUBE_CONFIG_PARAMETER = "kubetest.kube-config";
    public static final String KUBE_LOG_LEVEL_PARAMETER = "kubetest.kube-log-level";
    public static final String LEAKED_REPORT_KEY = "kubetest.leaked";

    private static final ExtensionContext.Namespace STORE = ExtensionContext.Namespace.create(KubeTestExtension.class);
    private static final String CLIENT_KEY = "client";
    private static final String STATE_KEY = "state";
    private static final NamespaceNames NAMES = new NamespaceNames();

    private final Supplier<KubeClient> clientSupplier;
    private volatile Duration testTimeout;

    public KubeTestExtension() {
        this(null);
    }

    /**
     * @param clientSupplier client to use, the extension never closes it
     */
    public KubeTestExtension(Supplier<KubeClient> clientSupplier) {
        this.clientSupplier = clientSupplier;
    }

    /**
     * Time budget of every test method, takes precedence over {@link KubeTest#timeoutSeconds()}.
     */
    public KubeTestExtension withTestTimeout(Duration timeout) {
        this.testTimeout = timeout;
        return this;
    }

    @Override
    public void beforeAll(ExtensionContext extensionContext) {
        TestUtils.logWithSeparator("-> Running test class: {}", extensionContext.getRequiredTestClass().getName());
    }

    @Override
    public void afterAll(ExtensionContext extensionContext) {
        TestUtils.logWithSeparator("-> End of test class: {}", extensionContext.getRequiredTestClass().getName());
    }

    @Override
    public void beforeEach(ExtensionContext extensionContext) {
        TestUtils.logWithSeparator("-> Running test method: {}", extensionContext.getDisplayName());
        Class<?> testClass = extensionContext.getRequiredTestClass();
        Method testMethod = extensionContext.getRequiredTestMethod();
        String testName = testMethod.getName();
        String owner = testClass.getSimpleName() + "." + testName;

        KubeClient client = client(extensionContext);
        NamespaceManager namespaces = new NamespaceManager(client, NAMES,
                Duration.ofMillis(Environment.NAMESPACE_READY_TIMEOUT_MS),
                Duration.ofMillis(Environment.NAMESPACE_DELETION_GRACE_MS),
                Environment.AWAIT_NAMESPACE_DELETION, Environment.WAIT_POLL_INTERVAL_MS);

        TestState state = new TestState(owner, namespaces);
        try {
            state.namespace = namespace(namespaces, testClass, testMethod, testName);
            ResourceRegistry registry = new ResourceRegistry(owner, client, state.namespace, new ConditionWaiter(client));
            state.registry = registry;

            Duration timeout = timeout(testClass);
            registry.setDeadline(Instant.now().plus(timeout));
            state.timeout = TestUtils.scheduler().schedule(() -> {
                LOGGER.warn("Test {} exceeded its time budget of {} s, cancelling its waits", owner, timeout.toSeconds());
                registry.cancelWaits();
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);

            Map<String, String> render = ManifestLoader.context(state.namespace.getName(), testName, extensionContext.getUniqueId());
            ManifestRenderer renderer = testRenderer(testClass, testMethod);
            state.context = new KubeTestContext(client, state.namespace, registry, renderer, render, testClass);

            createBindings(state, testClass, testMethod, testName);
            applyManifests(client, state, testClass, testMethod, renderer, render);
        } catch (RuntimeException e) {
            LOGGER.error("Setup of {} failed: {}", owner, e.getMessage());
            cleanup(extensionContext, state);
            throw e;
        }
        extensionContext.getStore(STORE).put(STATE_KEY, state);
    }

    @Override
    public void afterEach(ExtensionContext extensionContext) {
        TestUtils.logWithSeparator("-> End of test method: {}", extensionContext.getDisplayName());
        TestState state = extensionContext.getStore(STORE).remove(STATE_KEY, TestState.class);
        if (state == null) {
            return;
        }
        extensionContext.getExecutionException()
                .ifPresent(throwable -> LogCollector.saveKubernetesState(extensionContext, state.context, throwable));
        cleanup(extensionContext, state);
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        Class<?> type = parameterContext.getParameter().getType();
        return extensionContext.getTestMethod().isPresent()
                && parameterContext.getDeclaringExecutable() instanceof Method
                && (type == KubeTestContext.class || type == KubeClient.class
                    || type == TestNamespace.class || type == ResourceRegistry.class);
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        TestState state = extensionContext.getStore(STORE).get(STATE_KEY, TestState.class);
        if (state == null) {
            throw new ParameterResolutionException("No cluster context is available for " + extensionContext.getDisplayName());
        }
        Class<?> type = parameterContext.getParameter().getType();
        if (type == KubeTestContext.class) {
            return state.context;
        } else if (type == KubeClient.class) {
            return state.context.client();
        } else if (type == TestNamespace.class) {
            return state.namespace;
        }
        return state.registry;
    }

    private KubeClient client(ExtensionContext extensionContext) {
        if (clientSupplier != null) {
            return clientSupplier.get();
        }
        String kubeconfig = extensionContext.getConfigurationParameter(KUBE_CONFIG_PARAMETER).orElse(Environment.KUBE_CONFIG);
        return extensionContext.getRoot().getStore(STORE)
                .getOrComputeIfAbsent(CLIENT_KEY, k -> new SharedClient(KubeClient.connect(kubeconfig)), SharedClient.class)
                .client;
    }

    private Duration timeout(Class<?> testClass) {
        if (testTimeout != null) {
            return testTimeout;
        }
        return AnnotationSupport.findAnnotation(testClass, KubeTest.class)
                .filter(kubeTest -> kubeTest.timeoutSeconds() >= 0)
                .map(kubeTest -> Duration.ofSeconds(kubeTest.timeoutSeconds()))
                .orElse(Duration.ofMillis(Environment.TEST_TIMEOUT_MS));
    }

    private static TestNamespace namespace(NamespaceManager namespaces, Class<?> testClass, Method testMethod, String testName) {
        Optional<KubeNamespace> annotation = AnnotationSupport.findAnnotation(testMethod, KubeNamespace.class)
                .or(() -> AnnotationSupport.findAnnotation(testClass, KubeNamespace.class));
        if (annotation.isEmpty()) {
            return namespaces.acquire(testName);
        }
        String name = annotation.get().name();
        if (!annotation.get().create()) {
            return namespaces.use(name.isBlank() ? "default" : name);
        }
        return name.isBlank() ? namespaces.acquire(testName) : namespaces.create(name, testName);
    }

    private static void createBindings(TestState state, Class<?> testClass, Method testMethod, String testName) {
        String ns = state.namespace.getName();
        int index = 0;
        for (RoleBinding binding : annotations(testClass, testMethod, RoleBinding.class)) {
            state.registry.create(RbacBindings.roleBinding(RbacBindings.bindingName(testName, index++), ns,
                    binding.kind(), binding.name(), binding.subjectKind(), binding.subjectName()));
        }
        for (ClusterRoleBinding binding : annotations(testClass, testMethod, ClusterRoleBinding.class)) {
            state.registry.create(RbacBindings.clusterRoleBinding(RbacBindings.bindingName(testName, index++), ns,
                    binding.name(), binding.subjectKind(), binding.subjectName()));
        }
    }

    private static void applyManifests(KubeClient client, TestState state, Class<?> testClass, Method testMethod,
                                       ManifestRenderer testRenderer, Map<String, String> render) {
        ManifestLoader loader = new ManifestLoader(client.client(), testRenderer);
        for (AnnotatedElement element : new AnnotatedElement[] {testClass, testMethod}) {
            for (ApplyManifest manifest : AnnotationSupport.findRepeatableAnnotations(element, ApplyManifest.class)) {
                List<HasMetadata> objects = loader.withRenderer(renderer(manifest.renderer(), testRenderer))
                        .load(ManifestLoader.resolve(manifest.value(), testClass), render);
                state.registry.createAll(objects);
            }
            for (ApplyManifests manifests : AnnotationSupport.findRepeatableAnnotations(element, ApplyManifests.class)) {
                Path dir = ManifestLoader.resolve(manifests.value(), testClass);
                state.registry.createAll(loader.withRenderer(renderer(manifests.renderer(), testRenderer))
                        .loadDirectory(dir, Arrays.asList(manifests.files()), render));
            }
        }
    }

    static ManifestRenderer testRenderer(Class<?> testClass, Method testMethod) {
        Optional<RenderManifests> mark = AnnotationSupport.findAnnotation(testMethod, RenderManifests.class);
        if (mark.isEmpty()) {
            mark = AnnotationSupport.findAnnotation(testClass, RenderManifests.class);
        }
        Class<? extends ManifestRenderer> type = mark.isPresent() ? mark.get().value() : ManifestRenderer.class;
        return renderer(type, new TokenRenderer());
    }

    /**
     * @return a new instance of {@code type}, or {@code fallback} for the {@link ManifestRenderer} placeholder
     */
    static ManifestRenderer renderer(Class<? extends ManifestRenderer> type, ManifestRenderer fallback) {
        if (type == ManifestRenderer.class) {
            return fallback;
        }
        return ReflectionSupport.newInstance(type);
    }

    private static <A extends Annotation> List<A> annotations(Class<?> testClass, Method testMethod, Class<A> type) {
        List<A> result = new ArrayList<>(AnnotationSupport.findRepeatableAnnotations(testClass, type));
        result.addAll(AnnotationSupport.findRepeatableAnnotations(testMethod, type));
        return result;
    }

    private static void cleanup(ExtensionContext extensionContext, TestState state) {
        if (state.timeout != null) {
            state.timeout.cancel(false);
        }
        if (state.registry != null) {
            state.registry.cancelWaits();
        }
        if (Environment.SKIP_TEARDOWN) {
            LOGGER.warn("Teardown is skipped, objects of {} in namespace {} are left in place", state.owner, state.namespace);
            return;
        }
        if (state.registry != null) {
            TeardownReport report = state.registry.teardown();
            if (report.hasFailures()) {
                extensionContext.publishReportEntry(LEAKED_REPORT_KEY, report.getFailures().stream()
                        .map(failure -> failure.getHandle().toString())
                        .collect(Collectors.joining(", ")));
            }
        }
        if (state.namespace != null) {
            state.namespaces.release(state.namespace);
        }
    }

    /**
     * Per test method state, created in {@link #beforeEach} and consumed in {@link #afterEach}.
     */
    private static final class TestState {
        private final String owner;
        private final NamespaceManager namespaces;
        private TestNamespace namespace;
        private ResourceRegistry registry;
        private KubeTestContext context;
        private ScheduledFuture<?> timeout;

        private TestState(String owner, NamespaceManager namespaces) {
            this.owner = owner;
            this.namespaces = namespaces;
        }
    }

    /**
     * Client shared by all tests of a run, closed by jUnit when the run ends.
     */
    private static final class SharedClient implements ExtensionContext.Store.CloseableResource {
        private final KubeClient client;

        private SharedClient(KubeClient client) {
            this.client = client;
        }

        @Override
        public void close() {
            LOGGER.info("Closing cluster client");
            client.close();
        }
    }
}
