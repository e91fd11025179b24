package io.kubetest.junit5;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.kubetest.KubeTestException;
import io.kubetest.TestUtils;
import io.kubetest.k8s.KubeClient;
import io.kubetest.k8s.ResourceKind;
import io.kubetest.resource.Readiness;
import io.kubetest.resource.ResourceHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Stores the state of a failed test's namespace under {@code LOG_DIR/failedTest/<class>/<method>}.
 */
public class LogCollector {
    private static final Logger LOGGER = LogManager.getLogger(LogCollector.class);

    public static final String FOLDER = "failedTest";

    private LogCollector() {
    }

    /**
     * Save the observed state of every tracked object, the pods and the events of the namespace.
     * Collection problems are logged, a failed test must still reach teardown.
     *
     * @return directory the state was written to
     */
    public static Path saveKubernetesState(ExtensionContext extensionContext, KubeTestContext context, Throwable throwable) {
        Path logPath = TestUtils.getLogPath(FOLDER, extensionContext.getRequiredTestClass().getName(),
                extensionContext.getRequiredTestMethod().getName());
        LOGGER.warn("Test {} failed: {}", extensionContext.getDisplayName(), throwable.getMessage());
        LOGGER.info("Storing namespace {} state into {}", context.namespace(), logPath);
        try {
            Files.createDirectories(logPath);
            saveTrackedObjects(logPath, context);
            saveNamespaceState(logPath, context);
        } catch (IOException | KubeTestException e) {
            LOGGER.warn("Cannot save state of namespace {} in {}: {}", context.namespace(), logPath, e.getMessage());
        }
        return logPath;
    }

    private static void saveTrackedObjects(Path logPath, KubeTestContext context) throws IOException {
        for (ResourceHandle handle : context.registry().handles()) {
            GenericKubernetesResource state = context.client()
                    .find(handle.getKind(), handle.getNamespace(), handle.getName())
                    .orElse(handle.getObserved());
            String fileName = String.format("%s-%s.yml", handle.getKind().getKind().toLowerCase(Locale.ROOT), handle.getName())
                    .replace(':', '_');
            Files.writeString(logPath.resolve(fileName), KubeClient.toYaml(state), StandardCharsets.UTF_8);
        }
    }

    private static void saveNamespaceState(Path logPath, KubeTestContext context) throws IOException {
        KubeClient kube = context.client();
        List<GenericKubernetesResource> pods = kube.list(ResourceKind.POD, context.namespace(), (String) null);
        pods.forEach(p -> LOGGER.info("Pod: {} in ns: {} with phase: {}", p.getMetadata().getName(),
                context.namespace(), Objects.toString(Readiness.field(p, "status", "phase"))));
        Files.writeString(logPath.resolve("pods.yml"), KubeClient.toYaml(pods), StandardCharsets.UTF_8);

        String events = kube.list(ResourceKind.EVENT, context.namespace(), (String) null).stream()
                .map(e -> String.format("%s %s/%s %s: %s",
                        Objects.toString(Readiness.field(e, "type"), ""),
                        Objects.toString(Readiness.field(e, "involvedObject", "kind"), ""),
                        Objects.toString(Readiness.field(e, "involvedObject", "name"), ""),
                        Objects.toString(Readiness.field(e, "reason"), ""),
                        Objects.toString(Readiness.field(e, "message"), "")))
                .collect(Collectors.joining(System.lineSeparator()));
        Files.writeString(logPath.resolve("events.log"), events, StandardCharsets.UTF_8);
    }
}
