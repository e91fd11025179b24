package io.kubetest.junit5;

import io.kubetest.Environment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.platform.engine.DiscoverySelector;
import org.junit.platform.launcher.Launcher;
import org.junit.platform.launcher.LauncherDiscoveryRequest;
import org.junit.platform.launcher.core.LauncherDiscoveryRequestBuilder;
import org.junit.platform.launcher.core.LauncherFactory;
import org.junit.platform.launcher.listeners.SummaryGeneratingListener;
import org.junit.platform.launcher.listeners.TestExecutionSummary;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import static org.junit.platform.engine.discovery.DiscoverySelectors.selectClass;
import static org.junit.platform.engine.discovery.DiscoverySelectors.selectPackage;

/**
 * Runs kube tests from the command line, the cluster options are handed to the tests as configuration parameters.
 */
@Command(name = "kubetest", description = "Run tests against a Kubernetes cluster", mixinStandardHelpOptions = true)
public class KubeTestLauncher implements Callable<Integer> {
    private static final Logger LOGGER = LogManager.getLogger(KubeTestLauncher.class);

    @Option(names = "--kube-config", description = "path to the kubeconfig file, defaults to $KUBECONFIG or ~/.kube/config")
    String kubeConfig;

    @Option(names = "--kube-log-level", description = "log level of the harness and cluster client, defaults to $KUBE_LOG_LEVEL or info")
    String kubeLogLevel;

    @Option(names = "--select-class", description = "fully qualified test class to run")
    List<String> classes = new ArrayList<>();

    @Option(names = "--select-package", description = "package whose test classes are run")
    List<String> packages = new ArrayList<>();

    public static void main(String[] args) {
        System.exit(new CommandLine(new KubeTestLauncher()).execute(args));
    }

    @Override
    public Integer call() {
        KubeLogLevel.apply(kubeLogLevel == null ? Environment.KUBE_LOG_LEVEL : kubeLogLevel);
        LauncherDiscoveryRequest request = request();
        if (request.getSelectorsByType(DiscoverySelector.class).isEmpty()) {
            LOGGER.error("Nothing to run, select at least one class or package");
            return 2;
        }
        Launcher launcher = LauncherFactory.create();
        SummaryGeneratingListener summary = new SummaryGeneratingListener();
        launcher.execute(request, summary);

        TestExecutionSummary result = summary.getSummary();
        result.printTo(new PrintWriter(System.out, true));
        if (result.getTotalFailureCount() > 0) {
            result.printFailuresTo(new PrintWriter(System.err, true), 20);
            return 1;
        }
        return 0;
    }

    LauncherDiscoveryRequest request() {
        List<DiscoverySelector> selectors = new ArrayList<>();
        classes.forEach(name -> selectors.add(selectClass(name)));
        packages.forEach(name -> selectors.add(selectPackage(name)));
        return LauncherDiscoveryRequestBuilder.request()
                .selectors(selectors)
                .configurationParameters(configurationParameters())
                .build();
    }

    Map<String, String> configurationParameters() {
        Map<String, String> parameters = new HashMap<>();
        if (kubeConfig != null) {
            parameters.put(KubeTestExtension.KUBE_CONFIG_PARAMETER, kubeConfig);
        }
        if (kubeLogLevel != null) {
            parameters.put(KubeTestExtension.KUBE_LOG_LEVEL_PARAMETER, kubeLogLevel);
        }
        return parameters;
    }
}
