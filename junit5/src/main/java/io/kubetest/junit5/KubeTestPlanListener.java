package io.kubetest.junit5;

import io.kubetest.Environment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.platform.engine.ConfigurationParameters;
import org.junit.platform.launcher.TestExecutionListener;
import org.junit.platform.launcher.TestIdentifier;
import org.junit.platform.launcher.TestPlan;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prepares the log directory and the log level once per test run.
 */
public class KubeTestPlanListener implements TestExecutionListener {

    private static final Logger LOGGER = LogManager.getLogger(KubeTestPlanListener.class);
    private static final String DIVIDER = "=======================================================================";

    @Override
    public void testPlanExecutionStarted(TestPlan testPlan) {
        LOGGER.info(DIVIDER);
        LOGGER.info(DIVIDER);
        LOGGER.info("                        Test run started");
        LOGGER.info(DIVIDER);
        LOGGER.info(DIVIDER);

        KubeLogLevel.apply(logLevel(testPlan.getConfigurationParameters()));
        Environment.logEnvironment();
        printSelectedTestClasses(getSelectedTestClassNames(testPlan));

        try {
            Files.createDirectories(Environment.LOG_DIR);
        } catch (IOException e) {
            LOGGER.warn("Test suite cannot create log dirs");
            throw new UncheckedIOException("Log folders cannot be created", e);
        }
    }

    @Override
    public void testPlanExecutionFinished(TestPlan testPlan) {
        LOGGER.info(DIVIDER);
        LOGGER.info(DIVIDER);
        LOGGER.info("                        Test run finished");
        LOGGER.info(DIVIDER);
        LOGGER.info(DIVIDER);
    }

    /**
     * @return the level given to the launcher, else the one of the environment or config file
     */
    static String logLevel(ConfigurationParameters parameters) {
        return parameters.get(KubeTestExtension.KUBE_LOG_LEVEL_PARAMETER).orElse(Environment.KUBE_LOG_LEVEL);
    }

    static List<String> getSelectedTestClassNames(TestPlan plan) {
        return plan.getRoots().stream()
                .flatMap(root -> plan.getChildren(root).stream())
                .map(TestIdentifier::getLegacyReportingName)
                .collect(Collectors.toList());
    }

    private void printSelectedTestClasses(List<String> testClasses) {
        if (testClasses.isEmpty()) {
            LOGGER.info("No test classes are selected for run");
        } else {
            LOGGER.info("Following test classes are selected for run:");
            testClasses.forEach(testIdentifier -> LOGGER.info("-> {}", testIdentifier));
        }
        LOGGER.info(DIVIDER);
    }
}
