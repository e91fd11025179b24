package io.kubetest.junit5;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import java.util.Locale;

/**
 * Applies {@code --kube-log-level} to the harness and cluster client loggers.
 */
public final class KubeLogLevel {
    private static final Logger LOGGER = LogManager.getLogger(KubeLogLevel.class);

    public static final String HARNESS_LOGGER = "io.kubetest";
    public static final String CLIENT_LOGGER = "io.fabric8.kubernetes";

    private KubeLogLevel() {
    }

    /**
     * @throws IllegalArgumentException for a name that is not a log4j level
     */
    public static Level parse(String level) {
        Level parsed = Level.getLevel(level.trim().toUpperCase(Locale.ROOT));
        if (parsed == null) {
            throw new IllegalArgumentException("Unknown log level " + level);
        }
        return parsed;
    }

    public static void apply(String level) {
        Level parsed = parse(level);
        Configurator.setLevel(HARNESS_LOGGER, parsed);
        Configurator.setLevel(CLIENT_LOGGER, parsed);
        LOGGER.debug("Kube log level set to {}", parsed);
    }
}
