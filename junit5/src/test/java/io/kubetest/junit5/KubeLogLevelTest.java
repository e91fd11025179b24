package io.kubetest.junit5;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class KubeLogLevelTest {

    @AfterEach
    void reset() {
        Configurator.setLevel(KubeLogLevel.HARNESS_LOGGER, Level.INFO);
        Configurator.setLevel(KubeLogLevel.CLIENT_LOGGER, Level.WARN);
    }

    @ParameterizedTest
    @CsvSource({
        "debug, DEBUG",
        "INFO, INFO",
        " warn , WARN",
        "trace, TRACE"
    })
    void testParse(String input, String expected) {
        assertEquals(Level.getLevel(expected), KubeLogLevel.parse(input));
    }

    @Test
    void testUnknownLevel() {
        assertThrows(IllegalArgumentException.class, () -> KubeLogLevel.parse("loud"));
    }

    @Test
    void testApplySetsHarnessAndClientLoggers() {
        KubeLogLevel.apply("debug");

        assertEquals(Level.DEBUG, LogManager.getLogger("io.kubetest.registry.ResourceRegistry").getLevel());
        assertEquals(Level.DEBUG, LogManager.getLogger("io.fabric8.kubernetes.client.Config").getLevel());
    }
}
