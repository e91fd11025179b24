package io.kubetest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class EnvironmentTest {

    private static JsonNode json(String text) throws Exception {
        return new ObjectMapper().readTree(text);
    }

    @Test
    void testLookupOrder() throws Exception {
        JsonNode config = json("{\"WAIT_TIMEOUT_MS\": 1000}");

        assertEquals("3", Environment.lookup("WAIT_TIMEOUT_MS", "3", "2", config));
        assertEquals("2", Environment.lookup("WAIT_TIMEOUT_MS", null, "2", config));
        assertEquals("1000", Environment.lookup("WAIT_TIMEOUT_MS", " ", null, config));
        assertNull(Environment.lookup("SKIP_TEARDOWN", null, null, config));
    }

    @Test
    void testPropertyName() {
        assertEquals("kubetest.kube-log-level", Environment.propertyName(Environment.KUBE_LOG_LEVEL_ENV));
        assertEquals("kubetest.kube-config", Environment.propertyName(Environment.KUBE_CONFIG_ENV));
    }

    @Test
    void testDefaultValue() {
        assertEquals(Integer.valueOf(42), Environment.getOrDefault("KUBETEST_TEST_UNSET_VARIABLE", Integer::parseInt, 42));
        assertEquals("fallback", Environment.getOrDefault("KUBETEST_TEST_UNSET_VARIABLE", "fallback"));
    }
}
