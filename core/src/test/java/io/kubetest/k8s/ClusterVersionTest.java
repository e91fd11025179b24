package io.kubetest.k8s;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ClusterVersionTest {

    @ParameterizedTest
    @CsvSource({"28, 28", "28+, 28", "9-gke, 9", "'', ''"})
    void testMinorDigits(String minor, String expected) {
        assertEquals(expected, new ClusterVersion("v1." + minor, "1", minor).getMinorDigits());
    }

    @Test
    void testIsAtLeast() {
        ClusterVersion version = new ClusterVersion("v1.27.3-eks", "1", "27+");
        assertTrue(version.isAtLeast(1, 27));
        assertTrue(version.isAtLeast(1, 20));
        assertFalse(version.isAtLeast(1, 28));
        assertFalse(version.isAtLeast(2, 0));
        assertEquals("v1.27.3-eks", version.toString());
    }

    @Test
    void testMajorWithSuffixOrMissing() {
        assertTrue(new ClusterVersion("v1.29.1", "1+", "29").isAtLeast(1, 29));
        assertEquals("1", new ClusterVersion("v1.29.1", "1+", "29").getMajorDigits());

        ClusterVersion unknown = new ClusterVersion(null, null, null);
        assertEquals("", unknown.getMajorDigits());
        assertTrue(unknown.isAtLeast(0, 0));
        assertFalse(unknown.isAtLeast(1, 0));
    }
}
