package io.kubetest.namespace;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestNamespaceTest {

    @Test
    void testPhasesOnlyMoveForward() {
        TestNamespace ns = new TestNamespace("kubetest-abc", true, NamespacePhase.PENDING);

        assertTrue(ns.advance(NamespacePhase.ACTIVE));
        assertFalse(ns.advance(NamespacePhase.ACTIVE));
        assertFalse(ns.advance(NamespacePhase.PENDING));
        assertTrue(ns.advance(NamespacePhase.GONE));
        assertFalse(ns.advance(NamespacePhase.TERMINATING));
        assertEquals(NamespacePhase.GONE, ns.getPhase());
        assertTrue(ns.getPhase().isTerminal());
    }

    @Test
    void testToString() {
        assertEquals("default (ACTIVE, unmanaged)", new TestNamespace("default", false, NamespacePhase.ACTIVE).toString());
    }
}
