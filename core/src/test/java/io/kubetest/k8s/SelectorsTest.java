package io.kubetest.k8s;

import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.LabelSelectorBuilder;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class SelectorsTest {

    @Test
    void testSelectorStringFromLabels() {
        Map<String, Object> labels = new LinkedHashMap<>();
        labels.put("foo", "bar");
        labels.put("abc", "xyz");
        assertEquals("foo=bar,abc=xyz", Selectors.selectorString(labels));
    }

    @Test
    void testSelectorStringKeepsNonStringValues() {
        Map<String, Object> labels = new LinkedHashMap<>();
        labels.put("tier", 2);
        labels.put("canary", true);
        assertEquals("tier=2,canary=true", Selectors.selectorString(labels));
    }

    @Test
    void testEmptyLabels() {
        assertEquals("", Selectors.selectorString(Collections.<String, String>emptyMap()));
        assertEquals("", Selectors.selectorString((Map<String, String>) null));
    }

    @Test
    void testLabelSelectorWithExpressions() {
        LabelSelector selector = new LabelSelectorBuilder()
                .addToMatchLabels("app", "nginx")
                .addNewMatchExpression()
                    .withKey("env")
                    .withOperator("In")
                    .withValues("dev", "qa")
                .endMatchExpression()
                .addNewMatchExpression()
                    .withKey("tier")
                    .withOperator("NotIn")
                    .withValues("db")
                .endMatchExpression()
                .addNewMatchExpression()
                    .withKey("managed")
                    .withOperator("Exists")
                .endMatchExpression()
                .addNewMatchExpression()
                    .withKey("legacy")
                    .withOperator("DoesNotExist")
                .endMatchExpression()
                .build();

        assertEquals("app=nginx,env in (dev,qa),tier notin (db),managed,!legacy", Selectors.selectorString(selector));
    }

    @Test
    void testEmptyLabelSelector() {
        assertNull(Selectors.selectorString(new LabelSelector()));
        assertNull(Selectors.selectorString((LabelSelector) null));
    }
}
