package io.kubetest.k8s;

import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirement;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds label selector strings understood by the API server.
 */
public class Selectors {
    private static final Logger LOGGER = LogManager.getLogger(Selectors.class);

    private Selectors() {
    }

    /**
     * {@code {"app": "nginx", "tier": 2}} becomes {@code app=nginx,tier=2}, iteration order of the map is kept.
     */
    public static String selectorString(Map<String, ?> labels) {
        if (labels == null || labels.isEmpty()) {
            return "";
        }
        return labels.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
    }

    /**
     * Selector string of a workload {@code spec.selector}, null when it selects nothing.
     */
    public static String selectorString(LabelSelector selector) {
        if (selector == null) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        if (selector.getMatchLabels() != null && !selector.getMatchLabels().isEmpty()) {
            parts.add(selectorString(selector.getMatchLabels()));
        }
        if (selector.getMatchExpressions() != null) {
            for (LabelSelectorRequirement expression : selector.getMatchExpressions()) {
                String values = expression.getValues() == null ? "" : String.join(",", expression.getValues());
                switch (expression.getOperator()) {
                    case "In":
                        parts.add(String.format("%s in (%s)", expression.getKey(), values));
                        break;
                    case "NotIn":
                        parts.add(String.format("%s notin (%s)", expression.getKey(), values));
                        break;
                    case "Exists":
                        parts.add(expression.getKey());
                        break;
                    case "DoesNotExist":
                        parts.add("!" + expression.getKey());
                        break;
                    default:
                        LOGGER.warn("Unsupported match expression operator: {}", expression.getOperator());
                }
            }
        }
        return parts.isEmpty() ? null : String.join(",", parts);
    }
}
