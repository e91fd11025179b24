package io.kubetest.systemtest.framework;

import org.junit.jupiter.api.DisplayNameGenerator;

import java.lang.reflect.Method;
import java.util.Locale;

/**
 * Turns {@code testDeploymentBecomesReady} into {@code deployment becomes ready}.
 */
public class IndicativeSentences extends DisplayNameGenerator.ReplaceUnderscores {

    @Override
    public String generateDisplayNameForMethod(Class<?> testClass, Method testMethod) {
        return sentence(testMethod.getName());
    }

    static String sentence(String methodName) {
        String name = methodName.startsWith("test") && methodName.length() > 4 ? methodName.substring(4) : methodName;
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_') {
                result.append(' ');
            } else if (Character.isUpperCase(c)) {
                if (result.length() > 0 && result.charAt(result.length() - 1) != ' ') {
                    result.append(' ');
                }
                result.append(Character.toLowerCase(c));
            } else {
                result.append(c);
            }
        }
        return result.toString().trim().toLowerCase(Locale.ROOT);
    }
}
