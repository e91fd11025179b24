package io.kubetest.manifest;

import java.io.InputStream;
import java.util.Map;

/**
 * Default renderer, replaces every {@code ${key}} of the context by its value.
 */
public class TokenRenderer implements ManifestRenderer {

    @Override
    public InputStream render(InputStream template, Map<String, String> context) {
        return ManifestLoader.render(template, context);
    }
}
