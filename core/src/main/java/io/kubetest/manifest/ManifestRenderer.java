package io.kubetest.manifest;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Turns a manifest template into the YAML that is parsed, given the rendering context of the test.
 * Implementations used from annotations need a public no-argument constructor.
 */
@FunctionalInterface
public interface ManifestRenderer {

    InputStream render(InputStream template, Map<String, String> context) throws IOException;
}
