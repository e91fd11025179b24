package io.kubetest.manifest;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.kubetest.KubeTestException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads multi-document YAML manifests, rendering them with the context of a test first. The default
 * {@link TokenRenderer} replaces {@code ${key}} tokens with values of the context.
 * Kinds without a model class are returned as generic documents.
 */
public class ManifestLoader {
    private static final Logger LOGGER = LogManager.getLogger(ManifestLoader.class);

    public static final String NAMESPACE = "namespace";
    public static final String TEST_NAME = "test_name";
    public static final String TEST_NODE_ID = "test_node_id";
    public static final String DIR_PATH = "dir_path";

    private final KubernetesClient client;
    private final ManifestRenderer renderer;

    public ManifestLoader(KubernetesClient client) {
        this(client, new TokenRenderer());
    }

    public ManifestLoader(KubernetesClient client, ManifestRenderer renderer) {
        this.client = client;
        this.renderer = renderer;
    }

    public ManifestLoader withRenderer(ManifestRenderer renderer) {
        return new ManifestLoader(client, renderer);
    }

    public ManifestRenderer getRenderer() {
        return renderer;
    }

    /**
     * Rendering context of a test.
     */
    public static Map<String, String> context(String namespace, String testName, String testNodeId) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put(NAMESPACE, namespace);
        context.put(TEST_NAME, testName);
        context.put(TEST_NODE_ID, testNodeId);
        return context;
    }

    public List<HasMetadata> load(Path file, Map<String, String> context) {
        LOGGER.info("Loading manifest {}", file);
        try (InputStream source = Files.newInputStream(file); InputStream in = renderer.render(source, context)) {
            return client.load(in).items();
        } catch (IOException e) {
            throw new KubeTestException("Cannot read manifest " + file, e);
        } catch (KubernetesClientException | IllegalArgumentException e) {
            throw new KubeTestException(String.format("Cannot parse manifest %s: %s", file, e.getMessage()), e);
        }
    }

    /**
     * Load the named files of a directory in the given order, or every {@code .yaml} / {@code .yml} file
     * sorted by name when {@code files} is empty. {@code ${dir_path}} renders to the directory.
     */
    public List<HasMetadata> loadDirectory(Path dir, List<String> files, Map<String, String> context) {
        Map<String, String> dirContext = new LinkedHashMap<>(context);
        dirContext.put(DIR_PATH, dir.toAbsolutePath().toString());
        List<Path> paths;
        if (files == null || files.isEmpty()) {
            try (Stream<Path> listing = Files.list(dir)) {
                paths = listing.filter(ManifestLoader::isManifest).sorted().collect(Collectors.toList());
            } catch (IOException e) {
                throw new KubeTestException("Cannot list manifest directory " + dir, e);
            }
        } else {
            paths = files.stream().map(dir::resolve).collect(Collectors.toList());
        }
        List<HasMetadata> result = new ArrayList<>();
        for (Path path : paths) {
            result.addAll(load(path, dirContext));
        }
        return result;
    }

    /**
     * Resolve a manifest location: an existing file system path wins, otherwise a class path resource relative to {@code anchor},
     * absolute when it starts with {@code /}.
     */
    public static Path resolve(String location, Class<?> anchor) {
        Path path = Paths.get(location);
        if (Files.exists(path)) {
            return path.toAbsolutePath();
        }
        URL url = anchor.getResource(location);
        if (url == null) {
            url = anchor.getClassLoader().getResource(location);
        }
        if (url == null) {
            throw new KubeTestException(String.format("Manifest %s not found on file system or class path", location));
        }
        try {
            return Paths.get(url.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new KubeTestException("Cannot resolve manifest " + url, e);
        }
    }

    /**
     * Wrap {@code source} so every {@code ${key}} of the context is replaced by its value.
     */
    public static InputStream render(InputStream source, Map<String, String> context) {
        InputStream result = source;
        for (Map.Entry<String, String> entry : context.entrySet()) {
            if (entry.getValue() != null) {
                result = new TokenReplacingStream(result,
                        ("${" + entry.getKey() + "}").getBytes(StandardCharsets.UTF_8),
                        entry.getValue().getBytes(StandardCharsets.UTF_8));
            }
        }
        return result;
    }

    private static boolean isManifest(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return Files.isRegularFile(path) && (name.endsWith(".yaml") || name.endsWith(".yml"));
    }
}
