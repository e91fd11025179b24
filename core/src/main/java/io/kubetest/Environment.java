package io.kubetest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Class which holds the harness settings.
 * <p>
 * Every value is looked up as a system property ({@code kubetest.<name>}, e.g. {@code kubetest.kube-config}),
 * then as an environment variable ({@code KUBE_CONFIG}), then in the json config file and finally falls back to the default.
 */
public class Environment {

    private static final Logger LOGGER = LogManager.getLogger(Environment.class);
    private static final Map<String, String> VALUES = new TreeMap<>();
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm");
    private static String config;
    private static final JsonNode JSON_DATA = loadConfigurationFile();

    public static final String PROPERTY_PREFIX = "kubetest.";

    /*
     * Definition of env vars
     */
    public static final String KUBE_CONFIG_ENV = "KUBE_CONFIG";
    public static final String KUBE_LOG_LEVEL_ENV = "KUBE_LOG_LEVEL";
    private static final String LOG_DIR_ENV = "LOG_DIR";
    private static final String CONFIG_FILE_PATH_ENV = "CONFIG_PATH";
    private static final String WAIT_POLL_INTERVAL_MS_ENV = "WAIT_POLL_INTERVAL_MS";
    private static final String WAIT_TIMEOUT_MS_ENV = "WAIT_TIMEOUT_MS";
    private static final String NAMESPACE_READY_TIMEOUT_MS_ENV = "NAMESPACE_READY_TIMEOUT_MS";
    private static final String NAMESPACE_DELETION_GRACE_MS_ENV = "NAMESPACE_DELETION_GRACE_MS";
    private static final String AWAIT_NAMESPACE_DELETION_ENV = "AWAIT_NAMESPACE_DELETION";
    private static final String TEST_TIMEOUT_MS_ENV = "TEST_TIMEOUT_MS";
    private static final String API_RETRY_ATTEMPTS_ENV = "API_RETRY_ATTEMPTS";
    private static final String API_RETRY_SCALE_MS_ENV = "API_RETRY_SCALE_MS";
    private static final String SKIP_TEARDOWN_ENV = "SKIP_TEARDOWN";

    /*
     * Setup constants from env variables or set default
     */
    public static final String SUITE_ROOT = System.getProperty("user.dir");
    public static final Path LOG_DIR = getOrDefault(LOG_DIR_ENV, Paths::get, Paths.get(SUITE_ROOT, "target", "logs")).resolve("test-run-" + DATE_FORMAT.format(LocalDateTime.now()));

    /**
     * Kubeconfig used to reach the cluster, null falls back to $KUBECONFIG or ~/.kube/config
     */
    public static final String KUBE_CONFIG = getOrDefault(KUBE_CONFIG_ENV, null);
    public static final String KUBE_LOG_LEVEL = getOrDefault(KUBE_LOG_LEVEL_ENV, "info");

    public static final long WAIT_POLL_INTERVAL_MS = getOrDefault(WAIT_POLL_INTERVAL_MS_ENV, Long::parseLong, 1_000L);
    public static final long WAIT_TIMEOUT_MS = getOrDefault(WAIT_TIMEOUT_MS_ENV, Long::parseLong, 300_000L);
    public static final long NAMESPACE_READY_TIMEOUT_MS = getOrDefault(NAMESPACE_READY_TIMEOUT_MS_ENV, Long::parseLong, 60_000L);
    public static final long NAMESPACE_DELETION_GRACE_MS = getOrDefault(NAMESPACE_DELETION_GRACE_MS_ENV, Long::parseLong, 120_000L);
    public static final boolean AWAIT_NAMESPACE_DELETION = getOrDefault(AWAIT_NAMESPACE_DELETION_ENV, Boolean::parseBoolean, false);
    public static final long TEST_TIMEOUT_MS = getOrDefault(TEST_TIMEOUT_MS_ENV, Long::parseLong, 600_000L);
    public static final int API_RETRY_ATTEMPTS = getOrDefault(API_RETRY_ATTEMPTS_ENV, Integer::parseInt, 5);
    public static final long API_RETRY_SCALE_MS = getOrDefault(API_RETRY_SCALE_MS_ENV, Long::parseLong, 200L);

    public static final boolean SKIP_TEARDOWN = getOrDefault(SKIP_TEARDOWN_ENV, Boolean::parseBoolean, false);

    private Environment() {
    }

    public static void logEnvironment() {
        String debugFormat = "{}: {}";
        LOGGER.info("=======================================================================");
        LOGGER.info("Used environment variables:");
        LOGGER.info(debugFormat, "CONFIG", config);
        VALUES.forEach((key, value) -> LOGGER.info(debugFormat, key, value));
        LOGGER.info("=======================================================================");
    }

    /**
     * Get value from system properties, env, config or default and parse it to String data type
     *
     * @param varName      variable name
     * @param defaultValue default string value
     * @return value of variable
     */
    public static String getOrDefault(String varName, String defaultValue) {
        return getOrDefault(varName, String::toString, defaultValue);
    }

    /**
     * Get value from system properties, env, config or default and parse it to defined type
     *
     * @param var          env variable name
     * @param converter    converter from string to defined type
     * @param defaultValue default value if variable is not set anywhere
     * @return value of variable in defined data type
     */
    public static <T> T getOrDefault(String var, Function<String, T> converter, T defaultValue) {
        String value = lookup(var, System.getProperty(propertyName(var)), System.getenv(var), JSON_DATA);
        T returnValue = defaultValue;
        if (value != null) {
            returnValue = converter.apply(value);
        }
        synchronized (VALUES) {
            VALUES.put(var, String.valueOf(returnValue));
        }
        return returnValue;
    }

    static String lookup(String var, String property, String env, JsonNode json) {
        if (property != null && !property.isBlank()) {
            return property;
        }
        if (env != null && !env.isBlank()) {
            return env;
        }
        if (json != null && json.get(var) != null) {
            return json.get(var).asText();
        }
        return null;
    }

    /**
     * @return system property name of a variable, {@code KUBE_LOG_LEVEL} becomes {@code kubetest.kube-log-level}
     */
    public static String propertyName(String var) {
        return PROPERTY_PREFIX + var.toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Load configuration fom config file
     *
     * @return json object with loaded variables
     */
    private static JsonNode loadConfigurationFile() {
        config = System.getenv().getOrDefault(CONFIG_FILE_PATH_ENV,
                Paths.get(System.getProperty("user.dir"), "config.json").toAbsolutePath().toString());
        ObjectMapper mapper = new ObjectMapper();
        File jsonFile = new File(config).getAbsoluteFile();
        if (!jsonFile.exists()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(jsonFile);
        } catch (IOException ex) {
            LOGGER.warn("Json configuration {} cannot be read: {}", config, ex.getMessage());
            return mapper.createObjectNode();
        }
    }
}
