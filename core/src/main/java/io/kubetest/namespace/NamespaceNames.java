package io.kubetest.namespace;

import java.time.Clock;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Generates namespace names of the form {@code kubetest-<8 hex>-<epoch seconds>[-<test name>]}.
 * <p>
 * Names handed out by one instance are distinct, also when requested from many threads at once.
 */
public class NamespaceNames {

    static final String PREFIX = "kubetest";
    static final int MAX_LENGTH = 63;
    private static final int MAX_ATTEMPTS = 10;

    private final Supplier<UUID> uuids;
    private final Clock clock;
    private final Set<String> issued = ConcurrentHashMap.newKeySet();

    public NamespaceNames() {
        this(UUID::randomUUID, Clock.systemUTC());
    }

    public NamespaceNames(Supplier<UUID> uuids, Clock clock) {
        this.uuids = uuids;
        this.clock = clock;
    }

    public String next(String testName) {
        for (int i = 0; i < MAX_ATTEMPTS; i++) {
            String candidate = format(uuids.get(), clock.instant().getEpochSecond(), testName);
            if (issued.add(candidate)) {
                return candidate;
            }
        }
        throw new NamespaceCreationException(String.format("Could not generate a unique namespace name for %s in %d attempts", testName, MAX_ATTEMPTS));
    }

    /**
     * Forget an issued name, it may be handed out again.
     */
    public void forget(String name) {
        issued.remove(name);
    }

    static String format(UUID uuid, long epochSecond, String testName) {
        StringBuilder name = new StringBuilder(PREFIX)
                .append('-').append(uuid.toString(), 0, 8)
                .append('-').append(epochSecond);
        String suffix = sanitize(testName);
        if (!suffix.isEmpty()) {
            name.append('-').append(suffix);
        }
        String result = name.length() > MAX_LENGTH ? name.substring(0, MAX_LENGTH) : name.toString();
        while (result.endsWith("-")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    /**
     * Lower case, every character other than a letter or digit replaced with a dash, no dash at either end.
     */
    static String sanitize(String testName) {
        if (testName == null) {
            return "";
        }
        String result = testName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "-");
        return result.replaceAll("^-+", "").replaceAll("-+$", "");
    }
}
