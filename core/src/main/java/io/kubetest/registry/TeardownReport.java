package io.kubetest.registry;

import io.kubetest.resource.ResourceHandle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of {@link ResourceRegistry#teardown()}.
 */
public class TeardownReport {

    private final String owner;
    private final List<ResourceHandle> deleted = new ArrayList<>();
    private final List<Failure> failures = new ArrayList<>();

    public TeardownReport(String owner) {
        this.owner = owner;
    }

    void deleted(ResourceHandle handle) {
        deleted.add(handle);
    }

    void failed(ResourceHandle handle, Exception cause) {
        failures.add(new Failure(handle, cause));
    }

    public List<ResourceHandle> getDeleted() {
        return Collections.unmodifiableList(deleted);
    }

    public List<Failure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public String summary() {
        if (!hasFailures()) {
            return String.format("Teardown of %s deleted %d objects", owner, deleted.size());
        }
        return String.format("Teardown of %s deleted %d objects, %d possibly leaked: %s", owner, deleted.size(), failures.size(),
                failures.stream().map(Failure::toString).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return summary();
    }

    /**
     * An object that could not be deleted.
     */
    public static final class Failure {
        private final ResourceHandle handle;
        private final Exception cause;

        Failure(ResourceHandle handle, Exception cause) {
            this.handle = handle;
            this.cause = cause;
        }

        public ResourceHandle getHandle() {
            return handle;
        }

        public Exception getCause() {
            return cause;
        }

        @Override
        public String toString() {
            return handle + " (" + cause.getMessage() + ")";
        }
    }
}
