package io.kubetest.wait;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.kubetest.KubeTestException;
import io.kubetest.k8s.KubeClient;

import java.time.Duration;

/**
 * A wait condition never became true within its time budget.
 */
public class ConditionTimeoutException extends KubeTestException {

    private final transient GenericKubernetesResource lastObserved;
    private final Duration timeout;

    public ConditionTimeoutException(String description, Duration timeout, GenericKubernetesResource lastObserved) {
        super(String.format("Waiting for %s timeout %s ms exceeded, last observed state:%n%s",
                description, timeout.toMillis(), lastObserved == null ? "<none>" : KubeClient.toYaml(lastObserved)));
        this.timeout = timeout;
        this.lastObserved = lastObserved;
    }

    /**
     * @return the last state seen before giving up, null if the object was never observed
     */
    public GenericKubernetesResource getLastObserved() {
        return lastObserved;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
