package io.kubetest.systemtest.framework;

import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestWorkloadsTest {

    @Test
    void testDeploymentSelectsItsTemplate() {
        Deployment deployment = TestWorkloads.deployment("web", 3);

        assertEquals(3, deployment.getSpec().getReplicas());
        assertEquals("web", deployment.getSpec().getSelector().getMatchLabels().get(TestWorkloads.APP_LABEL));
        assertEquals("web", deployment.getSpec().getTemplate().getMetadata().getLabels().get(TestWorkloads.APP_LABEL));
        assertEquals("Always", deployment.getSpec().getTemplate().getSpec().getRestartPolicy());
        List<String> command = deployment.getSpec().getTemplate().getSpec().getContainers().get(0).getCommand();
        assertTrue(command == null || command.isEmpty());
    }

    @Test
    void testJobRunsOnce() {
        Job job = TestWorkloads.job("hello", "hi");

        assertEquals(0, job.getSpec().getBackoffLimit());
        assertEquals("Never", job.getSpec().getTemplate().getSpec().getRestartPolicy());
        assertEquals(List.of("echo", "hi"), job.getSpec().getTemplate().getSpec().getContainers().get(0).getCommand());
    }
}
