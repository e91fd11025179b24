package io.kubetest.systemtest.framework;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.fabric8.kubernetes.api.model.PodTemplateSpecBuilder;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.Job;
import io.fabric8.kubernetes.api.model.batch.v1.JobBuilder;

import java.util.Map;

/**
 * Small workloads used by the system tests.
 */
public final class TestWorkloads {

    public static final String IMAGE = "registry.k8s.io/pause:3.9";
    public static final String BUSYBOX = "busybox:1.36";
    public static final String APP_LABEL = "app";

    private TestWorkloads() {
    }

    public static Deployment deployment(String name, int replicas) {
        return new DeploymentBuilder()
                .withNewMetadata()
                    .withName(name)
                    .addToLabels(APP_LABEL, name)
                .endMetadata()
                .withNewSpec()
                    .withReplicas(replicas)
                    .withNewSelector()
                        .addToMatchLabels(APP_LABEL, name)
                    .endSelector()
                    .withTemplate(template(name, IMAGE, null))
                .endSpec()
                .build();
    }

    /**
     * Job running one pod which prints {@code message} and exits.
     */
    public static Job job(String name, String message) {
        return new JobBuilder()
                .withNewMetadata()
                    .withName(name)
                .endMetadata()
                .withNewSpec()
                    .withBackoffLimit(0)
                    .withTemplate(template(name, BUSYBOX, new String[] {"echo", message}))
                .endSpec()
                .build();
    }

    public static Service service(String name, int port) {
        return new ServiceBuilder()
                .withNewMetadata()
                    .withName(name)
                .endMetadata()
                .withNewSpec()
                    .addToSelector(APP_LABEL, name)
                    .addNewPort()
                        .withPort(port)
                    .endPort()
                .endSpec()
                .build();
    }

    public static ConfigMap configMap(String name, Map<String, String> data) {
        return new ConfigMapBuilder()
                .withNewMetadata()
                    .withName(name)
                .endMetadata()
                .withData(data)
                .build();
    }

    private static PodTemplateSpec template(String name, String image, String[] command) {
        return new PodTemplateSpecBuilder()
                .withNewMetadata()
                    .addToLabels(APP_LABEL, name)
                .endMetadata()
                .withNewSpec()
                    .withRestartPolicy(command == null ? "Always" : "Never")
                    .addNewContainer()
                        .withName(name)
                        .withImage(image)
                        .withCommand(command)
                    .endContainer()
                .endSpec()
                .build();
    }
}
