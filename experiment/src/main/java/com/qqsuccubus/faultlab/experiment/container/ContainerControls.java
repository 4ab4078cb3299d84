package com.qqsuccubus.faultlab.experiment.container;

import com.qqsuccubus.faultlab.core.spi.IContainerControl;
import com.qqsuccubus.faultlab.experiment.config.ExperimentConfig;

/**
 * Creates the container control matching the configured runtime.
 */
public final class ContainerControls {
    private ContainerControls() {
    }

    public static IContainerControl create(ExperimentConfig config) {
        switch (config.getContainerRuntime()) {
            case DOCKER_CLI:
                return new DockerCliContainerControl();
            case KUBERNETES:
                return new KubernetesPodControl(config.getKubernetesNamespace());
            case DOCKER:
            default:
                return new DockerContainerControl();
        }
    }
}
