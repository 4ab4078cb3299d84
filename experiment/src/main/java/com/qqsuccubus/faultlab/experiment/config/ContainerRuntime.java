package com.qqsuccubus.faultlab.experiment.config;

/**
 * Backend used to stop, start and inspect the units hosting Cassandra nodes.
 */
public enum ContainerRuntime {
    /**
     * Docker Engine API through docker-java.
     */
    DOCKER,
    /**
     * The {@code docker} command line.
     */
    DOCKER_CLI,
    /**
     * Kubernetes pods managed by a StatefulSet.
     */
    KUBERNETES;

    public static ContainerRuntime fromString(String value) {
        if (value == null || value.isBlank()) {
            return DOCKER;
        }
        switch (value.trim().toLowerCase()) {
            case "docker-cli":
            case "cli":
                return DOCKER_CLI;
            case "kubernetes":
            case "k8s":
                return KUBERNETES;
            case "docker":
                return DOCKER;
            default:
                throw new IllegalArgumentException("Unknown container runtime: " + value);
        }
    }
}
