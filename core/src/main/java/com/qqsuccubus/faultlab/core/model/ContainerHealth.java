package com.qqsuccubus.faultlab.core.model;

/**
 * Health of an infrastructure unit as seen by its container runtime.
 */
public enum ContainerHealth {
    HEALTHY,
    UNHEALTHY,
    STARTING,
    /**
     * Running, but no healthcheck is configured.
     */
    RUNNING_NO_HEALTHCHECK,
    NOT_RUNNING,
    /**
     * Status could not be determined (unit missing, runtime unreachable).
     */
    UNKNOWN;

    /**
     * Maps a Docker healthcheck status ({@code State.Health.Status}).
     *
     * @param status Raw status, may be null or blank
     * @return Matching health, or {@link #UNKNOWN} if the status is absent or unrecognized
     */
    public static ContainerHealth fromDockerStatus(String status) {
        if (status == null) {
            return UNKNOWN;
        }
        switch (status.trim().toLowerCase()) {
            case "healthy":
                return HEALTHY;
            case "unhealthy":
                return UNHEALTHY;
            case "starting":
                return STARTING;
            default:
                return UNKNOWN;
        }
    }
}
