package com.qqsuccubus.faultlab.experiment.container;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.ContainerNetwork;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import com.qqsuccubus.faultlab.core.model.ContainerHealth;
import com.qqsuccubus.faultlab.core.spi.IContainerControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Container control over the Docker Engine API (docker-java).
 * <p>
 * The client is configured from the standard Docker environment ({@code DOCKER_HOST},
 * {@code DOCKER_TLS_VERIFY}, ...), defaulting to the local socket.
 * </p>
 */
public class DockerContainerControl implements IContainerControl {
    private static final Logger log = LoggerFactory.getLogger(DockerContainerControl.class);

    private static final int STOP_TIMEOUT_SECONDS = 30;

    private final DockerClient client;

    public DockerContainerControl() {
        DockerClientConfig config = DefaultDockerClientConfig.createDefaultConfigBuilder().build();
        DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
            .dockerHost(config.getDockerHost())
            .sslConfig(config.getSSLConfig())
            .connectionTimeout(Duration.ofSeconds(10))
            .responseTimeout(Duration.ofSeconds(STOP_TIMEOUT_SECONDS + 15))
            .build();
        this.client = DockerClientImpl.getInstance(config, httpClient);
        log.info("Docker client initialized for {}", config.getDockerHost());
    }

    public DockerContainerControl(DockerClient client) {
        this.client = client;
    }

    @Override
    public boolean stop(String unitId) {
        log.info("Stopping container: {}", unitId);
        try {
            client.stopContainerCmd(unitId).withTimeout(STOP_TIMEOUT_SECONDS).exec();
            log.info("Successfully stopped {}", unitId);
            return true;
        } catch (NotFoundException e) {
            log.error("Failed to stop {}: container not found", unitId);
            return false;
        } catch (RuntimeException e) {
            log.error("Error stopping container {}: {}", unitId, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean start(String unitId) {
        log.info("Starting container: {}", unitId);
        try {
            client.startContainerCmd(unitId).exec();
            log.info("Successfully started {}", unitId);
            return true;
        } catch (NotFoundException e) {
            log.error("Failed to start {}: container not found", unitId);
            return false;
        } catch (RuntimeException e) {
            log.error("Error starting container {}: {}", unitId, e.getMessage());
            return false;
        }
    }

    @Override
    public ContainerHealth healthStatus(String unitId) {
        try {
            InspectContainerResponse.ContainerState state = client.inspectContainerCmd(unitId).exec().getState();
            if (state.getHealth() != null && state.getHealth().getStatus() != null) {
                return ContainerHealth.fromDockerStatus(state.getHealth().getStatus());
            }
            return Boolean.TRUE.equals(state.getRunning())
                ? ContainerHealth.RUNNING_NO_HEALTHCHECK
                : ContainerHealth.NOT_RUNNING;
        } catch (RuntimeException e) {
            log.debug("Could not get health status for {}: {}", unitId, e.getMessage());
            return ContainerHealth.UNKNOWN;
        }
    }

    @Override
    public Optional<String> currentAddress(String unitId) {
        try {
            InspectContainerResponse response = client.inspectContainerCmd(unitId).exec();
            if (response.getNetworkSettings() == null || response.getNetworkSettings().getNetworks() == null) {
                return Optional.empty();
            }
            // First network with an assigned IP
            for (Map.Entry<String, ContainerNetwork> network : response.getNetworkSettings().getNetworks().entrySet()) {
                String ip = network.getValue().getIpAddress();
                if (ip != null && !ip.isEmpty()) {
                    return Optional.of(ip);
                }
            }
            return Optional.empty();
        } catch (RuntimeException e) {
            log.info("Could not inspect container {}: {}", unitId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void close() {
        try {
            client.close();
            log.info("Docker client closed");
        } catch (IOException e) {
            log.warn("Failed to close Docker client: {}", e.getMessage());
        }
    }
}
