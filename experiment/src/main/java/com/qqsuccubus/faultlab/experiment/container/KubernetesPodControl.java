package com.qqsuccubus.faultlab.experiment.container;

import com.qqsuccubus.faultlab.core.model.ContainerHealth;
import com.qqsuccubus.faultlab.core.spi.IContainerControl;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodCondition;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Container control for Cassandra pods managed by a StatefulSet.
 * <p>
 * Stopping a unit deletes its pod; starting waits for the StatefulSet controller to recreate the
 * pod under the same name. Addresses are read from the API on every call since a recreated
 * pod usually gets a new IP.
 * </p>
 */
public class KubernetesPodControl implements IContainerControl {
    private static final Logger log = LoggerFactory.getLogger(KubernetesPodControl.class);

    private static final long DELETE_GRACE_SECONDS = 30;

    private final KubernetesClient client;
    private final String namespace;
    private final Duration recreateTimeout;

    public KubernetesPodControl(String namespace) {
        this(new KubernetesClientBuilder().build(), namespace, Duration.ofSeconds(120));
    }

    public KubernetesPodControl(KubernetesClient client, String namespace, Duration recreateTimeout) {
        this.client = client;
        this.namespace = namespace;
        this.recreateTimeout = recreateTimeout;
        log.info("Pod control initialized for namespace {}", namespace);
    }

    @Override
    public Optional<String> currentAddress(String unitId) {
        try {
            Pod pod = client.pods().inNamespace(namespace).withName(unitId).get();
            if (pod != null && pod.getStatus() != null && pod.getStatus().getPodIP() != null) {
                return Optional.of(pod.getStatus().getPodIP());
            }
            return Optional.empty();
        } catch (KubernetesClientException e) {
            log.warn("Failed to get IP for pod {}: {}", unitId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean stop(String unitId) {
        log.info("Deleting pod {} in namespace {}", unitId, namespace);
        try {
            boolean deleted = !client.pods().inNamespace(namespace).withName(unitId)
                .withGracePeriod(DELETE_GRACE_SECONDS)
                .delete()
                .isEmpty();
            if (!deleted) {
                log.error("Failed to delete pod {}: not found", unitId);
            }
            return deleted;
        } catch (KubernetesClientException e) {
            log.error("Error deleting pod {}: {}", unitId, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean start(String unitId) {
        log.info("Waiting up to {}s for pod {} to be recreated", recreateTimeout.toSeconds(), unitId);
        try {
            client.pods().inNamespace(namespace).withName(unitId)
                .waitUntilCondition(pod -> pod != null && pod.getMetadata().getDeletionTimestamp() == null,
                    recreateTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Pod {} recreated", unitId);
            return true;
        } catch (KubernetesClientException e) {
            log.error("Pod {} was not recreated: {}", unitId, e.getMessage());
            return false;
        }
    }

    @Override
    public ContainerHealth healthStatus(String unitId) {
        try {
            return healthOf(client.pods().inNamespace(namespace).withName(unitId).get());
        } catch (KubernetesClientException e) {
            log.debug("Could not get health status for pod {}: {}", unitId, e.getMessage());
            return ContainerHealth.UNKNOWN;
        }
    }

    /**
     * Maps pod phase and the {@code Ready} condition to a health value.
     */
    static ContainerHealth healthOf(Pod pod) {
        if (pod == null || pod.getStatus() == null) {
            return ContainerHealth.NOT_RUNNING;
        }
        if (pod.getMetadata() != null && pod.getMetadata().getDeletionTimestamp() != null) {
            return ContainerHealth.NOT_RUNNING;
        }
        String phase = pod.getStatus().getPhase();
        if ("Pending".equals(phase)) {
            return ContainerHealth.STARTING;
        }
        if ("Failed".equals(phase)) {
            return ContainerHealth.UNHEALTHY;
        }
        if (!"Running".equals(phase)) {
            return ContainerHealth.NOT_RUNNING;
        }
        if (pod.getStatus().getConditions() == null) {
            return ContainerHealth.RUNNING_NO_HEALTHCHECK;
        }
        return pod.getStatus().getConditions().stream()
            .filter(c -> "Ready".equals(c.getType()))
            .map(PodCondition::getStatus)
            .findFirst()
            .map(status -> "True".equals(status) ? ContainerHealth.HEALTHY : ContainerHealth.STARTING)
            .orElse(ContainerHealth.RUNNING_NO_HEALTHCHECK);
    }

    @Override
    public void close() {
        client.close();
        log.info("Pod control closed");
    }
}
