package com.qqsuccubus.faultlab.experiment.run;

import com.qqsuccubus.faultlab.core.model.PartitionToken;
import com.qqsuccubus.faultlab.experiment.config.ContainerRuntime;
import com.qqsuccubus.faultlab.experiment.config.ExperimentConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeFailureExperimentTest {
    private FakeCluster cluster;
    private ExperimentConfig config;

    @BeforeEach
    void setUp() {
        cluster = new FakeCluster();
        config = ExperimentConfig.builder()
            .contactPoints(List.of("localhost"))
            .port(9042)
            .localDatacenter("datacenter1")
            .keyspace("experiment_rf1")
            .tableName("test_data")
            .testKey("experiment-key-001")
            .testValue("payload")
            .replicationFactor(1)
            .containerNames(List.of("cassandra-node1", "cassandra-node2", "cassandra-node3"))
            .containerRuntime(ContainerRuntime.DOCKER)
            .expectedNodes(3)
            .pollInterval(Duration.ofMillis(10))
            .clusterWait(Duration.ofSeconds(2))
            .detectionDelay(Duration.ofMillis(5))
            .healthWait(Duration.ofSeconds(2))
            .healthSettleDelay(Duration.ofMillis(5))
            .queryRetriesAfterStop(2)
            .queryRetriesAfterRestart(2)
            .queryRetryDelay(Duration.ofMillis(5))
            .build();
    }

    private NodeFailureExperiment experiment() {
        return new NodeFailureExperiment(config, cluster, cluster, new ExperimentReporter(null));
    }

    @Test
    @DisplayName("Owner is stopped, data disappears, then comes back: exit code 0")
    void testExpectedOutcome() {
        NodeFailureExperiment experiment = experiment();

        int exitCode = experiment.run();

        assertEquals(0, exitCode);
        assertEquals(List.of("cassandra-node2"), cluster.stopped);
        assertEquals(List.of("cassandra-node2"), cluster.started);
        assertTrue(cluster.closed);

        ExperimentResult result = experiment.getResult().orElseThrow();
        assertEquals("10.0.0.2", result.getReplicaNode());
        assertEquals("cassandra-node2", result.getContainer());
        assertEquals(PartitionToken.Source.CLUSTER_QUERY, result.getTokenSource());
        assertEquals(-4069959284402364209L, result.getToken());
        assertFalse(result.isDataAvailableAfterStop());
        assertTrue(result.isDataAvailableAfterRestart());
        assertTrue(result.isContainerHealthy());
        assertTrue(result.isNodeRecognizedAfterRestart());
    }

    @Test
    void testDataStillReadableWhileNodeDownIsUnexpected() {
        cluster.survivesNodeLoss = true;
        NodeFailureExperiment experiment = experiment();

        assertEquals(1, experiment.run());
        assertTrue(experiment.getResult().orElseThrow().isDataAvailableAfterStop());
    }

    @Test
    @DisplayName("Unresolved container mapping aborts before anything is stopped")
    void testUnresolvedMappingAbortsBeforeStop() {
        cluster.containerAddresses.replaceAll((unit, address) -> "172.16.0.9");

        assertEquals(1, experiment().run());
        assertTrue(cluster.stopped.isEmpty());
    }

    @Test
    void testUnknownKeyspaceAbortsBeforeStop() {
        cluster.registerKeyspaces = false;
        NodeFailureExperiment experiment = experiment();

        assertEquals(1, experiment.run());
        assertTrue(cluster.stopped.isEmpty());
        assertTrue(experiment.getResult().isEmpty());
    }

    @Test
    void testConnectionFailure() {
        cluster.connectable = false;

        assertEquals(1, experiment().run());
        assertTrue(cluster.closed);
    }

    @Test
    void testClusterNotReady() {
        cluster.nodeUp.put("10.0.0.3", false);
        config = config.toBuilder().clusterWait(Duration.ofMillis(100)).build();

        assertEquals(1, experiment().run());
        assertTrue(cluster.stopped.isEmpty());
    }
}
