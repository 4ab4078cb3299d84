package com.qqsuccubus.faultlab.experiment.run;

import com.qqsuccubus.faultlab.core.error.OwnershipException;
import com.qqsuccubus.faultlab.core.hash.TokenCodec;
import com.qqsuccubus.faultlab.core.model.NodeDescriptor;
import com.qqsuccubus.faultlab.core.model.ReplicaOwnership;
import com.qqsuccubus.faultlab.core.ownership.ContainerMapper;
import com.qqsuccubus.faultlab.core.ownership.ReplicaOwnershipResolver;
import com.qqsuccubus.faultlab.core.ownership.ReplicaSetResolver;
import com.qqsuccubus.faultlab.core.ownership.TokenResolver;
import com.qqsuccubus.faultlab.core.spi.IClusterTopology;
import com.qqsuccubus.faultlab.core.spi.IContainerControl;
import com.qqsuccubus.faultlab.experiment.cassandra.DataRecord;
import com.qqsuccubus.faultlab.experiment.cassandra.ICassandraRepository;
import com.qqsuccubus.faultlab.experiment.config.ExperimentConfig;
import com.qqsuccubus.faultlab.experiment.container.ContainerHealthWaiter;
import com.qqsuccubus.faultlab.experiment.probe.AvailabilityProbe;
import com.qqsuccubus.faultlab.experiment.probe.ClusterReadinessWaiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Stops the node that owns a test row, checks the row's availability while the node is down and
 * after it comes back.
 * <p>
 * Run as an ordered sequence of steps. Any setup step that fails aborts the run with exit code 1
 * before a container is touched. Once a container is stopped, failures while probing data are
 * recorded in the result rather than aborting.
 * </p>
 */
public class NodeFailureExperiment {
    private static final Logger log = LoggerFactory.getLogger(NodeFailureExperiment.class);
    private static final String RULE = "=".repeat(80);

    private final ExperimentConfig config;
    private final ICassandraRepository repository;
    private final IContainerControl containerControl;
    private final ContainerHealthWaiter healthWaiter;
    private final AvailabilityProbe probe;
    private final ExperimentReporter reporter;

    private ExperimentResult result;

    public NodeFailureExperiment(
            ExperimentConfig config,
            ICassandraRepository repository,
            IContainerControl containerControl,
            ExperimentReporter reporter
    ) {
        this.config = config;
        this.repository = repository;
        this.containerControl = containerControl;
        this.healthWaiter = new ContainerHealthWaiter(
            containerControl, config.getPollInterval(), config.getHealthSettleDelay());
        this.probe = new AvailabilityProbe();
        this.reporter = reporter;
    }

    /**
     * Runs every step and reports the outcome.
     *
     * @return 0 if the data was unavailable while its node was down and available after restart, 1 otherwise
     */
    public int run() {
        log.info(RULE);
        log.info("Node Failure Experiment: RF={} Data Availability Test", config.getReplicationFactor());
        log.info(RULE);
        try {
            return execute();
        } catch (OwnershipException e) {
            log.error("✗ Could not determine which node holds the data: {}", e.getMessage());
            return 1;
        } finally {
            repository.close();
        }
    }

    public Optional<ExperimentResult> getResult() {
        return Optional.ofNullable(result);
    }

    private int execute() {
        Instant startedAt = Instant.now();
        String keyspace = config.getKeyspace();
        String table = config.getTableName();
        String key = config.getTestKey();

        log.info("[Step 1] Connecting to Cassandra cluster...");
        if (!repository.connect()) {
            return 1;
        }
        IClusterTopology topology = repository.topology();
        Boolean ready = new ClusterReadinessWaiter(topology, config.getPollInterval())
            .waitForNodes(config.getExpectedNodes(), config.getClusterWait())
            .block();
        if (!Boolean.TRUE.equals(ready)) {
            log.error("✗ Cluster not ready");
            return 1;
        }

        log.info("[Step 2] Creating keyspace with replication_factor={}...", config.getReplicationFactor());
        if (!repository.createKeyspace(keyspace, config.getReplicationFactor())) {
            return 1;
        }

        log.info("[Step 3] Creating table...");
        if (!repository.createTable(keyspace, table)) {
            return 1;
        }

        log.info("[Step 4] Inserting test data...");
        DataRecord record = DataRecord.builder()
            .id(key)
            .value(config.getTestValue())
            .timestamp(Instant.now())
            .build();
        if (!repository.insert(keyspace, table, record)) {
            return 1;
        }

        log.info("[Step 5] Verifying data is accessible before node removal...");
        if (readWithRetries("read before failure", 1).isEmpty()) {
            log.error("✗ Test data is not readable");
            return 1;
        }

        log.info("[Step 6] Identifying which node holds the data...");
        topology.refresh(keyspace);
        ReplicaOwnershipResolver ownershipResolver = new ReplicaOwnershipResolver(
            topology,
            new TokenResolver(repository.tokenQuery(), new TokenCodec()),
            new ReplicaSetResolver());
        ReplicaOwnership ownership = ownershipResolver.resolve(keyspace, table, key);
        Optional<String> primary = ownership.primary();
        if (primary.isEmpty()) {
            log.error("✗ Could not determine which node holds the data");
            return 1;
        }
        String replicaNode = primary.get();
        log.info("✓ Data is stored on node: {}", replicaNode);

        Optional<String> container = new ContainerMapper(containerControl)
            .map(replicaNode, config.getContainerNames(), topology);
        if (container.isEmpty()) {
            log.error("✗ Could not determine which container to stop");
            logAvailableHosts(topology.allNodes());
            return 1;
        }
        String unit = container.get();
        log.info("✓ Will stop container: {}", unit);

        log.info("[Step 7] Stopping the node that holds the data...");
        if (!containerControl.stop(unit)) {
            log.error("✗ Failed to stop node");
            return 1;
        }
        log.info("Waiting {}s for cluster to detect node failure...", config.getDetectionDelay().toSeconds());
        Mono.delay(config.getDetectionDelay()).block();

        log.info("[Step 8] Attempting to query data after node removal...");
        topology.refresh(keyspace);
        boolean availableAfterStop = readWithRetries("read while node is down",
            config.getQueryRetriesAfterStop()).isPresent();

        log.info("[Step 9] Restarting the node that holds the data...");
        if (!containerControl.start(unit)) {
            log.error("✗ Failed to start node");
            return 1;
        }
        boolean healthy = Boolean.TRUE.equals(healthWaiter.waitUntilHealthy(unit, config.getHealthWait()).block());
        if (!healthy) {
            log.warn("Container did not become healthy, continuing with query test...");
        }
        log.info("Refreshing cluster metadata...");
        topology.refresh(keyspace);
        boolean recognized = isRecognizedAsUp(topology, replicaNode);

        log.info("[Step 10] Attempting to query data after node restart...");
        boolean availableAfterRestart = readWithRetries("read after restart",
            config.getQueryRetriesAfterRestart()).isPresent();

        result = ExperimentResult.builder()
            .keyspace(keyspace)
            .replicationFactor(config.getReplicationFactor())
            .testKey(key)
            .token(ownership.getResolvedToken().getToken().getValue())
            .tokenSource(ownership.getResolvedToken().getToken().getSource())
            .replicaAddresses(ownership.getReplicaAddresses())
            .replicaNode(replicaNode)
            .container(unit)
            .dataAvailableAfterStop(availableAfterStop)
            .containerHealthy(healthy)
            .nodeRecognizedAfterRestart(recognized)
            .dataAvailableAfterRestart(availableAfterRestart)
            .startedAt(startedAt)
            .finishedAt(Instant.now())
            .build();

        log.info("[Step 11] Reporting results...");
        reporter.report(result);
        return result.exitCode();
    }

    private Optional<DataRecord> readWithRetries(String description, int attempts) {
        return probe.untilPresent(description,
                () -> repository.query(config.getKeyspace(), config.getTableName(), config.getTestKey()),
                attempts,
                config.getQueryRetryDelay())
            .blockOptional()
            .flatMap(found -> found);
    }

    private boolean isRecognizedAsUp(IClusterTopology topology, String replicaNode) {
        Collection<NodeDescriptor> nodes = topology.allNodes();
        long up = nodes.stream().filter(NodeDescriptor::isReachable).count();
        boolean recognized = nodes.stream().anyMatch(n -> n.isReachable() && n.isKnownAs(replicaNode));
        if (recognized) {
            log.info("✓ Node {} is back up and recognized by cluster", replicaNode);
        } else {
            log.warn("Node {} not yet recognized by cluster ({}/{} nodes up)", replicaNode, up, nodes.size());
        }
        return recognized;
    }

    private static void logAvailableHosts(Collection<NodeDescriptor> nodes) {
        log.info("Available hosts:");
        for (NodeDescriptor node : nodes) {
            log.info("  - {} (broadcast: {})", node.getPrimaryAddress(), node.getBroadcastAddress());
        }
    }
}
