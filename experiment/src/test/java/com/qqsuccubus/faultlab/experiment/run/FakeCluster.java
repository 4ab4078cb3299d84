package com.qqsuccubus.faultlab.experiment.run;

import com.qqsuccubus.faultlab.core.model.ContainerHealth;
import com.qqsuccubus.faultlab.core.model.NodeDescriptor;
import com.qqsuccubus.faultlab.core.model.PartitionToken;
import com.qqsuccubus.faultlab.core.model.ReplicationMetadata;
import com.qqsuccubus.faultlab.core.model.TokenRow;
import com.qqsuccubus.faultlab.core.spi.IClusterTopology;
import com.qqsuccubus.faultlab.core.spi.IContainerControl;
import com.qqsuccubus.faultlab.core.spi.IPartitionTokenQuery;
import com.qqsuccubus.faultlab.experiment.cassandra.DataRecord;
import com.qqsuccubus.faultlab.experiment.cassandra.ICassandraRepository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Three-node cluster simulated in memory. Stopping a container takes its node down, and rows owned
 * by a down node become unreadable unless {@link #survivesNodeLoss} is set.
 */
class FakeCluster implements ICassandraRepository, IClusterTopology, IContainerControl {
    final Map<String, String> containerAddresses = new LinkedHashMap<>();
    final Map<String, Boolean> nodeUp = new LinkedHashMap<>();
    final Map<String, ReplicationMetadata> keyspaces = new HashMap<>();
    final Map<String, DataRecord> rows = new HashMap<>();
    final List<String> stopped = new ArrayList<>();
    final List<String> started = new ArrayList<>();

    String ownerAddress = "10.0.0.2";
    boolean connectable = true;
    boolean registerKeyspaces = true;
    boolean survivesNodeLoss = false;
    boolean closed = false;

    FakeCluster() {
        addNode("cassandra-node1", "10.0.0.1");
        addNode("cassandra-node2", "10.0.0.2");
        addNode("cassandra-node3", "10.0.0.3");
    }

    private void addNode(String container, String address) {
        containerAddresses.put(container, address);
        nodeUp.put(address, true);
    }

    // Repository

    @Override
    public boolean connect() {
        return connectable;
    }

    @Override
    public boolean createKeyspace(String keyspace, int replicationFactor) {
        if (registerKeyspaces) {
            keyspaces.put(keyspace, ReplicationMetadata.builder()
                .strategyClass("org.apache.cassandra.locator.SimpleStrategy")
                .option(ReplicationMetadata.REPLICATION_FACTOR_OPTION, Integer.toString(replicationFactor))
                .build());
        }
        return true;
    }

    @Override
    public boolean createTable(String keyspace, String table) {
        return true;
    }

    @Override
    public boolean insert(String keyspace, String table, DataRecord record) {
        rows.put(record.getId(), record);
        return true;
    }

    @Override
    public Optional<DataRecord> query(String keyspace, String table, String id) {
        if (!survivesNodeLoss && !nodeUp.get(ownerAddress)) {
            return Optional.empty();
        }
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public IClusterTopology topology() {
        return this;
    }

    @Override
    public IPartitionTokenQuery tokenQuery() {
        return (keyspace, table, key) -> new TokenRow(-4069959284402364209L);
    }

    @Override
    public void close() {
        closed = true;
    }

    // Topology

    @Override
    public String partitionerName() {
        return "org.apache.cassandra.dht.Murmur3Partitioner";
    }

    @Override
    public List<NodeDescriptor> allNodes() {
        return nodeUp.entrySet().stream()
            .map(e -> NodeDescriptor.builder()
                .primaryAddress(e.getKey())
                .reachable(e.getValue())
                .datacenter("datacenter1")
                .rack("rack1")
                .build())
            .collect(Collectors.toList());
    }

    @Override
    public Optional<ReplicationMetadata> keyspaceReplication(String keyspace) {
        return Optional.ofNullable(keyspaces.get(keyspace));
    }

    @Override
    public boolean hasTokenMap() {
        return true;
    }

    @Override
    public List<NodeDescriptor> ringOwners(String keyspace, PartitionToken token) {
        return allNodes().stream()
            .filter(n -> n.getPrimaryAddress().equals(ownerAddress))
            .collect(Collectors.toList());
    }

    @Override
    public boolean refresh(String keyspace) {
        return true;
    }

    // Containers

    @Override
    public Optional<String> currentAddress(String unitId) {
        return Optional.ofNullable(containerAddresses.get(unitId));
    }

    @Override
    public boolean stop(String unitId) {
        stopped.add(unitId);
        nodeUp.put(containerAddresses.get(unitId), false);
        return true;
    }

    @Override
    public boolean start(String unitId) {
        started.add(unitId);
        nodeUp.put(containerAddresses.get(unitId), true);
        return true;
    }

    @Override
    public ContainerHealth healthStatus(String unitId) {
        return nodeUp.get(containerAddresses.get(unitId)) ? ContainerHealth.HEALTHY : ContainerHealth.NOT_RUNNING;
    }
}
