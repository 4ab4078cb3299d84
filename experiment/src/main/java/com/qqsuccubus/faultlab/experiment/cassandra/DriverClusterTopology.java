package com.qqsuccubus.faultlab.experiment.cassandra;

import com.datastax.oss.driver.api.core.CqlIdentifier;
import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.metadata.Node;
import com.datastax.oss.driver.api.core.metadata.NodeState;
import com.datastax.oss.driver.api.core.metadata.TokenMap;
import com.datastax.oss.driver.api.core.metadata.token.Token;
import com.qqsuccubus.faultlab.core.error.TopologyUnavailableException;
import com.qqsuccubus.faultlab.core.model.NodeDescriptor;
import com.qqsuccubus.faultlab.core.model.PartitionToken;
import com.qqsuccubus.faultlab.core.model.ReplicationMetadata;
import com.qqsuccubus.faultlab.core.spi.IClusterTopology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cluster topology backed by the DataStax driver's live metadata.
 * <p>
 * Every call reads the session's current {@code Metadata} snapshot, so results reflect the
 * latest gossip and schema events the driver has processed.
 * </p>
 */
public class DriverClusterTopology implements IClusterTopology {
    private static final Logger log = LoggerFactory.getLogger(DriverClusterTopology.class);

    private final CqlSession session;

    public DriverClusterTopology(CqlSession session) {
        this.session = session;
    }

    @Override
    public String partitionerName() {
        return session.getMetadata().getTokenMap()
                .map(TokenMap::getPartitionerName)
                .orElse(null);
    }

    @Override
    public Collection<NodeDescriptor> allNodes() {
        return session.getMetadata().getNodes().values().stream()
                .map(DriverClusterTopology::toDescriptor)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<ReplicationMetadata> keyspaceReplication(String keyspace) {
        return session.getMetadata().getKeyspace(keyspace)
                .map(ks -> ReplicationMetadata.fromReplicationMap(ks.getReplication()));
    }

    @Override
    public boolean hasTokenMap() {
        return session.getMetadata().getTokenMap()
                .map(tokenMap -> !tokenMap.getTokenRanges().isEmpty())
                .orElse(false);
    }

    @Override
    public List<NodeDescriptor> ringOwners(String keyspace, PartitionToken token) {
        TokenMap tokenMap = session.getMetadata().getTokenMap()
                .orElseThrow(() -> new TopologyUnavailableException("Token map not available"));

        Token ringToken = tokenMap.parse(Long.toString(token.getValue()));
        Set<Node> replicas = tokenMap.getReplicas(CqlIdentifier.fromCql(keyspace), ringToken);

        return replicas.stream()
                .map(DriverClusterTopology::toDescriptor)
                .collect(Collectors.toList());
    }

    @Override
    public boolean refresh(String keyspace) {
        try {
            session.refreshSchema();
            log.info("Refreshed cluster metadata (keyspace {})", keyspace);
            return true;
        } catch (DriverException e) {
            log.warn("Could not refresh metadata: {}", e.getMessage());
            return false;
        }
    }

    static NodeDescriptor toDescriptor(Node node) {
        return NodeDescriptor.builder()
                .primaryAddress(hostOf(node.getEndPoint().resolve()))
                .broadcastAddress(node.getBroadcastAddress().map(DriverClusterTopology::hostOf).orElse(null))
                .reachable(node.getState() == NodeState.UP)
                .rack(node.getRack())
                .datacenter(node.getDatacenter())
                .build();
    }

    static String hostOf(SocketAddress address) {
        if (address instanceof InetSocketAddress) {
            InetSocketAddress inet = (InetSocketAddress) address;
            return inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
        }
        return String.valueOf(address);
    }
}
