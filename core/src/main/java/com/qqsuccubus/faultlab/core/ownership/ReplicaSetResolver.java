package com.qqsuccubus.faultlab.core.ownership;

import com.qqsuccubus.faultlab.core.error.TopologyUnavailableException;
import com.qqsuccubus.faultlab.core.error.UnknownKeyspaceException;
import com.qqsuccubus.faultlab.core.model.NodeDescriptor;
import com.qqsuccubus.faultlab.core.model.PartitionToken;
import com.qqsuccubus.faultlab.core.model.ReplicationMetadata;
import com.qqsuccubus.faultlab.core.spi.IClusterTopology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a trusted token into the ordered list of replica addresses for one keyspace.
 * <p>
 * The ring walk itself belongs to the store client; this class checks its preconditions and
 * converts the returned nodes. A single topology read is authoritative: no retries, no refresh.
 * </p>
 */
public class ReplicaSetResolver {
    private static final Logger log = LoggerFactory.getLogger(ReplicaSetResolver.class);

    /**
     * Resolves the replicas owning a token.
     *
     * @param topology Cluster topology view
     * @param keyspace Keyspace whose replication strategy applies
     * @param token    Token to place on the ring
     * @return Replica addresses in ring-walk order, possibly empty
     * @throws UnknownKeyspaceException     if the keyspace is not in cluster metadata
     * @throws TopologyUnavailableException if no token map is loaded
     */
    public List<String> resolve(IClusterTopology topology, String keyspace, PartitionToken token) {
        ReplicationMetadata replication = requireKnownKeyspace(topology, keyspace);

        if (!topology.hasTokenMap()) {
            log.error("Token map not available");
            throw new TopologyUnavailableException("Token map not available for keyspace '" + keyspace + "'");
        }

        List<String> replicas = topology.ringOwners(keyspace, token).stream()
                .map(NodeDescriptor::getPrimaryAddress)
                .collect(Collectors.toList());

        log.info("Token {} in keyspace '{}' (RF={}) is owned by {}",
                token.getValue(), keyspace, replication.replicationFactor(), replicas);
        return replicas;
    }

    /**
     * Checks that the keyspace is known before any ring computation.
     *
     * @return Replication settings of the keyspace
     * @throws UnknownKeyspaceException if the keyspace is absent
     */
    public ReplicationMetadata requireKnownKeyspace(IClusterTopology topology, String keyspace) {
        return topology.keyspaceReplication(keyspace)
                .orElseThrow(() -> {
                    log.error("Keyspace '{}' not found in cluster metadata", keyspace);
                    return new UnknownKeyspaceException(keyspace);
                });
    }
}
