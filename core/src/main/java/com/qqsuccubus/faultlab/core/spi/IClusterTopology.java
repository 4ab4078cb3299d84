package com.qqsuccubus.faultlab.core.spi;

import com.qqsuccubus.faultlab.core.model.NodeDescriptor;
import com.qqsuccubus.faultlab.core.model.PartitionToken;
import com.qqsuccubus.faultlab.core.model.ReplicationMetadata;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of cluster membership and partitioning, backed by the store client's metadata.
 */
public interface IClusterTopology {

    /**
     * Partitioner class name as reported by the cluster, or null if not known yet.
     */
    String partitionerName();

    /**
     * All known members, reachable or not.
     */
    Collection<NodeDescriptor> allNodes();

    /**
     * Replication settings of a keyspace. Empty means the keyspace is unknown,
     * which is distinct from a keyspace configured with zero replicas.
     */
    Optional<ReplicationMetadata> keyspaceReplication(String keyspace);

    /**
     * Whether a non-empty token map (ring) is available for replica computation.
     */
    boolean hasTokenMap();

    /**
     * Walks the ring from the token and returns the owning nodes, primary first.
     */
    List<NodeDescriptor> ringOwners(String keyspace, PartitionToken token);

    /**
     * Reloads schema and membership metadata. Invoked by orchestrators only.
     *
     * @return true if the refresh succeeded
     */
    boolean refresh(String keyspace);
}
