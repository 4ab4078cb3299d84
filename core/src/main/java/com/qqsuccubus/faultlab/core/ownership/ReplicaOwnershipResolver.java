package com.qqsuccubus.faultlab.core.ownership;

import com.qqsuccubus.faultlab.core.error.OwnershipException;
import com.qqsuccubus.faultlab.core.model.ReplicaOwnership;
import com.qqsuccubus.faultlab.core.model.ResolvedToken;
import com.qqsuccubus.faultlab.core.spi.IClusterTopology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Answers "which nodes own this key" by chaining token resolution and replica lookup.
 * <p>
 * The keyspace is checked first so an unknown keyspace fails before any token query runs.
 * </p>
 */
public class ReplicaOwnershipResolver {
    private static final Logger log = LoggerFactory.getLogger(ReplicaOwnershipResolver.class);

    private final IClusterTopology topology;
    private final TokenResolver tokenResolver;
    private final ReplicaSetResolver replicaSetResolver;

    public ReplicaOwnershipResolver(
            IClusterTopology topology,
            TokenResolver tokenResolver,
            ReplicaSetResolver replicaSetResolver
    ) {
        this.topology = topology;
        this.tokenResolver = tokenResolver;
        this.replicaSetResolver = replicaSetResolver;
    }

    /**
     * Resolves the replicas of a key stored in {@code keyspace.table}.
     *
     * @throws OwnershipException if ownership cannot be determined
     */
    public ReplicaOwnership resolve(String keyspace, String table, String key) {
        replicaSetResolver.requireKnownKeyspace(topology, keyspace);

        ResolvedToken resolved = tokenResolver.resolve(keyspace, table, key, topology.partitionerName());
        List<String> replicas = replicaSetResolver.resolve(topology, keyspace, resolved.getToken());

        if (replicas.size() > 1) {
            log.info("Key '{}' has {} replicas; primary is {}", key, replicas.size(), replicas.get(0));
        }

        return ReplicaOwnership.builder()
                .keyspace(keyspace)
                .key(key)
                .resolvedToken(resolved)
                .replicaAddresses(replicas)
                .build();
    }
}
