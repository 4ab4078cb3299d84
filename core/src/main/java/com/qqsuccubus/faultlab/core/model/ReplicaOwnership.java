package com.qqsuccubus.faultlab.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Which nodes own a key, in the store's ring-walk order.
 * <p>
 * The full replica list is exposed; {@link #primary()} is a convenience for RF=1 experiments
 * and callers running with RF&gt;1 choose a replica explicitly.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ReplicaOwnership {
    String keyspace;
    String key;
    ResolvedToken resolvedToken;

    @Singular
    List<String> replicaAddresses;

    /**
     * First replica of the ring walk (the natural owner), empty if no replicas are configured.
     */
    public Optional<String> primary() {
        return replicaAddresses.isEmpty() ? Optional.empty() : Optional.of(replicaAddresses.get(0));
    }
}
