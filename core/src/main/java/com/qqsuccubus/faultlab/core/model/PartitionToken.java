package com.qqsuccubus.faultlab.core.model;

import lombok.Value;

/**
 * A key's position on the hash ring, tagged with the method that produced it.
 * <p>
 * Cluster-reported Murmur3 tokens span the signed 64-bit range; locally hashed tokens are
 * unsigned 32-bit values widened to a long.
 * </p>
 */
@Value
public class PartitionToken {
    long value;
    Source source;

    public static PartitionToken fromQuery(long value) {
        return new PartitionToken(value, Source.CLUSTER_QUERY);
    }

    public static PartitionToken fromLocalHash(long value) {
        return new PartitionToken(value, Source.LOCAL_HASH);
    }

    public enum Source {
        /**
         * Computed by the store itself via {@code token(<pk>)}.
         */
        CLUSTER_QUERY,
        /**
         * Computed client-side from the raw key bytes.
         */
        LOCAL_HASH
    }
}
