package com.qqsuccubus.faultlab.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Replication settings of a keyspace as stored in the schema
 * (e.g. {@code {'class': 'SimpleStrategy', 'replication_factor': '1'}}).
 */
@Value
@Builder(toBuilder = true)
public class ReplicationMetadata {
    public static final String CLASS_OPTION = "class";
    public static final String REPLICATION_FACTOR_OPTION = "replication_factor";

    /**
     * Fully qualified or short replication strategy class name.
     */
    String strategyClass;

    /**
     * Strategy options other than {@code class}: {@code replication_factor} for SimpleStrategy,
     * one entry per datacenter for NetworkTopologyStrategy.
     */
    @Singular
    Map<String, String> options;

    /**
     * Builds metadata from the raw replication map the driver exposes.
     *
     * @param replication Raw map including the {@code class} entry
     * @return Parsed metadata
     */
    public static ReplicationMetadata fromReplicationMap(Map<String, String> replication) {
        ReplicationMetadataBuilder builder = ReplicationMetadata.builder()
                .strategyClass(replication.get(CLASS_OPTION));
        replication.forEach((key, value) -> {
            if (!CLASS_OPTION.equals(key)) {
                builder.option(key, value);
            }
        });
        return builder.build();
    }

    /**
     * Total number of replicas configured for the keyspace.
     * <p>
     * SimpleStrategy reads {@code replication_factor}; NetworkTopologyStrategy sums the per-DC
     * factors. Values like {@code "3/1"} (transient replication) count their full part only.
     * </p>
     *
     * @return Configured replica count, 0 if nothing parseable is configured
     */
    public int replicationFactor() {
        String simple = options.get(REPLICATION_FACTOR_OPTION);
        if (simple != null) {
            return parseFactor(simple);
        }
        return options.values().stream()
                .mapToInt(ReplicationMetadata::parseFactor)
                .sum();
    }

    private static int parseFactor(String value) {
        String full = value.contains("/") ? value.substring(0, value.indexOf('/')) : value;
        try {
            return Integer.parseInt(full.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
