package com.qqsuccubus.faultlab.core.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReplicationMetadataTest {

    @Test
    void testSimpleStrategy() {
        ReplicationMetadata metadata = ReplicationMetadata.fromReplicationMap(Map.of(
                "class", "org.apache.cassandra.locator.SimpleStrategy",
                "replication_factor", "1"));

        assertEquals("org.apache.cassandra.locator.SimpleStrategy", metadata.getStrategyClass());
        assertEquals(1, metadata.replicationFactor());
        assertFalse(metadata.getOptions().containsKey("class"));
    }

    @Test
    void testNetworkTopologyStrategySumsDatacenters() {
        ReplicationMetadata metadata = ReplicationMetadata.fromReplicationMap(Map.of(
                "class", "org.apache.cassandra.locator.NetworkTopologyStrategy",
                "dc1", "3",
                "dc2", "2/1"));

        assertEquals(5, metadata.replicationFactor());
    }

    @Test
    void testNothingConfigured() {
        ReplicationMetadata metadata = ReplicationMetadata.fromReplicationMap(Map.of("class", "LocalStrategy"));

        assertEquals(0, metadata.replicationFactor());
    }

    @Test
    void testNodeKnownAddresses() {
        NodeDescriptor node = NodeDescriptor.builder().primaryAddress("10.0.0.1").broadcastAddress("10.0.0.1").build();

        assertEquals(1, node.knownAddresses().size());
        assertTrue(node.isKnownAs("10.0.0.1"));
        assertFalse(node.isKnownAs(null));
    }
}
