package com.qqsuccubus.faultlab.core.ownership;

import com.qqsuccubus.faultlab.core.error.TokenResolutionFailedException;
import com.qqsuccubus.faultlab.core.error.UnknownKeyspaceException;
import com.qqsuccubus.faultlab.core.hash.TokenCodec;
import com.qqsuccubus.faultlab.core.model.NodeDescriptor;
import com.qqsuccubus.faultlab.core.model.PartitionToken;
import com.qqsuccubus.faultlab.core.model.ReplicaOwnership;
import com.qqsuccubus.faultlab.core.model.TokenComparison;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end ownership resolution over stubbed collaborators: token, replica set, container.
 */
class ReplicaOwnershipResolverTest {
    private static final String KEY = "experiment-key-001";

    private LogCapture audit;
    private StubClusterTopology topology;
    private StubContainerControl containers;

    @BeforeEach
    void setUp() {
        audit = new LogCapture("test.ownership." + System.nanoTime());
        topology = new StubClusterTopology()
                .withNode("10.0.0.1", null)
                .withNode("10.0.0.2", null)
                .withNode("10.0.0.3", null)
                .withKeyspace("experiment_rf1", 1);
        containers = new StubContainerControl()
                .withAddress("cassandra-node1", "10.0.0.1")
                .withAddress("cassandra-node2", "10.0.0.2")
                .withAddress("cassandra-node3", "10.0.0.3");
    }

    @AfterEach
    void tearDown() {
        audit.detach();
    }

    private ReplicaOwnershipResolver resolver(StubTokenQuery query) {
        return new ReplicaOwnershipResolver(topology,
                new TokenResolver(query, new TokenCodec(), audit.logger()),
                new ReplicaSetResolver());
    }

    @Test
    @DisplayName("Scenario: matching tokens, RF=1, owner mapped to the second container")
    void testEndToEndScenario() {
        NodeDescriptor owner = topology.nodes.get(1);
        topology.withOwners(owner);
        // A codec stand-in that agrees with the cluster token for this scenario
        TokenCodec agreeingCodec = new TokenCodec() {
            @Override
            public Optional<PartitionToken> compute(String key, String partitionerName) {
                return Optional.of(PartitionToken.fromLocalHash(123456789L));
            }
        };
        ReplicaOwnershipResolver resolver = new ReplicaOwnershipResolver(topology,
                new TokenResolver(StubTokenQuery.returning(123456789L), agreeingCodec, audit.logger()),
                new ReplicaSetResolver());

        ReplicaOwnership ownership = resolver.resolve("experiment_rf1", "test_data", KEY);

        assertEquals(123456789L, ownership.getResolvedToken().getToken().getValue());
        assertEquals(TokenComparison.Outcome.MATCH, ownership.getResolvedToken().getComparison().getOutcome());
        assertTrue(audit.contains("Both methods match: 123456789"));
        assertEquals(List.of("10.0.0.2"), ownership.getReplicaAddresses());

        String primary = ownership.primary().orElseThrow();
        Optional<String> container = new ContainerMapper(containers)
                .map(primary, List.of("cassandra-node1", "cassandra-node2", "cassandra-node3"), topology);
        assertEquals(Optional.of("cassandra-node2"), container);
    }

    @Test
    void testUnknownKeyspaceFailsBeforeTokenQuery() {
        StubTokenQuery query = StubTokenQuery.returning(1L);

        assertThrows(UnknownKeyspaceException.class,
                () -> resolver(query).resolve("missing_ks", "test_data", KEY));
        assertEquals(0, query.calls.get());
        assertTrue(topology.ringWalks.isEmpty());
    }

    @Test
    void testTokenFailurePropagates() {
        topology.partitioner = "org.apache.cassandra.dht.RandomPartitioner";

        assertThrows(TokenResolutionFailedException.class,
                () -> resolver(StubTokenQuery.failing()).resolve("experiment_rf1", "test_data", KEY));
        assertTrue(topology.ringWalks.isEmpty());
    }

    @Test
    void testLocalHashFallbackDrivesRingWalk() {
        topology.withOwners(topology.nodes.get(0));

        ReplicaOwnership ownership = resolver(StubTokenQuery.failing()).resolve("experiment_rf1", "test_data", KEY);

        assertEquals(3900860844L, topology.ringWalks.get(0).getValue());
        assertEquals(Optional.of("10.0.0.1"), ownership.primary());
    }

    @Test
    void testEmptyReplicaSetHasNoPrimary() {
        ReplicaOwnership ownership = resolver(StubTokenQuery.returning(9L)).resolve("experiment_rf1", "test_data", KEY);

        assertTrue(ownership.getReplicaAddresses().isEmpty());
        assertTrue(ownership.primary().isEmpty());
    }
}
