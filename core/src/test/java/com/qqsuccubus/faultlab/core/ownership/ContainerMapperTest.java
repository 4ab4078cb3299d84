package com.qqsuccubus.faultlab.core.ownership;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContainerMapperTest {

    @Test
    void testExactMatchSelectsSecondUnit() {
        StubContainerControl control = new StubContainerControl()
                .withAddress("cassandra-node1", "10.0.0.1")
                .withAddress("cassandra-node2", "10.0.0.2")
                .withAddress("cassandra-node3", "10.0.0.3");

        Optional<String> unit = new ContainerMapper(control)
                .map("10.0.0.2", List.of("cassandra-node1", "cassandra-node2", "cassandra-node3"));

        assertEquals(Optional.of("cassandra-node2"), unit);
        assertEquals(List.of("cassandra-node1", "cassandra-node2"), control.probes);
    }

    @Test
    @DisplayName("Exact match listed first wins")
    void testExactFirstWins() {
        StubContainerControl control = new StubContainerControl()
                .withAddress("A", "10.0.0.1")
                .withAddress("B", "10.0.0.10");

        assertEquals(Optional.of("A"), new ContainerMapper(control).map("10.0.0.1", List.of("A", "B")));
    }

    @Test
    @DisplayName("List order, not match quality, decides: an earlier substring match beats a later exact match")
    void testSubstringFirstWins() {
        StubContainerControl control = new StubContainerControl()
                .withAddress("A", "10.0.0.1")
                .withAddress("B", "10.0.0.10");

        assertEquals(Optional.of("B"), new ContainerMapper(control).map("10.0.0.1", List.of("B", "A")));
    }

    @Test
    void testInfraAddressContainedInTarget() {
        StubContainerControl control = new StubContainerControl()
                .withAddress("cassandra-node1", "172.18.0.4");

        assertEquals(Optional.of("cassandra-node1"),
                new ContainerMapper(control).map("172.18.0.4:9042", List.of("cassandra-node1")));
    }

    @Test
    @DisplayName("Units whose address probe fails are skipped")
    void testProbeFailureSkipped() {
        StubContainerControl control = new StubContainerControl()
                .withAddress("cassandra-node3", "10.0.0.3");

        Optional<String> unit = new ContainerMapper(control)
                .map("10.0.0.3", List.of("cassandra-node1", "cassandra-node2", "cassandra-node3"));

        assertEquals(Optional.of("cassandra-node3"), unit);
        assertEquals(3, control.probes.size());
    }

    @Test
    @DisplayName("Broadcast address cross-reference is used only after the direct probe fails")
    void testBroadcastFallback() {
        StubContainerControl control = new StubContainerControl()
                .withAddress("cassandra-node1", "172.18.0.2")
                .withAddress("cassandra-node2", "172.18.0.3");
        StubClusterTopology topology = new StubClusterTopology()
                .withNode("172.18.0.2", "192.168.1.10")
                .withNode("172.18.0.3", "192.168.1.11");

        Optional<String> unit = new ContainerMapper(control)
                .map("192.168.1.11", List.of("cassandra-node1", "cassandra-node2"), topology);

        assertEquals(Optional.of("cassandra-node2"), unit);
        // Two probes for the direct scan, then a fresh scan for the cross-reference
        assertEquals(List.of("cassandra-node1", "cassandra-node2", "cassandra-node1", "cassandra-node2"),
                control.probes);
    }

    @Test
    void testFallbackToleratesMissingBroadcast() {
        StubContainerControl control = new StubContainerControl()
                .withAddress("cassandra-node1", "172.18.0.9");
        StubClusterTopology topology = new StubClusterTopology()
                .withNode("10.1.1.1", null);

        assertTrue(new ContainerMapper(control)
                .map("10.1.1.1", List.of("cassandra-node1"), topology).isEmpty());
    }

    @Test
    @DisplayName("Empty unit list and no matching node yields unresolved, not an exception")
    void testUnresolved() {
        StubClusterTopology topology = new StubClusterTopology().withNode("10.0.0.1", null);

        Optional<String> unit = new ContainerMapper(new StubContainerControl())
                .map("10.0.0.9", List.of(), topology);

        assertTrue(unit.isEmpty());
    }

    @Test
    void testNoCachingBetweenCalls() {
        StubContainerControl control = new StubContainerControl()
                .withAddress("cassandra-node1", "10.0.0.1");
        ContainerMapper mapper = new ContainerMapper(control);

        assertEquals(Optional.of("cassandra-node1"), mapper.map("10.0.0.1", List.of("cassandra-node1")));

        // Address changes after a restart
        control.withAddress("cassandra-node1", "10.0.0.7");
        assertTrue(mapper.map("10.0.0.1", List.of("cassandra-node1")).isEmpty());
        assertEquals(Optional.of("cassandra-node1"), mapper.map("10.0.0.7", List.of("cassandra-node1")));
    }

    @Test
    void testAddressesMatchRules() {
        assertTrue(ContainerMapper.addressesMatch("10.0.0.1", "10.0.0.1"));
        assertTrue(ContainerMapper.addressesMatch("10.0.0.1", "10.0.0.12"));
        assertTrue(ContainerMapper.addressesMatch("10.0.0.12", "10.0.0.1"));
        assertFalse(ContainerMapper.addressesMatch("10.0.0.2", "10.0.0.3"));
    }
}
