package com.qqsuccubus.faultlab.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable descriptor for one member of the Cassandra cluster, as reported by the driver's metadata.
 * <p>
 * Descriptors mirror gossip state at the moment they were read and may already be stale when used.
 * Callers that need fresher state refresh the topology first.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class NodeDescriptor {
    /**
     * Address the store considers canonical for this node (plain IP, no port).
     */
    String primaryAddress;

    /**
     * Broadcast address reported by the node, or null when the store does not expose one.
     * May differ from the primary address (e.g. behind NAT).
     */
    String broadcastAddress;

    /**
     * Whether the driver currently considers the node up.
     */
    boolean reachable;

    /**
     * Informational only.
     */
    String rack;

    /**
     * Informational only.
     */
    String datacenter;

    /**
     * Returns every address this node is known by, primary first.
     */
    public List<String> knownAddresses() {
        List<String> addresses = new ArrayList<>(2);
        if (primaryAddress != null) {
            addresses.add(primaryAddress);
        }
        if (broadcastAddress != null && !broadcastAddress.equals(primaryAddress)) {
            addresses.add(broadcastAddress);
        }
        return Collections.unmodifiableList(addresses);
    }

    /**
     * Whether the given address equals the primary or the broadcast address exactly.
     */
    public boolean isKnownAs(String address) {
        if (address == null) {
            return false;
        }
        return address.equals(primaryAddress) || address.equals(broadcastAddress);
    }
}
