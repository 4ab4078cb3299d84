package com.qqsuccubus.faultlab.core.ownership;

import com.qqsuccubus.faultlab.core.model.NodeDescriptor;
import com.qqsuccubus.faultlab.core.spi.IClusterTopology;
import com.qqsuccubus.faultlab.core.spi.IContainerControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Maps a node address as seen by the cluster to the container (or pod) that hosts it.
 * <p>
 * Strategies run in fixed order and the first match wins:
 * <ol>
 *   <li><b>Direct probe</b>: each candidate's current address is compared with the target by
 *   exact equality, then target-in-address, then address-in-target. The first candidate in list
 *   order that satisfies any rule wins, even if a later candidate would match exactly.</li>
 *   <li><b>Topology cross-reference</b>: if the direct probe finds nothing, the node whose primary
 *   or broadcast address equals the target is looked up and candidates are probed again for an
 *   exact match against that node's addresses.</li>
 * </ol>
 * </p>
 * <p>
 * Nothing is cached: every call probes each candidate afresh, so addresses that changed after a
 * restart are picked up.
 * </p>
 */
public class ContainerMapper {
    private static final Logger log = LoggerFactory.getLogger(ContainerMapper.class);

    private final IContainerControl containerControl;

    public ContainerMapper(IContainerControl containerControl) {
        this.containerControl = containerControl;
    }

    /**
     * Maps a node address to a container using the direct probe only.
     *
     * @param targetAddress  Node address reported by the cluster
     * @param candidateUnits Container names in priority order
     * @return Matching container, or empty if unresolved
     */
    public Optional<String> map(String targetAddress, List<String> candidateUnits) {
        return map(targetAddress, candidateUnits, null);
    }

    /**
     * Maps a node address to a container.
     *
     * @param targetAddress  Node address reported by the cluster
     * @param candidateUnits Container names in priority order
     * @param topology       Topology for the cross-reference fallback, or null to skip it
     * @return Matching container, or empty if unresolved
     */
    public Optional<String> map(String targetAddress, List<String> candidateUnits, IClusterTopology topology) {
        log.info("Mapping replica node {} to one of {}", targetAddress, candidateUnits);

        Optional<String> direct = probeDirect(targetAddress, candidateUnits);
        if (direct.isPresent() || topology == null) {
            return direct;
        }

        log.info("No direct match, trying topology cross-reference");
        for (NodeDescriptor node : topology.allNodes()) {
            log.info("  Host: {} (known as {})", node.getPrimaryAddress(), node.knownAddresses());
            if (node.isKnownAs(targetAddress)) {
                Optional<String> viaNode = probeByNode(node, candidateUnits);
                if (viaNode.isPresent()) {
                    return viaNode;
                }
            }
        }

        log.warn("Could not map node {} to any container", targetAddress);
        return Optional.empty();
    }

    private Optional<String> probeDirect(String targetAddress, List<String> candidateUnits) {
        for (String unit : candidateUnits) {
            Optional<String> address = probe(unit);
            if (address.isEmpty()) {
                continue;
            }
            if (addressesMatch(targetAddress, address.get())) {
                log.info("Matched container {} (IP: {}) for node {}", unit, address.get(), targetAddress);
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }

    private Optional<String> probeByNode(NodeDescriptor node, List<String> candidateUnits) {
        for (String unit : candidateUnits) {
            Optional<String> address = probe(unit);
            if (address.isPresent() && node.knownAddresses().contains(address.get())) {
                log.info("Matched container {} via host metadata (IP: {})", unit, address.get());
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }

    private Optional<String> probe(String unit) {
        Optional<String> address = containerControl.currentAddress(unit);
        if (address.isPresent()) {
            log.info("  Container {} has IP: {}", unit, address.get());
        } else {
            log.info("  Container {} has no resolvable address, skipping", unit);
        }
        return address;
    }

    /**
     * Loose address comparison: exact, target contained in infra address, or infra address
     * contained in target. Tolerates port suffixes and formatting differences, at the cost of
     * false positives such as {@code 10.0.0.1} inside {@code 10.0.0.12}.
     */
    static boolean addressesMatch(String targetAddress, String infraAddress) {
        return infraAddress.equals(targetAddress)
                || infraAddress.contains(targetAddress)
                || targetAddress.contains(infraAddress);
    }
}
