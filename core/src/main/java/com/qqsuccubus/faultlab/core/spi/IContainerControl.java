package com.qqsuccubus.faultlab.core.spi;

import com.qqsuccubus.faultlab.core.model.ContainerHealth;

import java.util.Optional;

/**
 * Controls the infrastructure units (containers, pods) that host cluster nodes.
 * <p>
 * Lifecycle methods report failure through their return value and log the cause; they never throw.
 * </p>
 */
public interface IContainerControl {

    /**
     * Current network address of a unit.
     *
     * @param unitId Container or pod name
     * @return Address, or empty if it cannot be determined
     */
    Optional<String> currentAddress(String unitId);

    boolean stop(String unitId);

    boolean start(String unitId);

    ContainerHealth healthStatus(String unitId);

    /**
     * Releases the runtime client.
     */
    void close();
}
