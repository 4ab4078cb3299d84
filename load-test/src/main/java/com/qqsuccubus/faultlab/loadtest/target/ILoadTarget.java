package com.qqsuccubus.faultlab.loadtest.target;

import java.time.Instant;

/**
 * Store the load generator drives (Dependency Inversion Principle).
 * <p>
 * Failures are thrown as unchecked exceptions and counted by the caller.
 * </p>
 */
public interface ILoadTarget {

    void write(String deviceId, Instant timestamp, double value);

    /**
     * Reads the latest readings of a device.
     *
     * @return Number of rows returned
     */
    int read(String deviceId);
}
