package com.qqsuccubus.faultlab.core.error;

/**
 * The driver has no token map yet (metadata not loaded or token metadata disabled).
 */
public class TopologyUnavailableException extends OwnershipException {
    public TopologyUnavailableException(String message) {
        super(message);
    }
}
