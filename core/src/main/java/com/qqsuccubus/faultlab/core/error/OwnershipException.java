package com.qqsuccubus.faultlab.core.error;

/**
 * Base class for conditions that make replica ownership indeterminate.
 * <p>
 * These are fatal for the calling operation: an experiment must abort rather than act on a
 * guessed owner.
 * </p>
 */
public class OwnershipException extends RuntimeException {
    public OwnershipException(String message) {
        super(message);
    }

    public OwnershipException(String message, Throwable cause) {
        super(message, cause);
    }
}
