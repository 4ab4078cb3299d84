package com.qqsuccubus.faultlab.core.error;

/**
 * Neither the cluster query nor the local hash produced a token for the key.
 */
public class TokenResolutionFailedException extends OwnershipException {
    public TokenResolutionFailedException(String key) {
        super("Could not determine a token for key '" + key + "': both token calculation methods failed");
    }
}
