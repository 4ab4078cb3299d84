package com.qqsuccubus.faultlab.core.error;

import lombok.Getter;

/**
 * The keyspace is absent from cluster metadata, so its replication factor is unknown.
 */
@Getter
public class UnknownKeyspaceException extends OwnershipException {
    private final String keyspace;

    public UnknownKeyspaceException(String keyspace) {
        super("Keyspace '" + keyspace + "' not found in cluster metadata");
        this.keyspace = keyspace;
    }
}
