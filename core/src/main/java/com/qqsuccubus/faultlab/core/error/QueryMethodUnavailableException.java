package com.qqsuccubus.faultlab.core.error;

/**
 * The cluster could not answer a token query: no row for the key, missing table, or a driver error.
 * <p>
 * All causes collapse into this one type; the token resolver always recovers from it.
 * </p>
 */
public class QueryMethodUnavailableException extends RuntimeException {
    public QueryMethodUnavailableException(String message) {
        super(message);
    }

    public QueryMethodUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
