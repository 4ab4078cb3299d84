package com.qqsuccubus.faultlab.core.model;

/**
 * Typed result of a {@code SELECT token(...) AS token_value} query.
 *
 * @param tokenValue Token the cluster computed for the stored partition key
 */
public record TokenRow(long tokenValue) {
}
