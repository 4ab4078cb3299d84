package com.qqsuccubus.faultlab.core.model;

import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of comparing the cluster-reported token with the locally hashed one.
 * <p>
 * A mismatch is diagnostic only: the cluster hashes the serialized partition key with its own
 * partitioner, so the raw-key hash diverges whenever the two encodings differ.
 * </p>
 */
@Value
public class TokenComparison {
    /**
     * Token from the cluster query, null when that method was unavailable.
     */
    Long queryToken;

    /**
     * Token from the local hash, null when not applicable.
     */
    Long localToken;

    Outcome outcome;

    /**
     * Absolute difference between both candidates, null unless both are present.
     */
    BigInteger difference;

    public static TokenComparison of(Long queryToken, Long localToken) {
        if (queryToken != null && localToken != null) {
            if (queryToken.longValue() == localToken.longValue()) {
                return new TokenComparison(queryToken, localToken, Outcome.MATCH, BigInteger.ZERO);
            }
            BigInteger diff = BigInteger.valueOf(queryToken).subtract(BigInteger.valueOf(localToken)).abs();
            return new TokenComparison(queryToken, localToken, Outcome.MISMATCH, diff);
        }
        if (queryToken != null) {
            return new TokenComparison(queryToken, null, Outcome.QUERY_ONLY, null);
        }
        if (localToken != null) {
            return new TokenComparison(null, localToken, Outcome.LOCAL_ONLY, null);
        }
        return new TokenComparison(null, null, Outcome.NONE, null);
    }

    public enum Outcome {
        MATCH,
        MISMATCH,
        QUERY_ONLY,
        LOCAL_ONLY,
        NONE
    }
}
