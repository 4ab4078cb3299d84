package com.qqsuccubus.faultlab.core.ownership;

import com.qqsuccubus.faultlab.core.error.QueryMethodUnavailableException;
import com.qqsuccubus.faultlab.core.error.TokenResolutionFailedException;
import com.qqsuccubus.faultlab.core.hash.TokenCodec;
import com.qqsuccubus.faultlab.core.model.PartitionToken;
import com.qqsuccubus.faultlab.core.model.ResolvedToken;
import com.qqsuccubus.faultlab.core.model.TokenComparison;
import com.qqsuccubus.faultlab.core.spi.IPartitionTokenQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Produces one trusted token for a key using two independent methods.
 * <p>
 * <b>Method A</b> asks the cluster ({@code token(<pk>)} on an existing row) and is authoritative.
 * <b>Method B</b> hashes the raw key locally with {@link TokenCodec} and corroborates A.
 * Both candidates and their comparison are always written to the audit log; a mismatch is
 * logged as an anomaly and never fails the resolution.
 * </p>
 * <p>
 * Selection: A if present, else B, else {@link TokenResolutionFailedException}.
 * </p>
 */
public class TokenResolver {
    private static final String SEPARATOR = "=".repeat(60);

    private final IPartitionTokenQuery tokenQuery;
    private final TokenCodec codec;
    private final Logger log;

    public TokenResolver(IPartitionTokenQuery tokenQuery, TokenCodec codec) {
        this(tokenQuery, codec, LoggerFactory.getLogger(TokenResolver.class));
    }

    /**
     * @param log Sink for the token audit trail
     */
    public TokenResolver(IPartitionTokenQuery tokenQuery, TokenCodec codec, Logger log) {
        this.tokenQuery = tokenQuery;
        this.codec = codec;
        this.log = log;
    }

    /**
     * Resolves the token of a key.
     *
     * @param keyspace        Keyspace holding the row
     * @param table           Table holding the row
     * @param key             Partition key value
     * @param partitionerName Partitioner declared by the cluster
     * @return Selected token plus the comparison of both methods
     * @throws TokenResolutionFailedException if neither method yields a token
     */
    public ResolvedToken resolve(String keyspace, String table, String key, String partitionerName) {
        Long fromQuery = queryToken(keyspace, table, key);
        Long fromHash = hashToken(key, partitionerName);

        TokenComparison comparison = TokenComparison.of(fromQuery, fromHash);
        logComparison(comparison);

        if (fromQuery != null) {
            log.info("Using token from query method: {}", fromQuery);
            return new ResolvedToken(PartitionToken.fromQuery(fromQuery), comparison);
        }
        if (fromHash != null) {
            log.info("Using token from local Murmur3 hash (fallback): {}", fromHash);
            return new ResolvedToken(PartitionToken.fromLocalHash(fromHash), comparison);
        }
        log.error("Both token calculation methods failed for key '{}'", key);
        throw new TokenResolutionFailedException(key);
    }

    private Long queryToken(String keyspace, String table, String key) {
        try {
            long token = tokenQuery.queryToken(keyspace, table, key).tokenValue();
            log.info("Token value from query for key '{}': {}", key, token);
            return token;
        } catch (QueryMethodUnavailableException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Could not get token via query: {}", cause.getMessage(), e);
            return null;
        }
    }

    private Long hashToken(String key, String partitionerName) {
        Optional<PartitionToken> token = codec.compute(key, partitionerName);
        if (token.isEmpty()) {
            log.warn("Partitioner '{}' is not Murmur3, skipping local hash calculation", partitionerName);
            return null;
        }
        log.info("Token value from local Murmur3 hash for key '{}': {}", key, token.get().getValue());
        return token.get().getValue();
    }

    private void logComparison(TokenComparison comparison) {
        log.info(SEPARATOR);
        log.info("Token Calculation Comparison:");
        log.info("  Query method:     {}", orFailed(comparison.getQueryToken()));
        log.info("  Local Murmur3:    {}", orFailed(comparison.getLocalToken()));
        switch (comparison.getOutcome()) {
            case MATCH:
                log.info("  Both methods match: {}", comparison.getQueryToken());
                break;
            case MISMATCH:
                log.warn("  Methods differ by: {}", comparison.getDifference());
                log.warn("     Query: {}, local: {}", comparison.getQueryToken(), comparison.getLocalToken());
                break;
            default:
                break;
        }
        log.info(SEPARATOR);
    }

    private static Object orFailed(Long token) {
        return token != null ? token : "FAILED";
    }
}
