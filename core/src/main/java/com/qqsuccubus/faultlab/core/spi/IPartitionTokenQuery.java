package com.qqsuccubus.faultlab.core.spi;

import com.qqsuccubus.faultlab.core.error.QueryMethodUnavailableException;
import com.qqsuccubus.faultlab.core.model.TokenRow;

/**
 * Asks the live store which token a stored key hashes to (Dependency Inversion Principle).
 * <p>
 * Implementations run {@code SELECT token(<pk>) AS token_value FROM <ks>.<table> WHERE <pk> = ?}.
 * </p>
 */
public interface IPartitionTokenQuery {

    /**
     * Queries the token of an existing row.
     *
     * @param keyspace Keyspace name
     * @param table    Table name
     * @param key      Partition key value
     * @return Typed token row
     * @throws QueryMethodUnavailableException if no row exists or the query fails for any reason
     */
    TokenRow queryToken(String keyspace, String table, String key);
}
