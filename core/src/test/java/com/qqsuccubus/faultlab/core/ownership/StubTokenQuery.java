package com.qqsuccubus.faultlab.core.ownership;

import com.qqsuccubus.faultlab.core.error.QueryMethodUnavailableException;
import com.qqsuccubus.faultlab.core.model.TokenRow;
import com.qqsuccubus.faultlab.core.spi.IPartitionTokenQuery;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Token query answering with a fixed token, or failing when none is configured.
 */
class StubTokenQuery implements IPartitionTokenQuery {
    private final Long token;
    final AtomicInteger calls = new AtomicInteger();

    private StubTokenQuery(Long token) {
        this.token = token;
    }

    static StubTokenQuery returning(long token) {
        return new StubTokenQuery(token);
    }

    static StubTokenQuery failing() {
        return new StubTokenQuery(null);
    }

    @Override
    public TokenRow queryToken(String keyspace, String table, String key) {
        calls.incrementAndGet();
        if (token == null) {
            throw new QueryMethodUnavailableException("No row for key '" + key + "'",
                    new IllegalStateException("connection refused"));
        }
        return new TokenRow(token);
    }
}
