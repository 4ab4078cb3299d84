package com.qqsuccubus.faultlab.experiment.cassandra;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.qqsuccubus.faultlab.core.error.QueryMethodUnavailableException;
import com.qqsuccubus.faultlab.core.model.TokenRow;
import com.qqsuccubus.faultlab.core.spi.IPartitionTokenQuery;
import com.qqsuccubus.faultlab.core.util.CqlRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Asks Cassandra for a key's token with {@code SELECT token(<pk>)} against an existing row.
 */
public class CqlTokenQuery implements IPartitionTokenQuery {
    private static final Logger log = LoggerFactory.getLogger(CqlTokenQuery.class);
    private static final String TOKEN_COLUMN = "token_value";

    private final CqlSession session;
    private final String partitionKeyColumn;

    public CqlTokenQuery(CqlSession session, String partitionKeyColumn) {
        this.session = session;
        this.partitionKeyColumn = partitionKeyColumn;
    }

    @Override
    public TokenRow queryToken(String keyspace, String table, String key) {
        String cql = String.format("SELECT token(%s) AS %s FROM %s.%s WHERE %s = ?",
                partitionKeyColumn, TOKEN_COLUMN, keyspace, table, partitionKeyColumn);
        log.info("CQL Query: {}", CqlRenderer.render(cql, key));

        List<Row> rows;
        try {
            rows = session.execute(SimpleStatement.newInstance(cql, key)).all();
        } catch (DriverException e) {
            throw new QueryMethodUnavailableException("Token query failed for key '" + key + "'", e);
        }

        if (rows.isEmpty()) {
            throw new QueryMethodUnavailableException(
                    "No row with " + partitionKeyColumn + " = '" + key + "' in " + keyspace + "." + table);
        }

        log.info("CQL Result (SELECT TOKEN): {} row(s) returned", rows.size());
        try {
            for (int i = 0; i < rows.size(); i++) {
                log.info("  Row {}: {}", i + 1, rows.get(i).getFormattedContents());
            }
            return new TokenRow(rows.get(0).getLong(TOKEN_COLUMN));
        } catch (DriverException | IllegalArgumentException e) {
            throw new QueryMethodUnavailableException(
                    "Could not read " + TOKEN_COLUMN + " as a bigint for key '" + key + "'", e);
        }
    }
}
