package com.qqsuccubus.faultlab.experiment.cassandra;

import com.datastax.oss.driver.api.core.AllNodesFailedException;
import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import com.datastax.oss.driver.api.core.DefaultConsistencyLevel;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.qqsuccubus.faultlab.core.spi.IClusterTopology;
import com.qqsuccubus.faultlab.core.spi.IPartitionTokenQuery;
import com.qqsuccubus.faultlab.core.util.CqlRenderer;
import com.qqsuccubus.faultlab.experiment.config.ExperimentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Optional;

/**
 * Cassandra access for the experiment over a DataStax driver {@link CqlSession}.
 * <p>
 * Every statement is logged in rendered form before it runs. Table names are always fully
 * qualified, so the session is never bound to a keyspace.
 * </p>
 */
public class CassandraRepository implements ICassandraRepository {
    private static final Logger log = LoggerFactory.getLogger(CassandraRepository.class);
    private static final String PARTITION_KEY_COLUMN = "id";

    private final ExperimentConfig config;
    private CqlSession session;

    public CassandraRepository(ExperimentConfig config) {
        this.config = config;
    }

    @Override
    public boolean connect() {
        log.info("Connecting to Cassandra cluster at {} (port {})...", config.getContactPoints(), config.getPort());
        CqlSessionBuilder builder = CqlSession.builder()
            .withLocalDatacenter(config.getLocalDatacenter());
        for (String contactPoint : config.getContactPoints()) {
            builder.addContactPoint(new InetSocketAddress(contactPoint, config.getPort()));
        }
        if (config.getUsername() != null && !config.getUsername().isEmpty()) {
            builder.withAuthCredentials(config.getUsername(), config.getPassword());
        }

        try {
            session = builder.build();
        } catch (AllNodesFailedException e) {
            log.error("Unable to connect to Cassandra: {}", e.getMessage());
            return false;
        }
        log.info("Connected to cluster {}", session.getMetadata().getClusterName().orElse("<unnamed>"));
        return true;
    }

    @Override
    public boolean createKeyspace(String keyspace, int replicationFactor) {
        log.info("Creating keyspace '{}' with replication_factor={}...", keyspace, replicationFactor);
        try {
            execute(SimpleStatement.newInstance("DROP KEYSPACE IF EXISTS " + keyspace));
            execute(SimpleStatement.newInstance(String.format(
                "CREATE KEYSPACE %s WITH replication = {'class': 'SimpleStrategy', 'replication_factor': '%d'}",
                keyspace, replicationFactor)));
            log.info("Created keyspace '{}' with RF={}", keyspace, replicationFactor);
            return true;
        } catch (DriverException e) {
            log.error("Error creating keyspace: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean createTable(String keyspace, String table) {
        log.info("Creating table '{}'...", table);
        try {
            execute(SimpleStatement.newInstance(String.format(
                "CREATE TABLE IF NOT EXISTS %s.%s (id text, value text, timestamp timestamp, PRIMARY KEY (id))",
                keyspace, table)));
            log.info("Created table '{}'", table);
            return true;
        } catch (DriverException e) {
            log.error("Error creating table: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean insert(String keyspace, String table, DataRecord record) {
        log.info("Inserting data: id='{}', value='{}'...", record.getId(), record.getValue());
        try {
            execute(SimpleStatement.newInstance(
                    String.format("INSERT INTO %s.%s (id, value, timestamp) VALUES (?, ?, ?)", keyspace, table),
                    record.getId(), record.getValue(), record.getTimestamp())
                .setConsistencyLevel(DefaultConsistencyLevel.ONE));
            log.info("Inserted data: id='{}'", record.getId());
            return true;
        } catch (DriverException e) {
            log.error("Error inserting data: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<DataRecord> query(String keyspace, String table, String id) {
        try {
            Row row = execute(SimpleStatement.newInstance(
                    String.format("SELECT * FROM %s.%s WHERE id = ?", keyspace, table), id)
                .setConsistencyLevel(DefaultConsistencyLevel.ONE))
                .one();
            if (row == null) {
                log.warn("No data returned for id '{}'", id);
                return Optional.empty();
            }
            DataRecord record = DataRecord.builder()
                .id(row.getString("id"))
                .value(row.getString("value"))
                .timestamp(row.getInstant("timestamp"))
                .build();
            log.info("Data retrieved: id={}, value={}, timestamp={}",
                record.getId(), record.getValue(), record.getTimestamp());
            return Optional.of(record);
        } catch (DriverException e) {
            log.warn("Error reading data: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public IClusterTopology topology() {
        return new DriverClusterTopology(requireSession());
    }

    @Override
    public IPartitionTokenQuery tokenQuery() {
        return new CqlTokenQuery(requireSession(), PARTITION_KEY_COLUMN);
    }

    @Override
    public void close() {
        if (session != null) {
            session.close();
            log.info("Cassandra session closed");
        }
    }

    private ResultSet execute(SimpleStatement statement) {
        log.info("CQL Query: {}", CqlRenderer.render(statement.getQuery(), statement.getPositionalValues().toArray()));
        return requireSession().execute(statement);
    }

    private CqlSession requireSession() {
        if (session == null) {
            throw new IllegalStateException("Not connected to Cassandra");
        }
        return session;
    }
}
