package com.qqsuccubus.faultlab.loadtest.target;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import com.datastax.oss.driver.api.core.DefaultConsistencyLevel;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.qqsuccubus.faultlab.loadtest.config.LoadTestConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Instant;

/**
 * Load target writing sensor readings to {@code sensor_data} through the DataStax driver.
 */
public class CqlLoadTarget implements ILoadTarget, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CqlLoadTarget.class);

    private final CqlSession session;
    private final PreparedStatement insert;
    private final PreparedStatement select;

    private CqlLoadTarget(CqlSession session, String keyspace, DefaultConsistencyLevel consistency) {
        this.session = session;
        this.insert = session.prepare(SimpleStatement.newInstance(String.format(
                "INSERT INTO %s.sensor_data (device_id, ts, value) VALUES (?, ?, ?)", keyspace))
            .setConsistencyLevel(consistency));
        this.select = session.prepare(SimpleStatement.newInstance(String.format(
                "SELECT * FROM %s.sensor_data WHERE device_id = ? LIMIT 50", keyspace))
            .setConsistencyLevel(consistency));
    }

    /**
     * Connects, creates the keyspace and table if missing, and prepares the statements.
     */
    public static CqlLoadTarget connect(LoadTestConfig config) {
        log.info("Connecting to Cassandra at {}:{} (keyspace={})",
            config.getContactPoints(), config.getPort(), config.getKeyspace());
        CqlSessionBuilder builder = CqlSession.builder().withLocalDatacenter(config.getLocalDatacenter());
        for (String contactPoint : config.getContactPoints()) {
            builder.addContactPoint(new InetSocketAddress(contactPoint, config.getPort()));
        }
        if (config.getUsername() != null && !config.getUsername().isEmpty()) {
            builder.withAuthCredentials(config.getUsername(), config.getPassword());
        }
        CqlSession session = builder.build();

        log.info("Ensuring keyspace {} exists with RF=1", config.getKeyspace());
        session.execute(String.format(
            "CREATE KEYSPACE IF NOT EXISTS %s WITH replication = {'class': 'SimpleStrategy', 'replication_factor': '1'}",
            config.getKeyspace()));
        session.execute(String.format(
            "CREATE TABLE IF NOT EXISTS %s.sensor_data (device_id text, ts timestamp, value double, "
                + "PRIMARY KEY (device_id, ts)) WITH CLUSTERING ORDER BY (ts DESC)",
            config.getKeyspace()));

        return new CqlLoadTarget(session, config.getKeyspace(), DefaultConsistencyLevel.valueOf(config.getConsistency()));
    }

    @Override
    public void write(String deviceId, Instant timestamp, double value) {
        session.execute(insert.bind(deviceId, timestamp, value));
    }

    @Override
    public int read(String deviceId) {
        return session.execute(select.bind(deviceId)).all().size();
    }

    @Override
    public void close() {
        session.close();
        log.info("Cassandra session closed");
    }
}
