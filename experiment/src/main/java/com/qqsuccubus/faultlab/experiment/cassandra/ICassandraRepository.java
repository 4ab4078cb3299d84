package com.qqsuccubus.faultlab.experiment.cassandra;

import com.qqsuccubus.faultlab.core.spi.IClusterTopology;
import com.qqsuccubus.faultlab.core.spi.IPartitionTokenQuery;

import java.util.Optional;

/**
 * Interface for Cassandra operations used by the experiment (Dependency Inversion Principle).
 * <p>
 * Enables testing the orchestration with in-memory implementations. Failures are logged and
 * reported through return values; none of these methods throw on driver errors.
 * </p>
 */
public interface ICassandraRepository {

    /**
     * Opens the session.
     *
     * @return false if no contact point could be reached
     */
    boolean connect();

    /**
     * Drops the keyspace if present and recreates it with SimpleStrategy.
     */
    boolean createKeyspace(String keyspace, int replicationFactor);

    boolean createTable(String keyspace, String table);

    /**
     * Inserts at consistency ONE.
     */
    boolean insert(String keyspace, String table, DataRecord record);

    /**
     * Single read attempt at consistency ONE.
     *
     * @return The row, or empty if it is missing or the read failed
     */
    Optional<DataRecord> query(String keyspace, String table, String id);

    /**
     * Topology view over the live session metadata.
     */
    IClusterTopology topology();

    /**
     * Token query capability over the live session.
     */
    IPartitionTokenQuery tokenQuery();

    /**
     * Closes the session.
     */
    void close();
}
