package com.qqsuccubus.faultlab.experiment.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration for the node failure experiment, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class ExperimentConfig {

    // Cassandra connection
    List<String> contactPoints;
    int port;
    String username;
    String password;
    String localDatacenter;

    // Data under test
    String keyspace;
    String tableName;
    String testKey;
    String testValue;
    int replicationFactor;

    // Infrastructure
    List<String> containerNames;
    ContainerRuntime containerRuntime;
    String kubernetesNamespace;

    // Timing
    int expectedNodes;
    Duration pollInterval;
    Duration clusterWait;
    Duration detectionDelay;
    Duration healthWait;
    Duration healthSettleDelay;
    int queryRetriesAfterStop;
    int queryRetriesAfterRestart;
    Duration queryRetryDelay;

    // Optional JSON report location, null to skip
    String reportPath;

    public static ExperimentConfig fromEnv() {
        return from(System::getenv);
    }

    static ExperimentConfig from(Function<String, String> env) {
        return ExperimentConfig.builder()
            .contactPoints(splitList(getEnv(env, "CASSANDRA_CONTACT_POINTS", "localhost")))
            .port(Integer.parseInt(getEnv(env, "CASSANDRA_PORT", "9042")))
            .username(getEnv(env, "CASSANDRA_USERNAME", ""))
            .password(getEnv(env, "CASSANDRA_PASSWORD", ""))
            .localDatacenter(getEnv(env, "CASSANDRA_LOCAL_DC", "datacenter1"))
            .keyspace(getEnv(env, "CASSANDRA_KEYSPACE", "experiment_rf1"))
            .tableName(getEnv(env, "TABLE_NAME", "test_data"))
            .testKey(getEnv(env, "TEST_KEY", "experiment-key-001"))
            .testValue(getEnv(env, "TEST_VALUE", "This is test data for the RF=1 experiment"))
            .replicationFactor(Integer.parseInt(getEnv(env, "REPLICATION_FACTOR", "1")))
            .containerNames(splitList(getEnv(env, "CONTAINER_NAMES", "cassandra-node1,cassandra-node2,cassandra-node3")))
            .containerRuntime(ContainerRuntime.fromString(getEnv(env, "CONTAINER_RUNTIME", "docker")))
            .kubernetesNamespace(getEnv(env, "KUBERNETES_NAMESPACE", "default"))
            .expectedNodes(Integer.parseInt(getEnv(env, "EXPECTED_NODES", "3")))
            .pollInterval(Duration.ofSeconds(Integer.parseInt(getEnv(env, "POLL_INTERVAL_SEC", "2"))))
            .clusterWait(Duration.ofSeconds(Integer.parseInt(getEnv(env, "CLUSTER_WAIT_SEC", "120"))))
            .detectionDelay(Duration.ofSeconds(Integer.parseInt(getEnv(env, "DETECTION_DELAY_SEC", "10"))))
            .healthWait(Duration.ofSeconds(Integer.parseInt(getEnv(env, "HEALTH_WAIT_SEC", "180"))))
            .healthSettleDelay(Duration.ofSeconds(Integer.parseInt(getEnv(env, "HEALTH_SETTLE_SEC", "5"))))
            .queryRetriesAfterStop(Integer.parseInt(getEnv(env, "QUERY_RETRIES_AFTER_STOP", "3")))
            .queryRetriesAfterRestart(Integer.parseInt(getEnv(env, "QUERY_RETRIES_AFTER_RESTART", "5")))
            .queryRetryDelay(Duration.ofSeconds(Integer.parseInt(getEnv(env, "QUERY_RETRY_DELAY_SEC", "3"))))
            .reportPath(emptyToNull(getEnv(env, "REPORT_PATH", "")))
            .build();
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value != null ? value : defaultValue;
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
