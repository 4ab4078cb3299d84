package com.qqsuccubus.faultlab.loadtest.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration for the mixed read/write load test, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class LoadTestConfig {
    private static final Set<String> CONSISTENCY_LEVELS = Set.of("ONE", "QUORUM", "LOCAL_QUORUM", "ALL");

    List<String> contactPoints;
    int port;
    String username;
    String password;
    String localDatacenter;
    String keyspace;

    int numThreads;
    Duration duration;
    double writeRatio;
    String consistency;
    int errorLogLimit;
    int deviceCount;

    public static LoadTestConfig fromEnv() {
        return from(System::getenv);
    }

    static LoadTestConfig from(Function<String, String> env) {
        return LoadTestConfig.builder()
            .contactPoints(splitList(getEnv(env, "CASSANDRA_CONTACT_POINTS", "cassandra-node1")))
            .port(Integer.parseInt(getEnv(env, "CASSANDRA_PORT", "9042")))
            .username(getEnv(env, "CASSANDRA_USERNAME", ""))
            .password(getEnv(env, "CASSANDRA_PASSWORD", ""))
            .localDatacenter(getEnv(env, "CASSANDRA_LOCAL_DC", "datacenter1"))
            .keyspace(getEnv(env, "CASSANDRA_KEYSPACE", "test_scaling"))
            .numThreads(Integer.parseInt(getEnv(env, "NUM_THREADS", "8")))
            .duration(Duration.ofSeconds(Integer.parseInt(getEnv(env, "DURATION_SECONDS", "60"))))
            .writeRatio(Double.parseDouble(getEnv(env, "WRITE_RATIO", "0.5")))
            .consistency(normalizeConsistency(getEnv(env, "CONSISTENCY", "ONE")))
            .errorLogLimit(Integer.parseInt(getEnv(env, "ERROR_LOG_LIMIT", "5")))
            .deviceCount(Integer.parseInt(getEnv(env, "DEVICE_COUNT", "100")))
            .build();
    }

    /**
     * Unsupported levels fall back to ONE.
     */
    static String normalizeConsistency(String value) {
        String upper = value.trim().toUpperCase();
        return CONSISTENCY_LEVELS.contains(upper) ? upper : "ONE";
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
}
