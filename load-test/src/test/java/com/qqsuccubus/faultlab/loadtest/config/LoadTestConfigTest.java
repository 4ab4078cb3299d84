package com.qqsuccubus.faultlab.loadtest.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoadTestConfigTest {

    @Test
    void testDefaults() {
        LoadTestConfig config = LoadTestConfig.from(key -> null);

        assertEquals(List.of("cassandra-node1"), config.getContactPoints());
        assertEquals("test_scaling", config.getKeyspace());
        assertEquals(8, config.getNumThreads());
        assertEquals(Duration.ofSeconds(60), config.getDuration());
        assertEquals(0.5, config.getWriteRatio());
        assertEquals("ONE", config.getConsistency());
        assertEquals(5, config.getErrorLogLimit());
        assertEquals(100, config.getDeviceCount());
    }

    @Test
    void testConsistencyLevels() {
        assertEquals("QUORUM", LoadTestConfig.from(Map.of("CONSISTENCY", "quorum")::get).getConsistency());
        assertEquals("LOCAL_QUORUM", LoadTestConfig.normalizeConsistency("local_quorum"));
        assertEquals("ALL", LoadTestConfig.normalizeConsistency("ALL"));
        assertEquals("ONE", LoadTestConfig.normalizeConsistency("EACH_QUORUM"));
    }
}
