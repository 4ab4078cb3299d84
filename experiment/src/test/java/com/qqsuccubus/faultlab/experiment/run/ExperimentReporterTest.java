package com.qqsuccubus.faultlab.experiment.run;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.faultlab.core.model.PartitionToken;
import com.qqsuccubus.faultlab.core.util.JsonUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentReporterTest {

    private static ExperimentResult.ExperimentResultBuilder result() {
        return ExperimentResult.builder()
            .keyspace("experiment_rf1")
            .replicationFactor(1)
            .testKey("experiment-key-001")
            .token(42L)
            .tokenSource(PartitionToken.Source.LOCAL_HASH)
            .replicaAddress("10.0.0.2")
            .replicaNode("10.0.0.2")
            .container("cassandra-node2")
            .startedAt(Instant.parse("2024-01-01T00:00:00Z"))
            .finishedAt(Instant.parse("2024-01-01T00:01:00Z"));
    }

    @Test
    void testExitCodeMapping() {
        assertEquals(0, result().dataAvailableAfterStop(false).dataAvailableAfterRestart(true).build().exitCode());
        assertEquals(1, result().dataAvailableAfterStop(true).dataAvailableAfterRestart(true).build().exitCode());
        assertEquals(1, result().dataAvailableAfterStop(false).dataAvailableAfterRestart(false).build().exitCode());
        assertEquals(1, result().dataAvailableAfterStop(true).dataAvailableAfterRestart(false).build().exitCode());
    }

    @Test
    void testWritesJsonReport(@TempDir Path dir) throws Exception {
        Path report = dir.resolve("reports/result.json");

        new ExperimentReporter(report).report(result().dataAvailableAfterRestart(true).build());

        JsonNode json = JsonUtils.mapper().readTree(Files.readString(report));
        assertEquals("cassandra-node2", json.get("container").asText());
        assertEquals("LOCAL_HASH", json.get("tokenSource").asText());
        assertEquals("2024-01-01T00:00:00Z", json.get("startedAt").asText());
        assertTrue(json.get("expectedOutcome").asBoolean());
        assertEquals("10.0.0.2", json.get("replicaAddresses").get(0).asText());
    }

    @Test
    void testNoReportPathOnlyLogs(@TempDir Path dir) throws Exception {
        new ExperimentReporter(null).report(result().build());

        try (var files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }
}
