package com.qqsuccubus.faultlab.experiment.run;

import com.qqsuccubus.faultlab.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Logs the result block and optionally writes the result as JSON.
 */
public class ExperimentReporter {
    private static final Logger log = LoggerFactory.getLogger(ExperimentReporter.class);
    private static final String RULE = "=".repeat(80);

    private final Path reportPath;

    /**
     * @param reportPath JSON output file, or null to only log
     */
    public ExperimentReporter(Path reportPath) {
        this.reportPath = reportPath;
    }

    public void report(ExperimentResult result) {
        log.info(RULE);
        log.info("EXPERIMENT RESULTS");
        log.info(RULE);
        log.info("Keyspace: {} (RF={})", result.getKeyspace(), result.getReplicationFactor());
        log.info("Test data ID: {}", result.getTestKey());
        log.info("Token: {} (from {})", result.getToken(), result.getTokenSource());
        log.info("Replicas: {}", result.getReplicaAddresses());
        log.info("Node that held data: {} (container: {})", result.getReplicaNode(), result.getContainer());
        log.info("Node status: RESTARTED (healthy: {}, recognized by cluster: {})",
            yesNo(result.isContainerHealthy()), yesNo(result.isNodeRecognizedAfterRestart()));
        log.info("Data accessible after node removal: {}", result.isDataAvailableAfterStop() ? "YES ✓" : "NO ✗");
        log.info("Data accessible after node restart: {}", result.isDataAvailableAfterRestart() ? "YES ✓" : "NO ✗");

        if (result.isDataAvailableAfterStop()) {
            log.warn("UNEXPECTED: Data is still accessible even though the owning node is down");
        } else {
            log.info("EXPECTED: Data is not accessible after removing the node that owns it");
        }
        if (result.isDataAvailableAfterRestart()) {
            log.info("EXPECTED: Data is accessible again after restarting the node");
        } else {
            log.warn("UNEXPECTED: Data is still not accessible after restarting the node");
        }
        log.info(RULE);

        if (reportPath != null) {
            write(result);
        }
    }

    private void write(ExperimentResult result) {
        try {
            if (reportPath.getParent() != null) {
                Files.createDirectories(reportPath.getParent());
            }
            Files.writeString(reportPath, JsonUtils.writePretty(result), StandardCharsets.UTF_8);
            log.info("Report written to {}", reportPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report to " + reportPath, e);
        }
    }

    private static String yesNo(boolean value) {
        return value ? "YES" : "NO";
    }
}
