package com.qqsuccubus.faultlab.loadtest.run;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Totals of one load test run.
 */
@Value
@Builder
public class LoadTestSummary {
    long writes;
    long reads;
    long writeErrors;
    long readErrors;
    double totalWriteLatencyMs;
    double totalReadLatencyMs;
    Duration duration;
    @Singular
    List<ErrorSample> errorSamples;

    public long totalOperations() {
        return writes + reads;
    }

    /**
     * Successful operations per second over the configured duration.
     */
    public double throughput() {
        double seconds = duration.toMillis() / 1000.0;
        return seconds > 0 ? totalOperations() / seconds : 0.0;
    }

    /**
     * @return Average in milliseconds, or NaN if there were no successful writes
     */
    public double averageWriteLatencyMs() {
        return writes > 0 ? totalWriteLatencyMs / writes : Double.NaN;
    }

    /**
     * @return Average in milliseconds, or NaN if there were no successful reads
     */
    public double averageReadLatencyMs() {
        return reads > 0 ? totalReadLatencyMs / reads : Double.NaN;
    }

    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Load Test Summary ===\n");
        sb.append("Total operations: ").append(totalOperations()).append('\n');
        sb.append("  Writes: ").append(writes).append(" (errors=").append(writeErrors).append(")\n");
        sb.append("  Reads : ").append(reads).append(" (errors=").append(readErrors).append(")\n");
        if (!duration.isZero()) {
            sb.append(String.format(Locale.ROOT, "Throughput: %.1f ops/sec%n", throughput()));
        }
        if (writes > 0) {
            sb.append(String.format(Locale.ROOT, "Avg write latency: %.2f ms%n", averageWriteLatencyMs()));
        }
        if (reads > 0) {
            sb.append(String.format(Locale.ROOT, "Avg read latency : %.2f ms%n", averageReadLatencyMs()));
        }
        if (!errorSamples.isEmpty()) {
            sb.append("\nSample errors:\n");
            for (ErrorSample sample : errorSamples) {
                sb.append("  [").append(sample.getOperation()).append("] ").append(sample.getMessage()).append('\n');
            }
        }
        return sb.toString();
    }
}
