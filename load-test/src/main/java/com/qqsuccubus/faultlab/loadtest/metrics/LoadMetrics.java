package com.qqsuccubus.faultlab.loadtest.metrics;

import com.qqsuccubus.faultlab.core.metrics.MetricsNames;
import com.qqsuccubus.faultlab.loadtest.run.Operation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for the load test.
 */
public class LoadMetrics {
    private final Timer writeLatency;
    private final Timer readLatency;
    private final Counter writeErrors;
    private final Counter readErrors;

    public LoadMetrics(MeterRegistry registry) {
        writeLatency = Timer.builder(MetricsNames.LOAD_WRITE_LATENCY)
            .description("Latency of successful writes")
            .register(registry);

        readLatency = Timer.builder(MetricsNames.LOAD_READ_LATENCY)
            .description("Latency of successful reads")
            .register(registry);

        writeErrors = Counter.builder(MetricsNames.LOAD_ERRORS_TOTAL)
            .tag(MetricsNames.TAG_OP, "write")
            .description("Failed writes")
            .register(registry);

        readErrors = Counter.builder(MetricsNames.LOAD_ERRORS_TOTAL)
            .tag(MetricsNames.TAG_OP, "read")
            .description("Failed reads")
            .register(registry);
    }

    public void recordSuccess(Operation op, long startNanos) {
        timer(op).record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordError(Operation op) {
        (op == Operation.WRITE ? writeErrors : readErrors).increment();
    }

    public long successCount(Operation op) {
        return timer(op).count();
    }

    public long errorCount(Operation op) {
        return (long) (op == Operation.WRITE ? writeErrors : readErrors).count();
    }

    public double totalLatencyMs(Operation op) {
        return timer(op).totalTime(TimeUnit.MILLISECONDS);
    }

    private Timer timer(Operation op) {
        return op == Operation.WRITE ? writeLatency : readLatency;
    }
}
