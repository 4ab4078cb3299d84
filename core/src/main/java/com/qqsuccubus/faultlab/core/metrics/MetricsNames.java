package com.qqsuccubus.faultlab.core.metrics;

/**
 * Micrometer metric names used across the harness.
 * <p>
 * <b>Naming convention:</b> {@code faultlab.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Timer: Latency of successful load-test writes.
     */
    public static final String LOAD_WRITE_LATENCY = "faultlab.load.write.latency";

    /**
     * Timer: Latency of successful load-test reads.
     */
    public static final String LOAD_READ_LATENCY = "faultlab.load.read.latency";

    /**
     * Counter: Failed load-test operations.
     * <p>
     * Tags: op (write/read)
     * </p>
     */
    public static final String LOAD_ERRORS_TOTAL = "faultlab.load.errors.total";

    public static final String TAG_OP = "op";
}
