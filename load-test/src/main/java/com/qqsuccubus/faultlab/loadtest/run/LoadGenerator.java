package com.qqsuccubus.faultlab.loadtest.run;

import com.qqsuccubus.faultlab.loadtest.config.LoadTestConfig;
import com.qqsuccubus.faultlab.loadtest.metrics.LoadMetrics;
import com.qqsuccubus.faultlab.loadtest.target.ILoadTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Drives a mixed read/write workload against a {@link ILoadTarget}.
 * <p>
 * Each worker runs a blocking loop on the bounded-elastic scheduler until the deadline, choosing a
 * write with probability {@code writeRatio} and a device id uniformly from a fixed pool.
 * Failed operations are counted and the first {@code errorLogLimit} of them are kept as samples.
 * </p>
 */
public class LoadGenerator {
    private static final Logger log = LoggerFactory.getLogger(LoadGenerator.class);
    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final LoadTestConfig config;
    private final ILoadTarget target;
    private final LoadMetrics metrics;
    private final List<String> deviceIds;
    private final List<ErrorSample> errorSamples = Collections.synchronizedList(new ArrayList<>());

    public LoadGenerator(LoadTestConfig config, ILoadTarget target, LoadMetrics metrics) {
        this.config = config;
        this.target = target;
        this.metrics = metrics;
        this.deviceIds = generateDeviceIds(config.getDeviceCount());
    }

    /**
     * Runs all workers until the configured duration elapses.
     *
     * @return Mono emitting the summary once every worker has stopped
     */
    public Mono<LoadTestSummary> run() {
        log.info("Starting load threads={} duration={}s write_ratio={} consistency={}",
            config.getNumThreads(), config.getDuration().toSeconds(), config.getWriteRatio(), config.getConsistency());
        long deadline = System.nanoTime() + config.getDuration().toNanos();

        return Flux.range(0, config.getNumThreads())
            .flatMap(worker -> Mono.fromRunnable(() -> workerLoop(deadline))
                .subscribeOn(Schedulers.boundedElastic()), config.getNumThreads())
            .then(Mono.fromCallable(this::summarize));
    }

    private void workerLoop(long deadline) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        while (System.nanoTime() < deadline) {
            Operation op = random.nextDouble() < config.getWriteRatio() ? Operation.WRITE : Operation.READ;
            String deviceId = deviceIds.get(random.nextInt(deviceIds.size()));
            long start = System.nanoTime();
            try {
                if (op == Operation.WRITE) {
                    target.write(deviceId, Instant.now(), random.nextDouble() * 100.0);
                } else {
                    target.read(deviceId);
                }
                metrics.recordSuccess(op, start);
            } catch (RuntimeException e) {
                metrics.recordError(op);
                sampleError(op, e);
            }
        }
    }

    private void sampleError(Operation op, RuntimeException e) {
        synchronized (errorSamples) {
            if (errorSamples.size() < config.getErrorLogLimit()) {
                errorSamples.add(new ErrorSample(op, String.valueOf(e.getMessage())));
                log.debug("{} failed: {}", op, e.getMessage());
            }
        }
    }

    private LoadTestSummary summarize() {
        List<ErrorSample> samples;
        synchronized (errorSamples) {
            samples = new ArrayList<>(errorSamples);
        }
        return LoadTestSummary.builder()
            .writes(metrics.successCount(Operation.WRITE))
            .reads(metrics.successCount(Operation.READ))
            .writeErrors(metrics.errorCount(Operation.WRITE))
            .readErrors(metrics.errorCount(Operation.READ))
            .totalWriteLatencyMs(metrics.totalLatencyMs(Operation.WRITE))
            .totalReadLatencyMs(metrics.totalLatencyMs(Operation.READ))
            .duration(config.getDuration())
            .errorSamples(samples)
            .build();
    }

    List<String> deviceIds() {
        return deviceIds;
    }

    static List<String> generateDeviceIds(int count) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        List<String> ids = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            StringBuilder id = new StringBuilder("device-");
            for (int c = 0; c < 8; c++) {
                id.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
            }
            ids.add(id.toString());
        }
        return ids;
    }
}
