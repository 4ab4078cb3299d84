package com.qqsuccubus.faultlab.experiment.container;

import com.qqsuccubus.faultlab.core.model.ContainerHealth;
import com.qqsuccubus.faultlab.core.spi.IContainerControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Polls a container until it reports healthy.
 * <p>
 * A container that runs without a healthcheck counts as ready after a short settle delay.
 * Timing out is not an error: the returned {@code Mono} emits {@code false}.
 * </p>
 */
public class ContainerHealthWaiter {
    private static final Logger log = LoggerFactory.getLogger(ContainerHealthWaiter.class);

    private final IContainerControl control;
    private final Duration pollInterval;
    private final Duration settleDelay;

    public ContainerHealthWaiter(IContainerControl control, Duration pollInterval, Duration settleDelay) {
        this.control = control;
        this.pollInterval = pollInterval;
        this.settleDelay = settleDelay;
    }

    /**
     * Waits until the unit is healthy or {@code maxWait} elapses.
     *
     * @param unitId  Container or pod name
     * @param maxWait Upper bound on polling
     * @return Mono emitting true if the unit became ready, false on timeout
     */
    public Mono<Boolean> waitUntilHealthy(String unitId, Duration maxWait) {
        log.info("Waiting for {} to become healthy (max {}s)...", unitId, maxWait.toSeconds());
        long started = System.nanoTime();

        return Flux.interval(Duration.ZERO, pollInterval)
            .onBackpressureDrop()
            .concatMap(tick -> Mono.fromCallable(() -> control.healthStatus(unitId))
                .subscribeOn(Schedulers.boundedElastic()))
            .doOnNext(health -> log.info("  Container {} health: {} ({}s elapsed)",
                unitId, health, Duration.ofNanos(System.nanoTime() - started).toSeconds()))
            .filter(health -> health == ContainerHealth.HEALTHY || health == ContainerHealth.RUNNING_NO_HEALTHCHECK)
            .next()
            .timeout(maxWait)
            .flatMap(health -> {
                if (health == ContainerHealth.HEALTHY) {
                    log.info("Container {} is healthy", unitId);
                    return Mono.just(true);
                }
                log.info("Container {} is running without a healthcheck, waiting {}s to settle",
                    unitId, settleDelay.toSeconds());
                return Mono.delay(settleDelay).thenReturn(true);
            })
            .onErrorResume(TimeoutException.class, e -> {
                log.warn("Container {} did not become healthy within {}s", unitId, maxWait.toSeconds());
                return Mono.just(false);
            });
    }
}
