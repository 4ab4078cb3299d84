package com.qqsuccubus.faultlab.experiment.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Repeats an attempt until it yields a value or the attempts run out.
 * <p>
 * An attempt that throws counts as an empty attempt.
 * </p>
 */
public class AvailabilityProbe {
    private static final Logger log = LoggerFactory.getLogger(AvailabilityProbe.class);

    /**
     * @param description What is being probed, for logging
     * @param attempt     Single attempt, returning empty when the value is not available
     * @param maxAttempts Total attempts, at least 1
     * @param delay       Pause between attempts
     * @return Mono emitting the first present value, or empty Optional once attempts are exhausted
     */
    public <T> Mono<Optional<T>> untilPresent(
            String description,
            Callable<Optional<T>> attempt,
            int maxAttempts,
            Duration delay
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        AtomicInteger counter = new AtomicInteger();

        Mono<T> once = Mono.fromCallable(() -> {
                log.info("Attempt {}/{}: {}", counter.incrementAndGet(), maxAttempts, description);
                return attempt.call();
            })
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(e -> {
                log.warn("Attempt {}/{} failed: {}", counter.get(), maxAttempts, e.getMessage());
                return Mono.just(Optional.empty());
            })
            .flatMap(result -> Mono.<T>justOrEmpty(result));

        return Flux.range(0, maxAttempts)
            .concatMap(i -> {
                if (i == 0) {
                    return once;
                }
                log.info("Retrying in {}ms...", delay.toMillis());
                return once.delaySubscription(delay);
            })
            .next()
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .doOnNext(result -> {
                if (result.isEmpty()) {
                    log.warn("{}: not available after {} attempts", description, maxAttempts);
                }
            });
    }
}
