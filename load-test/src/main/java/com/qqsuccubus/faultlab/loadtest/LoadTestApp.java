package com.qqsuccubus.faultlab.loadtest;

import com.datastax.oss.driver.api.core.AllNodesFailedException;
import com.qqsuccubus.faultlab.loadtest.config.LoadTestConfig;
import com.qqsuccubus.faultlab.loadtest.metrics.LoadMetrics;
import com.qqsuccubus.faultlab.loadtest.run.LoadGenerator;
import com.qqsuccubus.faultlab.loadtest.run.LoadTestSummary;
import com.qqsuccubus.faultlab.loadtest.target.CqlLoadTarget;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the Cassandra load test.
 */
public class LoadTestApp {
    private static final Logger log = LoggerFactory.getLogger(LoadTestApp.class);

    public static void main(String[] args) {
        LoadTestConfig config = LoadTestConfig.fromEnv();

        CqlLoadTarget target;
        try {
            target = CqlLoadTarget.connect(config);
        } catch (AllNodesFailedException e) {
            log.error("Unable to connect to Cassandra: {}", e.getMessage());
            System.exit(1);
            return;
        }

        try (target) {
            LoadTestSummary summary = new LoadGenerator(config, target, new LoadMetrics(new SimpleMeterRegistry()))
                .run()
                .block();
            if (summary != null) {
                log.info("\n{}", summary.format());
            }
        }
    }
}
