package com.qqsuccubus.faultlab.experiment;

import com.qqsuccubus.faultlab.core.spi.IContainerControl;
import com.qqsuccubus.faultlab.experiment.cassandra.CassandraRepository;
import com.qqsuccubus.faultlab.experiment.config.ExperimentConfig;
import com.qqsuccubus.faultlab.experiment.container.ContainerControls;
import com.qqsuccubus.faultlab.experiment.run.ExperimentReporter;
import com.qqsuccubus.faultlab.experiment.run.NodeFailureExperiment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Entry point for the node failure experiment.
 * <p>
 * Reads configuration from the environment, runs the experiment and exits with its result code.
 * </p>
 */
public class ExperimentApp {
    private static final Logger log = LoggerFactory.getLogger(ExperimentApp.class);

    public static void main(String[] args) {
        ExperimentConfig config = ExperimentConfig.fromEnv();
        log.info("Starting experiment: keyspace={}, containers={}, runtime={}",
            config.getKeyspace(), config.getContainerNames(), config.getContainerRuntime());

        int exitCode;
        IContainerControl containerControl = ContainerControls.create(config);
        try {
            ExperimentReporter reporter = new ExperimentReporter(
                config.getReportPath() != null ? Path.of(config.getReportPath()) : null);
            exitCode = new NodeFailureExperiment(config, new CassandraRepository(config), containerControl, reporter)
                .run();
        } catch (Exception e) {
            log.error("Experiment failed", e);
            exitCode = 1;
        } finally {
            containerControl.close();
        }

        log.info("Experiment finished with exit code {}", exitCode);
        System.exit(exitCode);
    }
}
