package com.qqsuccubus.faultlab.experiment.container;

import com.qqsuccubus.faultlab.core.model.ContainerHealth;
import com.qqsuccubus.faultlab.core.spi.IContainerControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Container control that shells out to the {@code docker} command line.
 * <p>
 * Each command is logged before it runs. Lifecycle commands time out after 30s, inspections
 * after 5s.
 * </p>
 */
public class DockerCliContainerControl implements IContainerControl {
    private static final Logger log = LoggerFactory.getLogger(DockerCliContainerControl.class);

    private static final Duration LIFECYCLE_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration INSPECT_TIMEOUT = Duration.ofSeconds(5);

    private final CommandRunner runner;

    public DockerCliContainerControl() {
        this(new ProcessCommandRunner());
    }

    public DockerCliContainerControl(CommandRunner runner) {
        this.runner = runner;
    }

    @Override
    public boolean stop(String unitId) {
        log.info("Stopping container: {}", unitId);
        return lifecycle("stop", unitId);
    }

    @Override
    public boolean start(String unitId) {
        log.info("Starting container: {}", unitId);
        return lifecycle("start", unitId);
    }

    @Override
    public ContainerHealth healthStatus(String unitId) {
        Optional<String> health = inspect(unitId, "{{.State.Health.Status}}");
        if (health.isPresent() && !health.get().isBlank()) {
            ContainerHealth status = ContainerHealth.fromDockerStatus(health.get());
            if (status != ContainerHealth.UNKNOWN) {
                return status;
            }
        }

        // No healthcheck configured: fall back to the running flag
        Optional<String> running = inspect(unitId, "{{.State.Running}}");
        if (running.isEmpty()) {
            return ContainerHealth.UNKNOWN;
        }
        return "true".equals(running.get()) ? ContainerHealth.RUNNING_NO_HEALTHCHECK : ContainerHealth.NOT_RUNNING;
    }

    @Override
    public Optional<String> currentAddress(String unitId) {
        return inspect(unitId, "{{range .NetworkSettings.Networks}}{{.IPAddress}} {{end}}")
                .flatMap(out -> Arrays.stream(out.split("\\s+"))
                        .filter(ip -> !ip.isBlank())
                        .findFirst());
    }

    @Override
    public void close() {
        // Nothing to release
    }

    private boolean lifecycle(String action, String unitId) {
        try {
            CommandResult result = docker(LIFECYCLE_TIMEOUT, action, unitId);
            if (result.succeeded()) {
                log.info("Successfully {} {}", action.equals("stop") ? "stopped" : "started", unitId);
                return true;
            }
            log.error("Failed to {} {}: {}", action, unitId, result.stderr().trim());
            return false;
        } catch (IOException e) {
            log.error("Error running docker {} {}: {}", action, unitId, e.getMessage());
            return false;
        }
    }

    private Optional<String> inspect(String unitId, String format) {
        try {
            CommandResult result = docker(INSPECT_TIMEOUT, "inspect", "--format", format, unitId);
            if (!result.succeeded()) {
                log.debug("docker inspect {} failed: {}", unitId, result.stderr().trim());
                return Optional.empty();
            }
            return Optional.of(result.stdout().trim());
        } catch (IOException e) {
            log.debug("Could not inspect container {}: {}", unitId, e.getMessage());
            return Optional.empty();
        }
    }

    private CommandResult docker(Duration timeout, String... args) throws IOException {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add("docker");
        command.addAll(Arrays.asList(args));
        log.info("Docker Command: {}", String.join(" ", command));
        return runner.run(command, timeout);
    }
}
