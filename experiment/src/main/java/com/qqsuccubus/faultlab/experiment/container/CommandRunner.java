package com.qqsuccubus.faultlab.experiment.container;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command and waits for it.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @param command Program and arguments
     * @param timeout Maximum time to wait; the process is killed after that
     * @return Result, with exit code -1 on timeout
     * @throws IOException if the process cannot be started
     */
    CommandResult run(List<String> command, Duration timeout) throws IOException;
}
