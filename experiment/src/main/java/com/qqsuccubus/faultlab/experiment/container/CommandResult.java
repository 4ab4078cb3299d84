package com.qqsuccubus.faultlab.experiment.container;

/**
 * Outcome of an external command.
 *
 * @param exitCode Process exit code, -1 if the process timed out
 * @param stdout   Captured standard output
 * @param stderr   Captured standard error
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
