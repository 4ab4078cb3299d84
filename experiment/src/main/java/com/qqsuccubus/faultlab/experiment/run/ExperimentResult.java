package com.qqsuccubus.faultlab.experiment.run;

import com.qqsuccubus.faultlab.core.model.PartitionToken;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one node failure run.
 */
@Value
@Builder
public class ExperimentResult {
    String keyspace;
    int replicationFactor;
    String testKey;
    long token;
    PartitionToken.Source tokenSource;
    @Singular
    List<String> replicaAddresses;
    String replicaNode;
    String container;
    boolean dataAvailableAfterStop;
    boolean containerHealthy;
    boolean nodeRecognizedAfterRestart;
    boolean dataAvailableAfterRestart;
    Instant startedAt;
    Instant finishedAt;

    /**
     * True when the data was unavailable while its only replica was down and readable again after restart.
     */
    public boolean isExpectedOutcome() {
        return !dataAvailableAfterStop && dataAvailableAfterRestart;
    }

    public int exitCode() {
        return isExpectedOutcome() ? 0 : 1;
    }
}
