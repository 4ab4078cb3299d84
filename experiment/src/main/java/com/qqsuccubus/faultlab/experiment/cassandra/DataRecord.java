package com.qqsuccubus.faultlab.experiment.cassandra;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One row of the experiment table {@code (id text PRIMARY KEY, value text, timestamp timestamp)}.
 */
@Value
@Builder(toBuilder = true)
public class DataRecord {
    String id;
    String value;
    Instant timestamp;
}
