package com.qqsuccubus.faultlab.core.model;

import lombok.Value;

/**
 * The token selected for a key together with the comparison that led to it.
 */
@Value
public class ResolvedToken {
    PartitionToken token;
    TokenComparison comparison;
}
