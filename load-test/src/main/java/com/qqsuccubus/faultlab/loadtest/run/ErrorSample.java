package com.qqsuccubus.faultlab.loadtest.run;

import lombok.Value;

/**
 * One failed operation kept for the summary.
 */
@Value
public class ErrorSample {
    Operation operation;
    String message;
}
