package com.qqsuccubus.faultlab.loadtest.run;

public enum Operation {
    WRITE,
    READ
}
