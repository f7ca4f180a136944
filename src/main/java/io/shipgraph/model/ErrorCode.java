package io.shipgraph.model;

import java.util.Locale;

public enum ErrorCode {
    COMPILE,
    NODE_EXECUTION,
    REDUCER_CONFLICT,
    CHECKPOINT_IO,
    INTERRUPT_PROTOCOL,
    CANCELLED,
    SUPERSTEP_LIMIT,
    INVALID_INPUT,
    THREAD_BUSY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
