package io.shipgraph.model;

public enum RunStatus {
    COMPLETED,
    INTERRUPTED,
    FAILED
}
