package io.shipgraph.model;

public final class RunCancelledException extends ShipGraphException {
    public RunCancelledException(String threadId) {
        super(ErrorCode.CANCELLED, "Run cancelled for thread " + threadId);
    }
}
