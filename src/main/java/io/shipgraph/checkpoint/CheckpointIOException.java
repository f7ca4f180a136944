package io.shipgraph.checkpoint;

import io.shipgraph.model.ErrorCode;
import io.shipgraph.model.ShipGraphException;

public final class CheckpointIOException extends ShipGraphException {
    public CheckpointIOException(String message) {
        super(ErrorCode.CHECKPOINT_IO, message);
    }

    public CheckpointIOException(String message, Throwable cause) {
        super(ErrorCode.CHECKPOINT_IO, message, cause);
    }
}
