package io.shipgraph.state;

import io.shipgraph.model.ErrorCode;
import io.shipgraph.model.ShipGraphException;

public final class InvalidUpdateException extends ShipGraphException {
    public InvalidUpdateException(String message) {
        super(ErrorCode.NODE_EXECUTION, message);
    }
}
