package io.shipgraph.runtime;

import io.shipgraph.model.ErrorCode;
import io.shipgraph.model.ShipGraphException;

public final class RunRejectedException extends ShipGraphException {
    public RunRejectedException(ErrorCode code, String message) {
        super(code, message);
    }
}
