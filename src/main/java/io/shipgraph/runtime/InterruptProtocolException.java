package io.shipgraph.runtime;

import io.shipgraph.model.ErrorCode;
import io.shipgraph.model.ShipGraphException;

public final class InterruptProtocolException extends ShipGraphException {
    public InterruptProtocolException(String message) {
        super(ErrorCode.INTERRUPT_PROTOCOL, message);
    }
}
