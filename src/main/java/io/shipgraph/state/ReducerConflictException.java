package io.shipgraph.state;

import io.shipgraph.model.ErrorCode;
import io.shipgraph.model.ShipGraphException;

public final class ReducerConflictException extends ShipGraphException {
    private final String channel;

    public ReducerConflictException(String channel, String node, Throwable cause) {
        super(ErrorCode.REDUCER_CONFLICT,
                "Reducer for channel '" + channel + "' rejected update from node '" + node + "': " + cause.getMessage(),
                cause);
        this.channel = channel;
    }

    public String channel() {
        return channel;
    }
}
