package io.shipgraph.runtime;

import io.shipgraph.model.ErrorCode;
import io.shipgraph.model.ShipGraphException;

public final class SuperstepLimitException extends ShipGraphException {
    public SuperstepLimitException(String threadId, int limit) {
        super(ErrorCode.SUPERSTEP_LIMIT, "Thread " + threadId + " exceeded " + limit + " supersteps in one invocation");
    }
}
