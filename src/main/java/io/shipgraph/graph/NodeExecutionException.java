package io.shipgraph.graph;

import io.shipgraph.model.ErrorCode;
import io.shipgraph.model.ShipGraphException;

public final class NodeExecutionException extends ShipGraphException {
    private final String node;

    public NodeExecutionException(String node, String message) {
        super(ErrorCode.NODE_EXECUTION, message);
        this.node = node;
    }

    public NodeExecutionException(String node, String message, Throwable cause) {
        super(ErrorCode.NODE_EXECUTION, message, cause);
        this.node = node;
    }

    public String node() {
        return node;
    }
}
