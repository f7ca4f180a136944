package io.shipgraph.graph;

import com.fasterxml.jackson.databind.JsonNode;

public final class GraphInterrupt extends RuntimeException {
    private final transient JsonNode payload;

    public GraphInterrupt(JsonNode payload) {
        super("Node interrupted", null, false, false);
        this.payload = payload;
    }

    public JsonNode payload() {
        return payload;
    }
}
