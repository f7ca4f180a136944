package io.shipgraph.state;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Combines a channel's current value with one incoming update. Implementations must be pure:
 * never mutate either argument, always return a fresh tree.
 */
@FunctionalInterface
public interface Reducer {
    JsonNode reduce(JsonNode current, JsonNode update);
}
