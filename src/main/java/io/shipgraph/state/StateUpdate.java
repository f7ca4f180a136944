package io.shipgraph.state;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record StateUpdate(int taskIndex, String node, Map<String, JsonNode> values) {
    public StateUpdate {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
