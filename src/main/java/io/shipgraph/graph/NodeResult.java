package io.shipgraph.graph;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipgraph.util.Jsons;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record NodeResult(
        Kind kind,
        Map<String, JsonNode> update,
        JsonNode interruptPayload,
        String error,
        Throwable cause
) {
    public enum Kind {
        UPDATE,
        INTERRUPT,
        FAILURE
    }

    public NodeResult {
        update = update == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(update));
    }

    public static NodeResult update(Map<String, ?> values) {
        Map<String, JsonNode> update = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((channel, value) -> update.put(channel, Jsons.tree(value)));
        }
        return new NodeResult(Kind.UPDATE, update, null, null, null);
    }

    public static NodeResult update(String channel, Object value) {
        Map<String, JsonNode> update = new LinkedHashMap<>();
        update.put(channel, Jsons.tree(value));
        return new NodeResult(Kind.UPDATE, update, null, null, null);
    }

    public static NodeResult empty() {
        return new NodeResult(Kind.UPDATE, Map.of(), null, null, null);
    }

    public static NodeResult interrupt(Object payload) {
        return new NodeResult(Kind.INTERRUPT, Map.of(), Jsons.tree(payload), null, null);
    }

    public static NodeResult fail(String error) {
        return new NodeResult(Kind.FAILURE, Map.of(), null, error, null);
    }

    public static NodeResult fail(String error, Throwable cause) {
        return new NodeResult(Kind.FAILURE, Map.of(), null, error, cause);
    }
}
