package io.shipgraph.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipgraph.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public record PendingInterrupt(
        String id,
        String node,
        int taskIndex,
        JsonNode payload,
        List<JsonNode> resumeValues
) {
    public PendingInterrupt {
        payload = Jsons.orNull(payload);
        List<JsonNode> values = new ArrayList<>();
        if (resumeValues != null) {
            for (JsonNode value : resumeValues) {
                values.add(Jsons.orNull(value));
            }
        }
        resumeValues = List.copyOf(values);
    }

    public static PendingInterrupt raised(String node, int taskIndex, JsonNode payload, List<JsonNode> resumeValues) {
        return new PendingInterrupt("int_" + UUID.randomUUID(), node, taskIndex, payload, resumeValues);
    }

    public List<JsonNode> resumeValuesWith(JsonNode value) {
        List<JsonNode> values = new ArrayList<>(resumeValues);
        values.add(Jsons.orNull(value));
        return values;
    }
}
