package io.shipgraph.graph;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipgraph.util.Jsons;

public record Send(String node, JsonNode input) {
    public Send {
        if (node == null || node.isBlank()) {
            throw new IllegalArgumentException("send target must not be blank");
        }
        input = Jsons.orNull(input);
    }

    public static Send to(String node, Object input) {
        return new Send(node, Jsons.tree(input));
    }
}
