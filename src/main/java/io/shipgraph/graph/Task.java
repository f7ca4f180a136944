package io.shipgraph.graph;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipgraph.util.Jsons;

public record Task(String node, JsonNode input, int superstep, int index) {
    public Task {
        input = Jsons.orNull(input);
    }
}
