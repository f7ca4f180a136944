package io.shipgraph.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipgraph.state.StateUpdate;

import java.util.List;
import java.util.Map;

record ResumePlan(Map<Integer, List<JsonNode>> resumeValues, Map<Integer, StateUpdate> pendingWrites) {
    static final ResumePlan NONE = new ResumePlan(Map.of(), Map.of());

    ResumePlan {
        resumeValues = Map.copyOf(resumeValues);
        pendingWrites = Map.copyOf(pendingWrites);
    }

    List<JsonNode> resumeValuesFor(int taskIndex) {
        return resumeValues.getOrDefault(taskIndex, List.of());
    }
}
