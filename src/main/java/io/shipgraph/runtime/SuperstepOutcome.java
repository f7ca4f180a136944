package io.shipgraph.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipgraph.graph.Task;
import io.shipgraph.model.ShipGraphException;
import io.shipgraph.state.StateUpdate;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

record SuperstepOutcome(
        List<StateUpdate> updates,
        List<TaskInterrupt> interrupts,
        ShipGraphException failure
) {
    SuperstepOutcome {
        updates = List.copyOf(updates);
        interrupts = List.copyOf(interrupts);
    }

    boolean failed() {
        return failure != null;
    }

    boolean interrupted() {
        return failure == null && !interrupts.isEmpty();
    }

    Optional<TaskInterrupt> firstInterrupt() {
        return interrupts.stream().min(Comparator.comparingInt(i -> i.task().index()));
    }

    record TaskInterrupt(Task task, JsonNode payload, List<JsonNode> resumeValues) {
    }
}
