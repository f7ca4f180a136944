package io.shipgraph.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipgraph.state.StateUpdate;

import java.util.Map;

public record PendingWrite(int taskIndex, String node, Map<String, JsonNode> update) {
    public PendingWrite {
        update = new StateUpdate(taskIndex, node, update).values();
    }

    public static PendingWrite of(StateUpdate update) {
        return new PendingWrite(update.taskIndex(), update.node(), update.values());
    }

    public StateUpdate toStateUpdate() {
        return new StateUpdate(taskIndex, node, update);
    }
}
