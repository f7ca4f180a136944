package io.shipgraph.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.shipgraph.graph.Task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable snapshot of a thread taken at a superstep boundary.
 *
 * <p>{@code next} is the frontier to execute after this checkpoint. A thread is complete when
 * the frontier is empty and no interrupt is pending.
 */
public record Checkpoint(
        String threadId,
        int superstep,
        Map<String, JsonNode> state,
        List<Task> next,
        List<PendingWrite> pendingWrites,
        PendingInterrupt pendingInterrupt,
        long createdAtMs
) {
    public Checkpoint {
        Map<String, JsonNode> values = new LinkedHashMap<>();
        if (state != null) {
            state.forEach((k, v) -> values.put(k, v == null ? NullNode.getInstance() : v));
        }
        state = Collections.unmodifiableMap(values);
        next = next == null ? List.of() : List.copyOf(next);
        pendingWrites = pendingWrites == null ? List.of() : List.copyOf(pendingWrites);
    }

    @JsonIgnore
    public boolean isComplete() {
        return next.isEmpty() && pendingInterrupt == null;
    }

    @JsonIgnore
    public boolean isInterrupted() {
        return pendingInterrupt != null;
    }
}
