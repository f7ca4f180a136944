package io.shipgraph.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipgraph.checkpoint.PendingInterrupt;
import io.shipgraph.model.ErrorCode;
import io.shipgraph.model.RunStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RunResult(
        RunStatus status,
        String threadId,
        Map<String, JsonNode> state,
        PendingInterrupt interrupt,
        RunError error
) {
    public RunResult {
        state = state == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }

    public static RunResult completed(String threadId, Map<String, JsonNode> state) {
        return new RunResult(RunStatus.COMPLETED, threadId, state, null, null);
    }

    public static RunResult interrupted(String threadId, Map<String, JsonNode> state, PendingInterrupt interrupt) {
        return new RunResult(RunStatus.INTERRUPTED, threadId, state, interrupt, null);
    }

    public static RunResult failed(String threadId, ErrorCode code, String message) {
        return new RunResult(RunStatus.FAILED, threadId, Map.of(), null, new RunError(code, message));
    }

    public record RunError(ErrorCode code, String message) {
    }
}
