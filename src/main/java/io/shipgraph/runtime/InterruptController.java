package io.shipgraph.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipgraph.checkpoint.Checkpoint;
import io.shipgraph.checkpoint.PendingInterrupt;
import io.shipgraph.checkpoint.PendingWrite;
import io.shipgraph.state.StateUpdate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class InterruptController {

    Checkpoint suspend(Checkpoint before, SuperstepOutcome outcome, long nowMs) {
        SuperstepOutcome.TaskInterrupt first = outcome.firstInterrupt()
                .orElseThrow(() -> new IllegalStateException("Superstep has no interrupt to suspend on"));
        List<PendingWrite> writes = new ArrayList<>();
        for (StateUpdate update : outcome.updates()) {
            writes.add(PendingWrite.of(update));
        }
        PendingInterrupt interrupt = PendingInterrupt.raised(
                first.task().node(), first.task().index(), first.payload(), first.resumeValues());
        return new Checkpoint(
                before.threadId(),
                before.superstep(),
                before.state(),
                before.next(),
                writes,
                interrupt,
                nowMs
        );
    }

    ResumePlan resumePlan(Checkpoint checkpoint, JsonNode value) {
        PendingInterrupt pending = checkpoint.pendingInterrupt();
        if (pending == null) {
            throw new InterruptProtocolException("Thread " + checkpoint.threadId() + " has no pending interrupt");
        }
        Map<Integer, List<JsonNode>> resumeValues = new HashMap<>();
        resumeValues.put(pending.taskIndex(), pending.resumeValuesWith(value));
        return new ResumePlan(resumeValues, pendingWrites(checkpoint));
    }

    ResumePlan continuePlan(Checkpoint checkpoint) {
        PendingInterrupt pending = checkpoint.pendingInterrupt();
        if (pending == null) {
            return ResumePlan.NONE;
        }
        Map<Integer, List<JsonNode>> resumeValues = new HashMap<>();
        resumeValues.put(pending.taskIndex(), pending.resumeValues());
        return new ResumePlan(resumeValues, pendingWrites(checkpoint));
    }

    private static Map<Integer, StateUpdate> pendingWrites(Checkpoint checkpoint) {
        Map<Integer, StateUpdate> writes = new HashMap<>();
        for (PendingWrite write : checkpoint.pendingWrites()) {
            writes.put(write.taskIndex(), write.toStateUpdate());
        }
        return writes;
    }
}
