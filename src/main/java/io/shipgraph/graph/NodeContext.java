package io.shipgraph.graph;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipgraph.model.RunCancelledException;
import io.shipgraph.state.StateView;
import io.shipgraph.util.Jsons;

import java.util.List;
import java.util.function.BooleanSupplier;

public final class NodeContext {
    private final String threadId;
    private final Task task;
    private final StateView state;
    private final List<JsonNode> resumeValues;
    private final BooleanSupplier cancelled;
    private final NodeEvents events;
    private int interruptCalls;

    public NodeContext(
            String threadId,
            Task task,
            StateView state,
            List<JsonNode> resumeValues,
            BooleanSupplier cancelled,
            NodeEvents events
    ) {
        this.threadId = threadId;
        this.task = task;
        this.state = state;
        this.resumeValues = resumeValues == null ? List.of() : List.copyOf(resumeValues);
        this.cancelled = cancelled == null ? () -> false : cancelled;
        this.events = events == null ? NodeEvents.NONE : events;
    }

    public String threadId() {
        return threadId;
    }

    public String nodeName() {
        return task.node();
    }

    public int superstep() {
        return task.superstep();
    }

    public int taskIndex() {
        return task.index();
    }

    public JsonNode input() {
        return task.input().deepCopy();
    }

    public StateView state() {
        return state;
    }

    /**
     * Asks the caller for input. The n-th call of a task returns the n-th value supplied by
     * {@code resume}; when none is left the node is suspended.
     *
     * @throws GraphInterrupt always, when no resume value is available for this call
     */
    public JsonNode interrupt(Object payload) {
        int call = interruptCalls++;
        if (call < resumeValues.size()) {
            return resumeValues.get(call).deepCopy();
        }
        throw new GraphInterrupt(Jsons.tree(payload));
    }

    public boolean isCancelled() {
        return cancelled.getAsBoolean() || Thread.currentThread().isInterrupted();
    }

    public void checkCancelled() {
        if (isCancelled()) {
            throw new RunCancelledException(threadId);
        }
    }

    public void emitStatus(String message) {
        events.status(message);
    }

    public void emitProgress(String stage, Integer percent) {
        events.progress(stage, percent);
    }

    public void emitToken(String content) {
        events.token(content);
    }
}
