package io.shipgraph.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipgraph.graph.CompiledGraph;
import io.shipgraph.graph.GraphInterrupt;
import io.shipgraph.graph.NodeAction;
import io.shipgraph.graph.NodeContext;
import io.shipgraph.graph.NodeEvents;
import io.shipgraph.graph.NodeExecutionException;
import io.shipgraph.graph.NodeResult;
import io.shipgraph.graph.Task;
import io.shipgraph.model.RunCancelledException;
import io.shipgraph.model.ShipGraphException;
import io.shipgraph.state.StateUpdate;
import io.shipgraph.state.StateView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the tasks of one superstep on the shared worker pool and waits at the barrier.
 *
 * <p>The first failure, a cancellation, or a task that runs or waits for a worker past its
 * timeout cancels every task still in flight. Interrupts do not: the other tasks finish so
 * their writes can be kept.
 */
final class SuperstepExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(SuperstepExecutor.class);
    private static final long POLL_MS = 20L;

    private final CompiledGraph graph;
    private final ExecutorService workers;
    private final long taskTimeoutMs;

    SuperstepExecutor(CompiledGraph graph, ExecutorService workers, long taskTimeoutMs) {
        this.graph = graph;
        this.workers = workers;
        this.taskTimeoutMs = taskTimeoutMs;
    }

    SuperstepOutcome run(
            String threadId,
            List<Task> tasks,
            StateView state,
            ResumePlan plan,
            AtomicBoolean cancelled,
            RunEventListener listener
    ) {
        List<StateUpdate> updates = new ArrayList<>();
        List<SuperstepOutcome.TaskInterrupt> interrupts = new ArrayList<>();
        CompletionService<TaskOutcome> completion = new ExecutorCompletionService<>(workers);
        List<Running> running = new ArrayList<>();

        for (Task task : tasks) {
            StateUpdate reused = plan.pendingWrites().get(task.index());
            if (reused != null) {
                updates.add(reused);
                continue;
            }
            NodeAction action = graph.registry().require(task.node());
            List<JsonNode> resumeValues = plan.resumeValuesFor(task.index());
            AtomicLong startedAt = new AtomicLong();
            NodeContext ctx = new NodeContext(threadId, task, state, resumeValues, cancelled::get,
                    new ListenerEvents(threadId, listener));
            long submittedAt = System.nanoTime();
            Future<TaskOutcome> future = completion.submit(() -> {
                startedAt.set(System.nanoTime());
                return execute(task, action, ctx, resumeValues);
            });
            running.add(new Running(task, future, submittedAt, startedAt));
        }

        ShipGraphException failure = null;
        int remaining = running.size();
        long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(taskTimeoutMs);
        while (remaining > 0 && failure == null) {
            Future<TaskOutcome> done;
            try {
                done = completion.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failure = new RunCancelledException(threadId);
                break;
            }
            if (done != null) {
                remaining--;
                TaskOutcome outcome = outcomeOf(threadId, done);
                switch (outcome.kind()) {
                    case UPDATE -> updates.add(outcome.update());
                    case INTERRUPT -> interrupts.add(new SuperstepOutcome.TaskInterrupt(
                            outcome.task(), outcome.payload(), outcome.resumeValues()));
                    case FAILURE -> failure = outcome.failure();
                }
                continue;
            }
            if (cancelled.get()) {
                failure = new RunCancelledException(threadId);
                break;
            }
            long now = System.nanoTime();
            for (Running r : running) {
                failure = timedOut(r, now, timeoutNanos);
                if (failure != null) {
                    break;
                }
            }
        }

        if (failure != null) {
            for (Running r : running) {
                r.future().cancel(true);
            }
            LOG.debug("Superstep of thread {} aborted: {}", threadId, failure.getMessage());
        }
        return new SuperstepOutcome(updates, interrupts, failure);
    }

    // Queued tasks count from submission, running tasks from their start.
    private NodeExecutionException timedOut(Running r, long now, long timeoutNanos) {
        if (r.future().isDone()) {
            return null;
        }
        long started = r.startedAt().get();
        String node = r.task().node();
        if (started == 0L) {
            if (now - r.submittedAt() <= timeoutNanos) {
                return null;
            }
            LOG.warn("Node {} found no free worker within {} ms; a timed-out node may still hold one", node, taskTimeoutMs);
            return new NodeExecutionException(node,
                    "Node '" + node + "' waited longer than the task timeout of " + taskTimeoutMs + " ms for a worker");
        }
        if (now - started <= timeoutNanos) {
            return null;
        }
        return new NodeExecutionException(node, "Node '" + node + "' exceeded task timeout of " + taskTimeoutMs + " ms");
    }

    private static TaskOutcome execute(Task task, NodeAction action, NodeContext ctx, List<JsonNode> resumeValues) {
        try {
            NodeResult result = action.apply(ctx);
            if (result == null) {
                result = NodeResult.empty();
            }
            return switch (result.kind()) {
                case UPDATE -> TaskOutcome.update(task, new StateUpdate(task.index(), task.node(), result.update()));
                case INTERRUPT -> TaskOutcome.interrupt(task, result.interruptPayload(), resumeValues);
                case FAILURE -> TaskOutcome.failure(task, new NodeExecutionException(task.node(),
                        "Node '" + task.node() + "' failed: " + result.error(), result.cause()));
            };
        } catch (GraphInterrupt e) {
            return TaskOutcome.interrupt(task, e.payload(), resumeValues);
        } catch (ShipGraphException e) {
            return TaskOutcome.failure(task, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskOutcome.failure(task, new NodeExecutionException(task.node(),
                    "Node '" + task.node() + "' was interrupted", e));
        } catch (Exception e) {
            return TaskOutcome.failure(task, new NodeExecutionException(task.node(),
                    "Node '" + task.node() + "' failed: " + e.getMessage(), e));
        }
    }

    private static TaskOutcome outcomeOf(String threadId, Future<TaskOutcome> done) {
        try {
            return done.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return TaskOutcome.failure(null, new NodeExecutionException(null, "Task crashed: " + cause, cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskOutcome.failure(null, new RunCancelledException(threadId));
        }
    }

    private record Running(Task task, Future<TaskOutcome> future, long submittedAt, AtomicLong startedAt) {
    }

    private record TaskOutcome(
            Kind kind,
            Task task,
            StateUpdate update,
            JsonNode payload,
            List<JsonNode> resumeValues,
            ShipGraphException failure
    ) {
        enum Kind {
            UPDATE,
            INTERRUPT,
            FAILURE
        }

        static TaskOutcome update(Task task, StateUpdate update) {
            return new TaskOutcome(Kind.UPDATE, task, update, null, null, null);
        }

        static TaskOutcome interrupt(Task task, JsonNode payload, List<JsonNode> resumeValues) {
            return new TaskOutcome(Kind.INTERRUPT, task, null, payload, resumeValues, null);
        }

        static TaskOutcome failure(Task task, ShipGraphException failure) {
            return new TaskOutcome(Kind.FAILURE, task, null, null, null, failure);
        }
    }

    private static final class ListenerEvents implements NodeEvents {
        private final String threadId;
        private final RunEventListener listener;

        private ListenerEvents(String threadId, RunEventListener listener) {
            this.threadId = threadId;
            this.listener = listener;
        }

        @Override
        public void status(String message) {
            deliver(listener, RunEvent.status(threadId, message));
        }

        @Override
        public void progress(String stage, Integer percent) {
            deliver(listener, RunEvent.progress(threadId, stage, percent));
        }

        @Override
        public void token(String content) {
            deliver(listener, RunEvent.token(threadId, content));
        }
    }

    static void deliver(RunEventListener listener, RunEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Run event listener failed on {} event of thread {}", event.type().wireName(), event.threadId(), e);
        }
    }
}
