package io.shipgraph.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipgraph.checkpoint.Checkpoint;
import io.shipgraph.checkpoint.CheckpointStore;
import io.shipgraph.checkpoint.CheckpointStores;
import io.shipgraph.checkpoint.PendingInterrupt;
import io.shipgraph.config.EngineSettings;
import io.shipgraph.config.ShipGraphConfig;
import io.shipgraph.graph.CompiledGraph;
import io.shipgraph.graph.GraphBuilder;
import io.shipgraph.graph.Task;
import io.shipgraph.model.ErrorCode;
import io.shipgraph.model.RunCancelledException;
import io.shipgraph.model.ShipGraphException;
import io.shipgraph.observability.RunJournal;
import io.shipgraph.state.StateSchema;
import io.shipgraph.state.StateUpdate;
import io.shipgraph.state.StateView;
import io.shipgraph.util.Jsons;
import io.shipgraph.util.ThreadIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run handle of a compiled graph. Drives supersteps for a thread until the frontier is
 * empty, a node interrupts, or the run fails, checkpointing after every committed superstep.
 *
 * <p>{@link #invoke} and {@link #resume} never throw for run-time problems; every call ends in
 * a {@link RunResult}. One runtime may serve many threads at once, but only one run per thread.
 */
public final class GraphRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GraphRuntime.class);

    private final CompiledGraph graph;
    private final CheckpointStore store;
    private final EngineSettings settings;
    private final RunJournal journal;
    private final ExecutorService workers;
    private final SuperstepExecutor supersteps;
    private final InterruptController interrupts = new InterruptController();
    private final Map<String, AtomicBoolean> activeRuns = new ConcurrentHashMap<>();

    public GraphRuntime(CompiledGraph graph, CheckpointStore store, EngineSettings settings, RunJournal journal) {
        this.graph = graph;
        this.store = store;
        this.settings = settings == null ? EngineSettings.defaults() : settings;
        this.journal = journal == null ? RunJournal.disabled() : journal;
        this.workers = Executors.newFixedThreadPool(this.settings.maxConcurrency(), workerThreads());
        this.supersteps = new SuperstepExecutor(graph, workers, this.settings.taskTimeoutMs());
    }

    public GraphRuntime(CompiledGraph graph, CheckpointStore store) {
        this(graph, store, EngineSettings.defaults(), RunJournal.disabled());
    }

    public static GraphRuntime open(CompiledGraph graph, ShipGraphConfig config, EngineSettings settings) {
        CheckpointStore store = CheckpointStores.open(config, settings);
        RunJournal journal = settings.journalEnabled() ? new RunJournal(config.journalFile()) : RunJournal.disabled();
        return new GraphRuntime(graph, store, settings, journal);
    }

    public CompiledGraph graph() {
        return graph;
    }

    public CheckpointStore store() {
        return store;
    }

    public EngineSettings settings() {
        return settings;
    }

    public RunResult invoke(Object input, String threadId) {
        return invoke(input, threadId, RunEventListener.NONE);
    }

    /**
     * Starts or continues a thread.
     *
     * <p>With {@code input}, a new pass starts at the start node on top of whatever state the
     * thread already has; a pending interrupt is dropped. With {@code null}, the thread continues
     * from its checkpoint: a completed thread completes again at once, an interrupted one
     * raises its interrupt again.
     */
    public RunResult invoke(Object input, String threadId, RunEventListener listener) {
        RunEventListener events = listener == null ? RunEventListener.NONE : listener;
        return guarded(threadId, events, cancelled -> {
            Optional<Checkpoint> existing = store.load(threadId);
            if (input == null) {
                Checkpoint checkpoint = existing.orElseThrow(() -> new RunRejectedException(
                        ErrorCode.INVALID_INPUT, "Thread " + threadId + " has no checkpoint to continue"));
                if (checkpoint.isComplete()) {
                    return complete(checkpoint, events);
                }
                journal.record(RunJournal.Entry.of(RunJournal.RUN_START, threadId, checkpoint.superstep(), "continue", Map.of()));
                return drive(checkpoint, interrupts.continuePlan(checkpoint), cancelled, events);
            }
            Checkpoint first = startPass(threadId, input, existing.orElse(null));
            store.save(first);
            journal.record(RunJournal.Entry.of(RunJournal.RUN_START, threadId, first.superstep(),
                    existing.isPresent() ? "new_pass" : "new_thread", Map.of("channels", List.copyOf(first.state().keySet()))));
            return drive(first, ResumePlan.NONE, cancelled, events);
        });
    }

    public RunResult resume(String threadId, Object value) {
        return resume(threadId, value, RunEventListener.NONE);
    }

    /**
     * Answers the pending interrupt of a thread with {@code value} and continues the run. The
     * interrupted node runs again from its beginning and receives {@code value} from its
     * matching {@code interrupt} call.
     */
    public RunResult resume(String threadId, Object value, RunEventListener listener) {
        RunEventListener events = listener == null ? RunEventListener.NONE : listener;
        return guarded(threadId, events, cancelled -> {
            Checkpoint checkpoint = store.load(threadId).orElseThrow(() -> new InterruptProtocolException(
                    "Thread " + threadId + " has no checkpoint to resume"));
            JsonNode answer = Jsons.tree(value);
            ResumePlan plan = interrupts.resumePlan(checkpoint, answer);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("interruptId", checkpoint.pendingInterrupt().id());
            details.put("node", checkpoint.pendingInterrupt().node());
            details.put("value", answer);
            journal.record(RunJournal.Entry.of(RunJournal.RUN_RESUME, threadId, checkpoint.superstep(), "ok", details));
            return drive(checkpoint, plan, cancelled, events);
        });
    }

    public Optional<Checkpoint> getState(String threadId) {
        if (!ThreadIds.isValid(threadId)) {
            return Optional.empty();
        }
        return store.load(threadId);
    }

    public List<Checkpoint> history(String threadId, int limit) {
        if (!ThreadIds.isValid(threadId)) {
            return List.of();
        }
        return store.history(threadId, limit);
    }

    /**
     * Signals the active run of {@code threadId} to stop. The run discards its in-flight
     * superstep and returns {@code FAILED(CANCELLED)}.
     *
     * @return {@code false} when the thread has no active run
     */
    public boolean cancel(String threadId) {
        AtomicBoolean flag = threadId == null ? null : activeRuns.get(threadId);
        if (flag == null) {
            return false;
        }
        flag.set(true);
        LOG.info("Cancellation requested for thread {}", threadId);
        return true;
    }

    public boolean isRunning(String threadId) {
        return threadId != null && activeRuns.containsKey(threadId);
    }

    @Override
    public void close() {
        activeRuns.values().forEach(flag -> flag.set(true));
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Worker pool did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        store.close();
    }

    private RunResult guarded(String threadId, RunEventListener events, RunBody body) {
        if (!ThreadIds.isValid(threadId)) {
            return failed(threadId, new RunRejectedException(ErrorCode.INVALID_INPUT, "Invalid thread id: " + threadId), events);
        }
        AtomicBoolean cancelled = new AtomicBoolean(false);
        if (activeRuns.putIfAbsent(threadId, cancelled) != null) {
            return failed(threadId, new RunRejectedException(ErrorCode.THREAD_BUSY, "Thread " + threadId + " already has an active run"), events);
        }
        try {
            return body.run(cancelled);
        } catch (ShipGraphException e) {
            return failed(threadId, e, events);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure in run of thread {}", threadId, e);
            return failed(threadId, new ShipGraphException(ErrorCode.NODE_EXECUTION, "Unexpected engine failure: " + e.getMessage(), e), events);
        } finally {
            activeRuns.remove(threadId, cancelled);
        }
    }

    private Checkpoint startPass(String threadId, Object input, Checkpoint existing) {
        JsonNode tree = Jsons.tree(input);
        if (!tree.isObject()) {
            throw new RunRejectedException(ErrorCode.INVALID_INPUT, "Run input must be a JSON object of channel values");
        }
        StateSchema schema = graph.schema();
        Map<String, JsonNode> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = tree.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!schema.has(field.getKey())) {
                throw new RunRejectedException(ErrorCode.INVALID_INPUT, "Input names undeclared channel '" + field.getKey() + "'");
            }
            values.put(field.getKey(), field.getValue());
        }
        Map<String, JsonNode> base = existing == null ? schema.initialState() : schema.align(existing.state());
        Map<String, JsonNode> state = schema.merge(base, List.of(new StateUpdate(0, GraphBuilder.START, values)));
        int superstep = existing == null ? 0 : existing.superstep() + 1;
        Task start = graph.startTask(superstep + 1);
        return new Checkpoint(threadId, superstep, state, List.of(start), List.of(), null, System.currentTimeMillis());
    }

    private RunResult drive(Checkpoint from, ResumePlan firstPlan, AtomicBoolean cancelled, RunEventListener events) {
        String threadId = from.threadId();
        Checkpoint current = from;
        ResumePlan plan = firstPlan;
        int executed = 0;
        while (!current.next().isEmpty()) {
            if (executed >= settings.maxSupersteps()) {
                throw new SuperstepLimitException(threadId, settings.maxSupersteps());
            }
            if (cancelled.get()) {
                throw new RunCancelledException(threadId);
            }
            Map<String, JsonNode> state = graph.schema().align(current.state());
            SuperstepOutcome outcome = supersteps.run(threadId, current.next(), new StateView(state), plan, cancelled, events);
            executed++;
            if (outcome.failed()) {
                throw outcome.failure();
            }
            if (outcome.interrupted()) {
                return suspend(current, outcome, events);
            }

            Map<String, JsonNode> merged = graph.schema().merge(state, outcome.updates());
            int superstep = current.superstep() + 1;
            List<Task> next = graph.nextTasks(current.next(), new StateView(merged), superstep + 1);
            if (cancelled.get()) {
                throw new RunCancelledException(threadId);
            }
            current = new Checkpoint(threadId, superstep, merged, next, List.of(), null, System.currentTimeMillis());
            store.save(current);
            journal.record(RunJournal.Entry.of(RunJournal.SUPERSTEP_COMMIT, threadId, superstep, "ok",
                    Map.of("tasks", current.next().size(), "updates", outcome.updates().size())));
            LOG.debug("Thread {} committed superstep {} with {} next task(s)", threadId, superstep, next.size());
            plan = ResumePlan.NONE;
        }
        return complete(current, events);
    }

    private RunResult suspend(Checkpoint current, SuperstepOutcome outcome, RunEventListener events) {
        Checkpoint suspended = interrupts.suspend(current, outcome, System.currentTimeMillis());
        store.save(suspended);
        PendingInterrupt pending = suspended.pendingInterrupt();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("interruptId", pending.id());
        details.put("node", pending.node());
        details.put("payload", pending.payload());
        details.put("pendingWrites", suspended.pendingWrites().size());
        journal.record(RunJournal.Entry.of(RunJournal.RUN_INTERRUPT, current.threadId(), current.superstep(), "waiting", details));
        LOG.info("Thread {} interrupted at node {} ({})", current.threadId(), pending.node(), pending.id());
        SuperstepExecutor.deliver(events, RunEvent.interrupt(current.threadId(), pending.id(), pending.node(), pending.payload()));
        return RunResult.interrupted(current.threadId(), suspended.state(), pending);
    }

    private RunResult complete(Checkpoint checkpoint, RunEventListener events) {
        journal.record(RunJournal.Entry.of(RunJournal.RUN_COMPLETE, checkpoint.threadId(), checkpoint.superstep(), "ok", Map.of()));
        SuperstepExecutor.deliver(events, RunEvent.complete(checkpoint.threadId(), checkpoint.state()));
        return RunResult.completed(checkpoint.threadId(), checkpoint.state());
    }

    private RunResult failed(String threadId, ShipGraphException error, RunEventListener events) {
        String action = error.code() == ErrorCode.CANCELLED ? RunJournal.RUN_CANCEL : RunJournal.RUN_FAIL;
        if (ThreadIds.isValid(threadId)) {
            journal.record(RunJournal.Entry.of(action, threadId, null, error.code().wireName(),
                    Map.of("message", String.valueOf(error.getMessage()))));
        }
        if (error.code() == ErrorCode.CANCELLED) {
            LOG.info("Run of thread {} cancelled", threadId);
        } else {
            LOG.warn("Run of thread {} failed [{}]: {}", threadId, error.code(), error.getMessage());
        }
        SuperstepExecutor.deliver(events, RunEvent.error(threadId, error.code(), error.getMessage()));
        return RunResult.failed(threadId, error.code(), error.getMessage());
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "shipgraph-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @FunctionalInterface
    private interface RunBody {
        RunResult run(AtomicBoolean cancelled);
    }
}
