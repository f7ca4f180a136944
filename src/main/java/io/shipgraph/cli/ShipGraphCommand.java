package io.shipgraph.cli;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shipgraph.checkpoint.Checkpoint;
import io.shipgraph.checkpoint.CheckpointStore;
import io.shipgraph.checkpoint.CheckpointStores;
import io.shipgraph.config.EngineSettings;
import io.shipgraph.config.ShipGraphConfig;
import io.shipgraph.model.RunStatus;
import io.shipgraph.runtime.GraphRuntime;
import io.shipgraph.runtime.RunEvent;
import io.shipgraph.runtime.RunResult;
import io.shipgraph.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "shipgraph",
        mixinStandardHelpOptions = true,
        description = "ShipGraph checkpoint and review-loop CLI",
        subcommands = {
                ShipGraphCommand.ThreadsCommand.class,
                ShipGraphCommand.StateCommand.class,
                ShipGraphCommand.HistoryCommand.class,
                ShipGraphCommand.DeleteCommand.class,
                ShipGraphCommand.SettingsCommand.class,
                ShipGraphCommand.ReviewStartCommand.class,
                ShipGraphCommand.ReviewResumeCommand.class
        }
)
public final class ShipGraphCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = ShipGraphConfig.DEFAULT_ROOT)
    String root;

    @Option(names = {"--checkpointer"}, description = "Override the checkpointer: memory|sqlite|file")
    String checkpointer;

    @Override
    public void run() {
        System.out.println("Use subcommands: threads | state | history | delete | settings | review-start | review-resume");
    }

    ShipGraphConfig config() {
        return ShipGraphConfig.fromRoot(root);
    }

    EngineSettings settings() {
        EngineSettings settings = EngineSettings.load(config());
        return checkpointer == null || checkpointer.isBlank() ? settings : settings.withCheckpointer(checkpointer);
    }

    CheckpointStore store() {
        return CheckpointStores.open(config(), settings());
    }

    GraphRuntime reviewRuntime() {
        return GraphRuntime.open(ReviewDemoGraph.build(), config(), settings());
    }

    static String statusOf(Checkpoint checkpoint) {
        if (checkpoint.isInterrupted()) {
            return RunStatus.INTERRUPTED.name();
        }
        return checkpoint.isComplete() ? RunStatus.COMPLETED.name() : "PENDING";
    }

    static int exitCode(RunResult result) {
        return result.status() == RunStatus.FAILED ? 1 : 0;
    }

    @Command(name = "threads", description = "List threads that have a checkpoint")
    static final class ThreadsCommand implements Callable<Integer> {
        @ParentCommand
        ShipGraphCommand parent;

        @Override
        public Integer call() {
            try (CheckpointStore store = parent.store()) {
                ArrayNode out = Jsons.mapper().createArrayNode();
                for (String threadId : store.listThreads()) {
                    Optional<Checkpoint> checkpoint = store.load(threadId);
                    if (checkpoint.isEmpty()) {
                        continue;
                    }
                    ObjectNode row = out.addObject();
                    row.put("threadId", threadId);
                    row.put("superstep", checkpoint.get().superstep());
                    row.put("status", statusOf(checkpoint.get()));
                    row.put("createdAtMs", checkpoint.get().createdAtMs());
                }
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "state", description = "Print the latest checkpoint of a thread")
    static final class StateCommand implements Callable<Integer> {
        @ParentCommand
        ShipGraphCommand parent;

        @Parameters(index = "0", description = "Thread id")
        String threadId;

        @Override
        public Integer call() {
            try (CheckpointStore store = parent.store()) {
                Optional<Checkpoint> checkpoint = store.load(threadId);
                if (checkpoint.isEmpty()) {
                    System.out.println("{\"error\":\"thread not found\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(checkpoint.get()));
                return 0;
            }
        }
    }

    @Command(name = "history", description = "Print checkpoints of a thread, newest first")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        ShipGraphCommand parent;

        @Parameters(index = "0", description = "Thread id")
        String threadId;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Maximum checkpoints to print, 0 for all")
        int limit;

        @Override
        public Integer call() {
            try (CheckpointStore store = parent.store()) {
                List<Checkpoint> history = store.history(threadId, limit);
                ArrayNode out = Jsons.mapper().createArrayNode();
                for (Checkpoint checkpoint : history) {
                    ObjectNode row = out.addObject();
                    row.put("superstep", checkpoint.superstep());
                    row.put("status", statusOf(checkpoint));
                    row.put("next", checkpoint.next().size());
                    row.put("pendingWrites", checkpoint.pendingWrites().size());
                    row.put("createdAtMs", checkpoint.createdAtMs());
                }
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "delete", description = "Delete every checkpoint of a thread")
    static final class DeleteCommand implements Callable<Integer> {
        @ParentCommand
        ShipGraphCommand parent;

        @Parameters(index = "0", description = "Thread id")
        String threadId;

        @Override
        public Integer call() {
            try (CheckpointStore store = parent.store()) {
                boolean deleted = store.delete(threadId);
                ObjectNode out = Jsons.mapper().createObjectNode();
                out.put("threadId", threadId);
                out.put("deleted", deleted);
                System.out.println(Jsons.toJson(out));
                return deleted ? 0 : 1;
            }
        }
    }

    @Command(name = "settings", description = "Print the effective engine settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        ShipGraphCommand parent;

        @Override
        public Integer call() {
            ObjectNode out = Jsons.mapper().createObjectNode();
            out.put("settingsFile", parent.config().settingsFile().toString());
            out.set("settings", Jsons.tree(parent.settings()));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "review-start", description = "Start the review-loop demo on a thread")
    static final class ReviewStartCommand implements Callable<Integer> {
        @ParentCommand
        ShipGraphCommand parent;

        @Option(names = {"--thread"}, required = true, description = "Thread id")
        String threadId;

        @Option(names = {"--topic"}, required = true, description = "What is being reviewed")
        String topic;

        @Option(names = {"--area"}, description = "Review area, repeatable; defaults to security, testing, observability")
        List<String> areas;

        @Option(names = {"--events"}, description = "Print run events to stderr as JSON lines")
        boolean events;

        @Override
        public Integer call() {
            try (GraphRuntime runtime = parent.reviewRuntime()) {
                RunResult result = runtime.invoke(ReviewDemoGraph.input(topic, areas), threadId, this::printEvent);
                System.out.println(Jsons.toJson(result));
                return exitCode(result);
            }
        }

        private void printEvent(RunEvent event) {
            if (events) {
                System.err.println(Jsons.toCompactJson(event.toJson()));
            }
        }
    }

    @Command(name = "review-resume", description = "Answer the pending review of a thread")
    static final class ReviewResumeCommand implements Callable<Integer> {
        @ParentCommand
        ShipGraphCommand parent;

        @Option(names = {"--thread"}, required = true, description = "Thread id")
        String threadId;

        @Option(names = {"--value"}, defaultValue = "", description = "approve, or feedback text")
        String value;

        @Override
        public Integer call() {
            try (GraphRuntime runtime = parent.reviewRuntime()) {
                RunResult result = runtime.resume(threadId, value);
                System.out.println(Jsons.toJson(result));
                return exitCode(result);
            }
        }
    }
}
