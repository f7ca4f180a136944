package io.shipgraph.runtime;

import io.shipgraph.checkpoint.Checkpoint;
import io.shipgraph.checkpoint.CheckpointStores;
import io.shipgraph.config.EngineSettings;
import io.shipgraph.config.ShipGraphConfig;
import io.shipgraph.graph.CompiledGraph;
import io.shipgraph.graph.GraphBuilder;
import io.shipgraph.graph.NodeResult;
import io.shipgraph.model.ErrorCode;
import io.shipgraph.model.RunStatus;
import io.shipgraph.observability.RunJournal;
import io.shipgraph.state.StateSchema;
import io.shipgraph.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

final class CheckpointDurabilityTest {
    private static final List<String> DURABLE_BACKENDS = List.of("sqlite", "file");

    @Test
    void exactDecimalsSurviveReopenedStore() throws Exception {
        BigDecimal amount = new BigDecimal("3.14159265358979323846264338327950288");
        StateSchema schema = StateSchema.builder().replace("price").replace("ratio").replace("answer").build();
        Map<String, Object> priced = new LinkedHashMap<>();
        priced.put("price", new BigDecimal("2.50"));
        priced.put("ratio", 0.1d);
        CompiledGraph graph = new GraphBuilder(schema)
                .addNode("price", ctx -> NodeResult.update(priced))
                .addNode("confirm", ctx -> NodeResult.update("answer", ctx.interrupt(Map.of("amount", amount))))
                .addEdge(GraphBuilder.START, "price")
                .addEdge("price", "confirm")
                .compile();

        for (String backend : DURABLE_BACKENDS) {
            Path root = Files.createTempDirectory("shipgraph-test-decimals-" + backend + "-");
            try {
                RunResult first;
                try (GraphRuntime runtime = open(graph, root, backend)) {
                    first = runtime.invoke(Map.of(), "exact");
                }
                Assertions.assertEquals(RunStatus.INTERRUPTED, first.status(), backend);
                Assertions.assertEquals(amount, first.interrupt().payload().get("amount").decimalValue(), backend);

                try (GraphRuntime runtime = open(graph, root, backend)) {
                    Checkpoint stored = runtime.getState("exact").orElseThrow();
                    Assertions.assertEquals(first.interrupt().payload(), stored.pendingInterrupt().payload(), backend);
                    Assertions.assertEquals(first.state(), stored.state(), backend);
                    Assertions.assertEquals("2.50", stored.state().get("price").decimalValue().toPlainString(), backend);

                    RunResult done = runtime.resume("exact", new BigDecimal("1.000"));
                    Assertions.assertEquals(RunStatus.COMPLETED, done.status(), backend);
                    Assertions.assertEquals(new BigDecimal("1.000"), done.state().get("answer").decimalValue(), backend);
                    Assertions.assertEquals(done.state(), runtime.getState("exact").orElseThrow().state(), backend);
                }
            } finally {
                deleteRecursively(root);
            }
        }
    }

    @Test
    void failedSuperstepContinuesInFreshRuntimeWithoutRerunningCommittedNodes() throws Exception {
        for (String backend : DURABLE_BACKENDS) {
            AtomicInteger planRuns = new AtomicInteger();
            AtomicInteger buildRuns = new AtomicInteger();
            CompiledGraph graph = twoStepGraph(planRuns, buildRuns, true);
            Path root = Files.createTempDirectory("shipgraph-test-continue-" + backend + "-");
            try {
                try (GraphRuntime runtime = open(graph, root, backend)) {
                    RunResult failed = runtime.invoke(Map.of(), "crashed");
                    Assertions.assertEquals(RunStatus.FAILED, failed.status(), backend);
                    Assertions.assertEquals(ErrorCode.NODE_EXECUTION, failed.error().code(), backend);
                }

                try (GraphRuntime runtime = open(graph, root, backend)) {
                    Checkpoint atFailure = runtime.getState("crashed").orElseThrow();
                    Assertions.assertEquals(1, atFailure.superstep(), backend);
                    Assertions.assertEquals(List.of("build"), atFailure.next().stream().map(t -> t.node()).toList(), backend);

                    RunResult done = runtime.invoke(null, "crashed");
                    Assertions.assertEquals(RunStatus.COMPLETED, done.status(), backend);
                    Assertions.assertEquals(Jsons.tree(List.of("plan", "build")), done.state().get("log"), backend);
                    Assertions.assertEquals(2, runtime.getState("crashed").orElseThrow().superstep(), backend);
                }
                Assertions.assertEquals(1, planRuns.get(), backend);
                Assertions.assertEquals(2, buildRuns.get(), backend);
            } finally {
                deleteRecursively(root);
            }
        }
    }

    @Test
    void runStoppedAtSuperstepLimitContinuesInFreshRuntime() throws Exception {
        for (String backend : DURABLE_BACKENDS) {
            AtomicInteger planRuns = new AtomicInteger();
            AtomicInteger buildRuns = new AtomicInteger();
            CompiledGraph graph = twoStepGraph(planRuns, buildRuns, false);
            Path root = Files.createTempDirectory("shipgraph-test-limit-" + backend + "-");
            try {
                EngineSettings oneStep = EngineSettings.defaults().withCheckpointer(backend).withMaxSupersteps(1);
                try (GraphRuntime runtime = GraphRuntime.open(graph, ShipGraphConfig.fromRoot(root.toString()), oneStep)) {
                    RunResult stopped = runtime.invoke(Map.of(), "stopped");
                    Assertions.assertEquals(ErrorCode.SUPERSTEP_LIMIT, stopped.error().code(), backend);
                }

                try (GraphRuntime runtime = open(graph, root, backend)) {
                    RunResult done = runtime.invoke(null, "stopped");
                    Assertions.assertEquals(RunStatus.COMPLETED, done.status(), backend);
                    Assertions.assertEquals(Jsons.tree(List.of("plan", "build")), done.state().get("log"), backend);
                }
                Assertions.assertEquals(1, planRuns.get(), backend);
                Assertions.assertEquals(1, buildRuns.get(), backend);
            } finally {
                deleteRecursively(root);
            }
        }
    }

    private static CompiledGraph twoStepGraph(AtomicInteger planRuns, AtomicInteger buildRuns, boolean failFirstBuild) {
        StateSchema schema = StateSchema.builder().append("log").build();
        return new GraphBuilder(schema)
                .addNode("plan", ctx -> {
                    planRuns.incrementAndGet();
                    return NodeResult.update("log", "plan");
                })
                .addNode("build", ctx -> {
                    if (buildRuns.incrementAndGet() == 1 && failFirstBuild) {
                        throw new IllegalStateException("build machine went away");
                    }
                    return NodeResult.update("log", "build");
                })
                .addEdge(GraphBuilder.START, "plan")
                .addEdge("plan", "build")
                .compile();
    }

    private static GraphRuntime open(CompiledGraph graph, Path root, String backend) {
        ShipGraphConfig config = ShipGraphConfig.fromRoot(root.toString());
        EngineSettings settings = EngineSettings.defaults().withCheckpointer(backend);
        return new GraphRuntime(graph, CheckpointStores.open(config, settings), settings, RunJournal.disabled());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
