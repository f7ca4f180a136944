package io.shipgraph.graph;

import io.shipgraph.model.ErrorCode;
import io.shipgraph.state.StateSchema;
import io.shipgraph.state.StateView;
import io.shipgraph.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class GraphBuilderTest {
    private static final NodeAction NOOP = ctx -> NodeResult.empty();

    private static StateSchema schema() {
        return StateSchema.builder().replace("value").append("log").build();
    }

    @Test
    void compileReportsEveryProblemTogether() {
        GraphBuilder builder = new GraphBuilder(schema())
                .addNode("a", NOOP)
                .addNode("a", NOOP)
                .addNode(GraphBuilder.END, NOOP)
                .addNode("bad name!", NOOP)
                .addNode("island", NOOP)
                .addEdge("a", "ghost");
        GraphCompileException error = Assertions.assertThrows(GraphCompileException.class, builder::compile);
        Assertions.assertEquals(ErrorCode.COMPILE, error.code());
        List<String> problems = error.problems();
        Assertions.assertTrue(problems.contains("Duplicate node: a"), problems.toString());
        Assertions.assertTrue(problems.contains("Reserved or missing node name: " + GraphBuilder.END), problems.toString());
        Assertions.assertTrue(problems.contains("Invalid node name: bad name!"), problems.toString());
        Assertions.assertTrue(problems.contains("Edge to unknown node: ghost"), problems.toString());
        Assertions.assertTrue(problems.contains("Missing start edge"), problems.toString());
    }

    @Test
    void duplicateStartEdgeAndDuplicateRouterAreRejected() {
        GraphBuilder builder = new GraphBuilder(schema())
                .addNode("a", NOOP)
                .addNode("b", NOOP)
                .addEdge(GraphBuilder.START, "a")
                .addEdge(GraphBuilder.START, "b")
                .addConditionalEdge("a", state -> RouteDecision.halt())
                .addConditionalEdge("a", state -> RouteDecision.halt());
        GraphCompileException error = Assertions.assertThrows(GraphCompileException.class, builder::compile);
        Assertions.assertTrue(error.problems().contains("More than one start edge"));
        Assertions.assertTrue(error.problems().contains("Duplicate router on node: a"));
    }

    @Test
    void unreachableNodeIsACompileError() {
        GraphBuilder builder = new GraphBuilder(schema())
                .addNode("a", NOOP)
                .addNode("b", NOOP)
                .addNode("orphan", NOOP)
                .addEdge(GraphBuilder.START, "a")
                .addConditionalEdge("a", state -> RouteDecision.next("b"), "b", GraphBuilder.END);
        GraphCompileException error = Assertions.assertThrows(GraphCompileException.class, builder::compile);
        Assertions.assertEquals(List.of("Unreachable node: orphan"), error.problems());
    }

    @Test
    void routerWithoutDeclaredDestinationsReachesEveryNode() {
        CompiledGraph graph = new GraphBuilder(schema())
                .addNode("a", NOOP)
                .addNode("b", NOOP)
                .addNode("c", NOOP)
                .addEdge(GraphBuilder.START, "a")
                .addConditionalEdge("a", state -> RouteDecision.next("c"))
                .compile();
        Assertions.assertEquals("a", graph.startNode());
        Assertions.assertEquals(List.of("a", "b", "c"), List.copyOf(graph.registry().listNodeNames()));
    }

    @Test
    void frontierDeduplicatesStaticTargetsButNotFanOutSends() {
        CompiledGraph graph = new GraphBuilder(schema())
                .addNode("left", NOOP)
                .addNode("right", NOOP)
                .addNode("split", NOOP)
                .addNode("join", NOOP)
                .addNode("worker", NOOP)
                .addEdge(GraphBuilder.START, "split")
                .addEdge("split", "left")
                .addEdge("split", "right")
                .addEdge("left", "join")
                .addEdge("right", "join")
                .addConditionalEdge("right", state -> RouteDecision.fanOut(List.of(
                        Send.to("worker", Map.of("n", 1)),
                        Send.to("worker", Map.of("n", 1)))), "worker")
                .compile();
        StateView state = new StateView(schema().initialState());

        List<Task> afterSplit = graph.nextTasks(List.of(new Task("split", null, 1, 0)), state, 2);
        Assertions.assertEquals(List.of("left", "right"), afterSplit.stream().map(Task::node).toList());

        List<Task> afterBranches = graph.nextTasks(afterSplit, state, 3);
        Assertions.assertEquals(List.of("join", "worker", "worker"), afterBranches.stream().map(Task::node).toList());
        Assertions.assertEquals(List.of(0, 1, 2), afterBranches.stream().map(Task::index).toList());
        Assertions.assertEquals(1, afterBranches.get(1).input().get("n").asInt());
        Assertions.assertEquals(3, afterBranches.get(0).superstep());
    }

    @Test
    void nextToEndAndEmptyFanOutHalt() {
        Assertions.assertTrue(RouteDecision.next(GraphBuilder.END).isHalt());
        Assertions.assertTrue(RouteDecision.fanOut(List.of()).isHalt());
        Assertions.assertEquals(RouteDecision.Kind.NEXT, RouteDecision.next("a").kind());
    }

    @Test
    void routerPickingUndeclaredDestinationFailsAtRunTime() {
        CompiledGraph graph = new GraphBuilder(schema())
                .addNode("a", NOOP)
                .addNode("b", NOOP)
                .addNode("c", NOOP)
                .addEdge(GraphBuilder.START, "a")
                .addEdge("a", "c")
                .addConditionalEdge("a", state -> RouteDecision.next("c"), "b")
                .compile();
        StateView state = new StateView(Map.of("value", Jsons.tree(1), "log", Jsons.mapper().createArrayNode()));
        NodeExecutionException error = Assertions.assertThrows(NodeExecutionException.class,
                () -> graph.nextTasks(List.of(new Task("a", null, 1, 0)), state, 2));
        Assertions.assertEquals("a", error.node());
        Assertions.assertTrue(error.getMessage().contains("undeclared destination"));
    }

    @Test
    void throwingRouterIsANodeExecutionError() {
        CompiledGraph graph = new GraphBuilder(schema())
                .addNode("a", NOOP)
                .addEdge(GraphBuilder.START, "a")
                .addConditionalEdge("a", state -> {
                    throw new IllegalStateException("boom");
                }, GraphBuilder.END)
                .compile();
        StateView state = new StateView(schema().initialState());
        NodeExecutionException error = Assertions.assertThrows(NodeExecutionException.class,
                () -> graph.nextTasks(List.of(new Task("a", null, 1, 0)), state, 2));
        Assertions.assertEquals(ErrorCode.NODE_EXECUTION, error.code());
    }
}
