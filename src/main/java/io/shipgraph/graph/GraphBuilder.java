package io.shipgraph.graph;

import io.shipgraph.state.StateSchema;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

public final class GraphBuilder {
    public static final String START = "__start__";
    public static final String END = "__end__";

    private static final Pattern NODE_NAME = Pattern.compile("[A-Za-z0-9_.-]{1,64}");

    private final StateSchema schema;
    private final Map<String, NodeAction> nodes = new LinkedHashMap<>();
    private final List<String[]> edges = new ArrayList<>();
    private final List<CompiledGraph.ConditionalEdge> conditionalEdges = new ArrayList<>();
    private final List<String> problems = new ArrayList<>();

    public GraphBuilder(StateSchema schema) {
        if (schema == null) {
            throw new IllegalArgumentException("schema must not be null");
        }
        this.schema = schema;
    }

    public GraphBuilder addNode(String name, NodeAction action) {
        if (name == null || START.equals(name) || END.equals(name)) {
            problems.add("Reserved or missing node name: " + name);
            return this;
        }
        if (!NODE_NAME.matcher(name).matches()) {
            problems.add("Invalid node name: " + name);
            return this;
        }
        if (action == null) {
            problems.add("Node '" + name + "' has no action");
            return this;
        }
        if (nodes.putIfAbsent(name, action) != null) {
            problems.add("Duplicate node: " + name);
        }
        return this;
    }

    public GraphBuilder addEdge(String from, String to) {
        edges.add(new String[]{from, to});
        return this;
    }

    public GraphBuilder addConditionalEdge(String from, Router router, String... destinations) {
        if (router == null) {
            problems.add("Conditional edge from '" + from + "' has no router");
            return this;
        }
        Set<String> declared = destinations == null
                ? Set.of()
                : new LinkedHashSet<>(Arrays.asList(destinations));
        conditionalEdges.add(new CompiledGraph.ConditionalEdge(from, router, declared));
        return this;
    }

    public CompiledGraph compile() {
        List<String> found = new ArrayList<>(problems);
        if (nodes.isEmpty()) {
            found.add("Graph has no nodes");
        }

        String startNode = null;
        int startEdges = 0;
        Map<String, List<String>> staticEdges = new LinkedHashMap<>();
        Set<String> seenEdges = new LinkedHashSet<>();
        for (String[] edge : edges) {
            String from = edge[0];
            String to = edge[1];
            if (END.equals(from)) {
                found.add("Edge cannot leave " + END);
                continue;
            }
            if (START.equals(to)) {
                found.add("Edge cannot enter " + START);
                continue;
            }
            if (!START.equals(from) && !nodes.containsKey(from)) {
                found.add("Edge from unknown node: " + from);
            }
            if (!END.equals(to) && !nodes.containsKey(to)) {
                found.add("Edge to unknown node: " + to);
            }
            if (!seenEdges.add(from + "->" + to)) {
                found.add("Duplicate edge: " + from + " -> " + to);
                continue;
            }
            if (START.equals(from)) {
                startEdges++;
                startNode = to;
                continue;
            }
            staticEdges.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
        }
        if (startEdges == 0) {
            found.add("Missing start edge");
        } else if (startEdges > 1) {
            found.add("More than one start edge");
        } else if (END.equals(startNode)) {
            found.add("Start edge cannot point at " + END);
        }

        Map<String, CompiledGraph.ConditionalEdge> routers = new LinkedHashMap<>();
        for (CompiledGraph.ConditionalEdge edge : conditionalEdges) {
            if (START.equals(edge.from()) || END.equals(edge.from())) {
                found.add("Conditional edge cannot leave " + edge.from());
                continue;
            }
            if (!nodes.containsKey(edge.from())) {
                found.add("Conditional edge from unknown node: " + edge.from());
                continue;
            }
            for (String destination : edge.destinations()) {
                if (!END.equals(destination) && !nodes.containsKey(destination)) {
                    found.add("Conditional edge from '" + edge.from() + "' names unknown destination: " + destination);
                }
            }
            if (routers.putIfAbsent(edge.from(), edge) != null) {
                found.add("Duplicate router on node: " + edge.from());
            }
        }

        if (found.isEmpty()) {
            Set<String> reachable = reachableFrom(startNode, staticEdges, routers);
            for (String node : nodes.keySet()) {
                if (!reachable.contains(node)) {
                    found.add("Unreachable node: " + node);
                }
            }
        }
        if (!found.isEmpty()) {
            throw new GraphCompileException(found);
        }
        return new CompiledGraph(schema, new NodeRegistry(nodes), startNode, staticEdges, routers);
    }

    private Set<String> reachableFrom(
            String startNode,
            Map<String, List<String>> staticEdges,
            Map<String, CompiledGraph.ConditionalEdge> routers
    ) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(startNode);
        while (!queue.isEmpty()) {
            String node = queue.poll();
            if (END.equals(node) || !seen.add(node)) {
                continue;
            }
            queue.addAll(staticEdges.getOrDefault(node, List.of()));
            CompiledGraph.ConditionalEdge router = routers.get(node);
            if (router != null) {
                queue.addAll(router.destinations().isEmpty() ? nodes.keySet() : router.destinations());
            }
        }
        return seen;
    }
}
