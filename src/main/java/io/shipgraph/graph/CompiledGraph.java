package io.shipgraph.graph;

import io.shipgraph.state.StateSchema;
import io.shipgraph.state.StateView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class CompiledGraph {
    private final StateSchema schema;
    private final NodeRegistry registry;
    private final String startNode;
    private final Map<String, List<String>> edges;
    private final Map<String, ConditionalEdge> routers;

    CompiledGraph(
            StateSchema schema,
            NodeRegistry registry,
            String startNode,
            Map<String, List<String>> edges,
            Map<String, ConditionalEdge> routers
    ) {
        this.schema = schema;
        this.registry = registry;
        this.startNode = startNode;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        edges.forEach((from, targets) -> copy.put(from, List.copyOf(targets)));
        this.edges = Collections.unmodifiableMap(copy);
        this.routers = Collections.unmodifiableMap(new LinkedHashMap<>(routers));
    }

    public StateSchema schema() {
        return schema;
    }

    public NodeRegistry registry() {
        return registry;
    }

    public String startNode() {
        return startNode;
    }

    public List<String> edgesFrom(String node) {
        return edges.getOrDefault(node, List.of());
    }

    public Optional<ConditionalEdge> routerFor(String node) {
        return Optional.ofNullable(routers.get(node));
    }

    public Task startTask(int superstep) {
        return new Task(startNode, null, superstep, 0);
    }

    /**
     * Frontier of the superstep after {@code executed}. Source nodes are visited in ascending
     * task index, each once; static targets come first in declaration order, then the router.
     * Static targets and {@code next} decisions are de-duplicated, fan-out sends are not.
     *
     * @throws NodeExecutionException when a router fails or picks a destination it may not
     */
    public List<Task> nextTasks(List<Task> executed, StateView merged, int superstep) {
        List<Task> ordered = new ArrayList<>(executed);
        ordered.sort((a, b) -> Integer.compare(a.index(), b.index()));
        Set<String> sources = new LinkedHashSet<>();
        for (Task task : ordered) {
            sources.add(task.node());
        }

        List<Task> next = new ArrayList<>();
        Set<String> scheduled = new LinkedHashSet<>();
        for (String source : sources) {
            for (String target : edgesFrom(source)) {
                if (!GraphBuilder.END.equals(target) && scheduled.add(target)) {
                    next.add(new Task(target, null, superstep, next.size()));
                }
            }
            ConditionalEdge router = routers.get(source);
            if (router == null) {
                continue;
            }
            RouteDecision decision = route(router, merged);
            switch (decision.kind()) {
                case NEXT -> {
                    router.check(decision.node(), this);
                    if (scheduled.add(decision.node())) {
                        next.add(new Task(decision.node(), null, superstep, next.size()));
                    }
                }
                case FAN_OUT -> {
                    for (Send send : decision.sends()) {
                        router.check(send.node(), this);
                        next.add(new Task(send.node(), send.input(), superstep, next.size()));
                    }
                }
                case HALT -> {
                }
            }
        }
        return next;
    }

    private static RouteDecision route(ConditionalEdge edge, StateView state) {
        RouteDecision decision;
        try {
            decision = edge.router().route(state);
        } catch (Exception e) {
            throw new NodeExecutionException(edge.from(), "Router of node '" + edge.from() + "' failed: " + e.getMessage(), e);
        }
        return decision == null ? RouteDecision.halt() : decision;
    }

    public record ConditionalEdge(String from, Router router, Set<String> destinations) {
        public ConditionalEdge {
            destinations = destinations == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(destinations));
        }

        void check(String target, CompiledGraph graph) {
            if (!graph.registry.contains(target)) {
                throw new NodeExecutionException(from, "Router of node '" + from + "' picked unknown node: " + target);
            }
            if (!destinations.isEmpty() && !destinations.contains(target)) {
                throw new NodeExecutionException(from, "Router of node '" + from + "' picked undeclared destination: " + target);
            }
        }
    }
}
