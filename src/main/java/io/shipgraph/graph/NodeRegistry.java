package io.shipgraph.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class NodeRegistry {
    private final Map<String, NodeAction> actions;

    NodeRegistry(Map<String, NodeAction> actions) {
        this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    }

    public Optional<NodeAction> findByName(String node) {
        return Optional.ofNullable(actions.get(node));
    }

    public NodeAction require(String node) {
        NodeAction action = actions.get(node);
        if (action == null) {
            throw new NodeExecutionException(node, "No node registered as '" + node + "'");
        }
        return action;
    }

    public boolean contains(String node) {
        return actions.containsKey(node);
    }

    public Collection<String> listNodeNames() {
        return actions.keySet();
    }
}
