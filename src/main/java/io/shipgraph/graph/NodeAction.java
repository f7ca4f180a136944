package io.shipgraph.graph;

/**
 * Business logic of a node. A resumed node restarts from its beginning, so side effects
 * must be idempotent or happen after the node's last {@link NodeContext#interrupt} call.
 */
@FunctionalInterface
public interface NodeAction {
    NodeResult apply(NodeContext ctx) throws Exception;
}
