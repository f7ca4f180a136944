package io.shipgraph.graph;

import io.shipgraph.state.StateView;

@FunctionalInterface
public interface Router {
    RouteDecision route(StateView state) throws Exception;
}
