package io.shipgraph.graph;

import io.shipgraph.model.ErrorCode;
import io.shipgraph.model.ShipGraphException;

import java.util.List;

public final class GraphCompileException extends ShipGraphException {
    private final List<String> problems;

    public GraphCompileException(List<String> problems) {
        super(ErrorCode.COMPILE, "Invalid graph: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
