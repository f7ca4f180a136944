package io.shipgraph.graph;

import java.util.List;

public record RouteDecision(Kind kind, String node, List<Send> sends) {
    public enum Kind {
        NEXT,
        FAN_OUT,
        HALT
    }

    public RouteDecision {
        sends = sends == null ? List.of() : List.copyOf(sends);
    }

    public static RouteDecision next(String node) {
        if (node == null || GraphBuilder.END.equals(node)) {
            return halt();
        }
        return new RouteDecision(Kind.NEXT, node, List.of());
    }

    public static RouteDecision fanOut(List<Send> sends) {
        if (sends == null || sends.isEmpty()) {
            return halt();
        }
        return new RouteDecision(Kind.FAN_OUT, null, sends);
    }

    public static RouteDecision halt() {
        return new RouteDecision(Kind.HALT, null, List.of());
    }

    public boolean isHalt() {
        return kind == Kind.HALT;
    }
}
