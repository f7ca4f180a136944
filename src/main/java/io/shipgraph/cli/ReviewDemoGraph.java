package io.shipgraph.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shipgraph.graph.CompiledGraph;
import io.shipgraph.graph.GraphBuilder;
import io.shipgraph.graph.NodeContext;
import io.shipgraph.graph.NodeResult;
import io.shipgraph.graph.RouteDecision;
import io.shipgraph.graph.Send;
import io.shipgraph.state.StateSchema;
import io.shipgraph.state.StateView;
import io.shipgraph.util.Jsons;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Built-in production-readiness review loop used by the CLI. A planner fans out one worker per
 * review area, an aggregator drafts a report, and a reviewer asks a human to approve it or to
 * send feedback, which loops through a revision node until approved.
 *
 * <p>Everything is deterministic; no model is called.
 */
public final class ReviewDemoGraph {
    public static final String PLANNER = "planner";
    public static final String WORKER = "worker";
    public static final String AGGREGATOR = "aggregator";
    public static final String REVIEW = "review";
    public static final String REVISE = "revise";

    public static final String INTERRUPT_KIND = "approve_or_feedback";
    static final List<String> DEFAULT_AREAS = List.of("security", "testing", "observability");
    private static final Set<String> APPROVALS = Set.of("", "approve", "approved", "yes", "y", "ok", "lgtm");

    private ReviewDemoGraph() {
    }

    public static StateSchema schema() {
        return StateSchema.builder()
                .replace("topic", () -> Jsons.tree(""))
                .replace("areas", () -> Jsons.mapper().createArrayNode())
                .upsertById("findings", "id")
                .replace("draft", () -> Jsons.tree(""))
                .replace("feedback", () -> Jsons.tree(""))
                .replace("approved", () -> Jsons.tree(false))
                .counter("revisions")
                .append("log")
                .build();
    }

    public static CompiledGraph build() {
        return new GraphBuilder(schema())
                .addNode(PLANNER, ReviewDemoGraph::plan)
                .addNode(WORKER, ReviewDemoGraph::inspect)
                .addNode(AGGREGATOR, ReviewDemoGraph::aggregate)
                .addNode(REVIEW, ReviewDemoGraph::review)
                .addNode(REVISE, ReviewDemoGraph::revise)
                .addEdge(GraphBuilder.START, PLANNER)
                .addConditionalEdge(PLANNER, ReviewDemoGraph::fanOutAreas, WORKER)
                .addEdge(WORKER, AGGREGATOR)
                .addEdge(AGGREGATOR, REVIEW)
                .addConditionalEdge(REVIEW, ReviewDemoGraph::afterReview, REVISE, GraphBuilder.END)
                .addEdge(REVISE, REVIEW)
                .compile();
    }

    public static Map<String, Object> input(String topic, List<String> areas) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("topic", topic == null ? "" : topic);
        input.put("areas", areas == null || areas.isEmpty() ? DEFAULT_AREAS : areas);
        return input;
    }

    static boolean isApproval(String answer) {
        return APPROVALS.contains(answer == null ? "" : answer.trim().toLowerCase(Locale.ROOT));
    }

    private static NodeResult plan(NodeContext ctx) {
        ctx.emitProgress("planning", 10);
        return NodeResult.update("log", "planned " + ctx.state().size("areas") + " area(s)");
    }

    private static RouteDecision fanOutAreas(StateView state) {
        List<Send> sends = new ArrayList<>();
        for (JsonNode area : state.get("areas")) {
            sends.add(Send.to(WORKER, Map.of("area", area.asText())));
        }
        return RouteDecision.fanOut(sends);
    }

    private static NodeResult inspect(NodeContext ctx) {
        String area = ctx.input().path("area").asText("general");
        ctx.checkCancelled();
        ctx.emitStatus("Inspecting " + area);
        ObjectNode finding = Jsons.mapper().createObjectNode();
        finding.put("id", area);
        finding.put("area", area);
        finding.put("summary", "Review " + area + " readiness of " + ctx.state().text("topic"));
        return NodeResult.update("findings", finding);
    }

    private static NodeResult aggregate(NodeContext ctx) {
        StringBuilder draft = new StringBuilder("Production readiness: ").append(ctx.state().text("topic"));
        for (JsonNode finding : ctx.state().get("findings")) {
            draft.append("\n- ").append(finding.path("area").asText()).append(": ").append(finding.path("summary").asText());
        }
        ctx.emitProgress("aggregating", 80);
        Map<String, Object> update = new LinkedHashMap<>();
        update.put("draft", draft.toString());
        update.put("log", "drafted report");
        return NodeResult.update(update);
    }

    private static NodeResult review(NodeContext ctx) {
        if (ctx.state().bool("approved")) {
            return NodeResult.empty();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("kind", INTERRUPT_KIND);
        payload.put("content", ctx.state().text("draft"));
        JsonNode answer = ctx.interrupt(payload);
        if (!answer.isTextual() && !answer.isNull()) {
            return NodeResult.fail("Review answer must be text, got " + answer.getNodeType());
        }
        String text = answer.isNull() ? "" : answer.asText();
        Map<String, Object> update = new LinkedHashMap<>();
        if (isApproval(text)) {
            update.put("approved", true);
            update.put("feedback", "");
            update.put("log", "report approved");
        } else {
            update.put("approved", false);
            update.put("feedback", text.trim());
            update.put("log", "feedback received");
        }
        return NodeResult.update(update);
    }

    private static RouteDecision afterReview(StateView state) {
        return state.bool("approved") ? RouteDecision.halt() : RouteDecision.next(REVISE);
    }

    private static NodeResult revise(NodeContext ctx) {
        String feedback = ctx.state().text("feedback");
        Map<String, Object> update = new LinkedHashMap<>();
        update.put("draft", ctx.state().text("draft") + "\n[revised: " + feedback + "]");
        update.put("revisions", 1);
        update.put("log", "revised report");
        return NodeResult.update(update);
    }
}
