package io.shipgraph.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shipgraph.model.ErrorCode;
import io.shipgraph.util.Jsons;

import java.util.Locale;
import java.util.Map;

public record RunEvent(Type type, String threadId, JsonNode data) {
    public enum Type {
        STATUS,
        PROGRESS,
        TOKEN,
        INTERRUPT,
        COMPLETE,
        ERROR;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public RunEvent {
        data = data == null ? Jsons.mapper().createObjectNode() : data;
    }

    public static RunEvent status(String threadId, String message) {
        ObjectNode data = Jsons.mapper().createObjectNode();
        data.put("message", message);
        return new RunEvent(Type.STATUS, threadId, data);
    }

    public static RunEvent progress(String threadId, String stage, Integer percent) {
        ObjectNode data = Jsons.mapper().createObjectNode();
        data.put("stage", stage);
        if (percent != null) {
            data.put("percent", percent);
        }
        return new RunEvent(Type.PROGRESS, threadId, data);
    }

    public static RunEvent token(String threadId, String content) {
        ObjectNode data = Jsons.mapper().createObjectNode();
        data.put("content", content);
        return new RunEvent(Type.TOKEN, threadId, data);
    }

    public static RunEvent interrupt(String threadId, String interruptId, String node, JsonNode payload) {
        ObjectNode data = Jsons.mapper().createObjectNode();
        data.put("interruptId", interruptId);
        data.put("node", node);
        data.set("payload", Jsons.orNull(payload));
        return new RunEvent(Type.INTERRUPT, threadId, data);
    }

    public static RunEvent complete(String threadId, Map<String, JsonNode> state) {
        ObjectNode data = Jsons.mapper().createObjectNode();
        ObjectNode result = data.putObject("result");
        state.forEach(result::set);
        return new RunEvent(Type.COMPLETE, threadId, data);
    }

    public static RunEvent error(String threadId, ErrorCode code, String message) {
        ObjectNode data = Jsons.mapper().createObjectNode();
        data.put("code", code.wireName());
        data.put("message", message);
        return new RunEvent(Type.ERROR, threadId, data);
    }

    public ObjectNode toJson() {
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("type", type.wireName());
        out.put("threadId", threadId);
        out.setAll((ObjectNode) data);
        return out;
    }
}
