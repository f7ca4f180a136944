package io.shipgraph.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shipgraph.util.Jsons;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class StateView {
    private final Map<String, JsonNode> values;

    public StateView(Map<String, JsonNode> values) {
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> copy.put(k, v == null ? NullNode.getInstance() : v.deepCopy()));
        this.values = Collections.unmodifiableMap(copy);
    }

    public Set<String> channels() {
        return values.keySet();
    }

    public JsonNode get(String channel) {
        JsonNode value = values.get(channel);
        if (value == null) {
            throw new IllegalArgumentException("Unknown channel: " + channel);
        }
        return value.deepCopy();
    }

    public String text(String channel) {
        JsonNode value = get(channel);
        return value.isNull() ? "" : value.asText("");
    }

    public boolean bool(String channel) {
        return get(channel).asBoolean(false);
    }

    public int size(String channel) {
        JsonNode value = get(channel);
        return value.isContainerNode() ? value.size() : 0;
    }

    public <T> T as(String channel, Class<T> type) {
        return Jsons.mapper().convertValue(get(channel), type);
    }

    public ObjectNode toObjectNode() {
        ObjectNode out = Jsons.mapper().createObjectNode();
        values.forEach((k, v) -> out.set(k, v.deepCopy()));
        return out;
    }
}
