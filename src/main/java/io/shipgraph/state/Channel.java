package io.shipgraph.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.shipgraph.util.Jsons;

import java.util.function.Supplier;

public record Channel(String name, Reducer reducer, Supplier<JsonNode> defaultValue) {
    public Channel {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("channel name must not be blank");
        }
        if (reducer == null) {
            throw new IllegalArgumentException("channel reducer must not be null: " + name);
        }
        if (defaultValue == null) {
            defaultValue = NullNode::getInstance;
        }
    }

    public JsonNode initialValue() {
        JsonNode value = defaultValue.get();
        return Jsons.tree(value == null ? null : value.deepCopy());
    }
}
