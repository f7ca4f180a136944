package io.shipgraph.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.shipgraph.util.Jsons;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Ordered channel declarations of a graph. Immutable once built.
 *
 * <p>Merging folds updates in ascending task index, channel by channel in declaration order,
 * so the merged state never depends on the order in which tasks finished.
 */
public final class StateSchema {
    private final Map<String, Channel> channels;

    private StateSchema(Map<String, Channel> channels) {
        this.channels = Collections.unmodifiableMap(new LinkedHashMap<>(channels));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Channel> channels() {
        return List.copyOf(channels.values());
    }

    public boolean has(String name) {
        return channels.containsKey(name);
    }

    public Channel channel(String name) {
        Channel channel = channels.get(name);
        if (channel == null) {
            throw new IllegalArgumentException("Unknown channel: " + name);
        }
        return channel;
    }

    public Map<String, JsonNode> initialState() {
        Map<String, JsonNode> state = new LinkedHashMap<>();
        for (Channel channel : channels.values()) {
            state.put(channel.name(), channel.initialValue());
        }
        return state;
    }

    public Map<String, JsonNode> align(Map<String, JsonNode> stored) {
        Map<String, JsonNode> state = new LinkedHashMap<>();
        for (Channel channel : channels.values()) {
            JsonNode value = stored == null ? null : stored.get(channel.name());
            state.put(channel.name(), value == null ? channel.initialValue() : value.deepCopy());
        }
        return state;
    }

    public Map<String, JsonNode> merge(Map<String, JsonNode> current, Collection<StateUpdate> updates) {
        List<StateUpdate> ordered = new ArrayList<>(updates == null ? List.of() : updates);
        ordered.sort(Comparator.comparingInt(StateUpdate::taskIndex));
        for (StateUpdate update : ordered) {
            for (String key : update.values().keySet()) {
                if (!channels.containsKey(key)) {
                    throw new InvalidUpdateException(
                            "Node '" + update.node() + "' wrote undeclared channel '" + key + "'");
                }
            }
        }

        Map<String, JsonNode> merged = align(current);
        for (Channel channel : channels.values()) {
            JsonNode value = merged.get(channel.name());
            for (StateUpdate update : ordered) {
                if (!update.values().containsKey(channel.name())) {
                    continue;
                }
                JsonNode incoming = update.values().get(channel.name());
                try {
                    value = channel.reducer().reduce(value, incoming == null ? NullNode.getInstance() : incoming);
                } catch (RuntimeException e) {
                    throw new ReducerConflictException(channel.name(), update.node(), e);
                }
                value = Jsons.tree(value);
            }
            merged.put(channel.name(), value);
        }
        return merged;
    }

    public static final class Builder {
        private final Map<String, Channel> channels = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder channel(String name, Reducer reducer, Supplier<JsonNode> defaultValue) {
            Channel channel = new Channel(name, reducer, defaultValue);
            if (channels.putIfAbsent(name, channel) != null) {
                throw new IllegalArgumentException("Duplicate channel: " + name);
            }
            return this;
        }

        public Builder replace(String name) {
            return channel(name, Reducers.replace(), null);
        }

        public Builder replace(String name, Supplier<JsonNode> defaultValue) {
            return channel(name, Reducers.replace(), defaultValue);
        }

        public Builder append(String name) {
            return channel(name, Reducers.append(), () -> Jsons.mapper().createArrayNode());
        }

        public Builder upsertById(String name, String idField) {
            return channel(name, Reducers.upsertById(idField), () -> Jsons.mapper().createArrayNode());
        }

        public Builder counter(String name) {
            return channel(name, Reducers.sum(), () -> IntNode.valueOf(0));
        }

        public StateSchema build() {
            if (channels.isEmpty()) {
                throw new IllegalStateException("State schema declares no channels");
            }
            return new StateSchema(channels);
        }
    }
}
