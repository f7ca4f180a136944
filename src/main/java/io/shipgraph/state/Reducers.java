package io.shipgraph.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shipgraph.util.Jsons;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Reducers {
    public static final String DEFAULT_ID_FIELD = "id";

    private Reducers() {
    }

    public static Reducer replace() {
        return (current, update) -> update == null ? null : update.deepCopy();
    }

    public static Reducer append() {
        return (current, update) -> {
            ArrayNode out = copyArray(current);
            if (update == null || update.isNull()) {
                return out;
            }
            if (update.isArray()) {
                for (JsonNode element : update) {
                    out.add(element.deepCopy());
                }
            } else {
                out.add(update.deepCopy());
            }
            return out;
        };
    }

    public static Reducer upsertById() {
        return upsertById(DEFAULT_ID_FIELD);
    }

    /**
     * Id-keyed upsert: elements of {@code update} replace elements of {@code current} with the
     * same id, unseen ids are appended. Last write per id wins with no field-level merge.
     */
    public static Reducer upsertById(String idField) {
        if (idField == null || idField.isBlank()) {
            throw new IllegalArgumentException("idField must not be blank");
        }
        return (current, update) -> {
            Map<String, JsonNode> byId = new LinkedHashMap<>();
            for (JsonNode element : copyArray(current)) {
                byId.put(idOf(element, idField), element);
            }
            if (update != null && !update.isNull()) {
                Iterable<JsonNode> incoming = update.isArray() ? update : List.of(update);
                for (JsonNode element : incoming) {
                    byId.put(idOf(element, idField), element.deepCopy());
                }
            }
            ArrayNode out = Jsons.mapper().createArrayNode();
            byId.values().forEach(out::add);
            return out;
        };
    }

    public static Reducer mergeObject() {
        return (current, update) -> {
            ObjectNode out = current != null && current.isObject()
                    ? ((ObjectNode) current).deepCopy()
                    : Jsons.mapper().createObjectNode();
            if (update == null || update.isNull()) {
                return out;
            }
            if (!update.isObject()) {
                throw new IllegalArgumentException("mergeObject expects an object update, got " + update.getNodeType());
            }
            out.setAll(((ObjectNode) update).deepCopy());
            return out;
        };
    }

    public static Reducer sum() {
        return (current, update) -> {
            long base = current == null || !current.isNumber() ? 0L : current.asLong();
            if (update == null || update.isNull()) {
                return numberNode(base);
            }
            if (!update.isIntegralNumber()) {
                throw new IllegalArgumentException("sum expects an integral update, got " + update.getNodeType());
            }
            return numberNode(Math.addExact(base, update.asLong()));
        };
    }

    private static JsonNode numberNode(long value) {
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return IntNode.valueOf((int) value);
        }
        return LongNode.valueOf(value);
    }

    private static ArrayNode copyArray(JsonNode current) {
        if (current != null && current.isArray()) {
            return ((ArrayNode) current).deepCopy();
        }
        return Jsons.mapper().createArrayNode();
    }

    private static String idOf(JsonNode element, String idField) {
        JsonNode id = element == null ? null : element.get(idField);
        if (id == null || id.isNull() || id.isContainerNode()) {
            throw new IllegalArgumentException("element without scalar '" + idField + "': " + element);
        }
        // 1 and "1" are different ids
        return id.getNodeType() + ":" + id.asText();
    }
}
