package io.shipgraph.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BigIntegerNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;

public final class Jsons {
    private static final ObjectMapper MAPPER = exactNumbers(new ObjectMapper())
            .findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private static final ObjectMapper COMPACT_MAPPER = exactNumbers(new ObjectMapper()).findAndRegisterModules();

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectMapper compactMapper() {
        return COMPACT_MAPPER;
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    public static String toCompactJson(Object value) {
        try {
            return COMPACT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return COMPACT_MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to parse JSON as " + type.getSimpleName(), e);
        }
    }

    /**
     * Converts any Jackson-mappable value to a tree. {@code null} becomes {@link NullNode}
     * so channel values and payloads never carry Java nulls. Numbers take the node type the
     * mappers read them back as, so a tree equals itself after a checkpoint round trip.
     */
    public static JsonNode tree(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        JsonNode node = value instanceof JsonNode json ? json : MAPPER.valueToTree(value);
        return readsBackDifferently(node) ? canonical(node.deepCopy()) : node;
    }

    public static JsonNode orNull(JsonNode node) {
        return node == null || node.isMissingNode() ? NullNode.getInstance() : node;
    }

    private static ObjectMapper exactNumbers(ObjectMapper mapper) {
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
        return mapper;
    }

    private static boolean readsBackDifferently(JsonNode node) {
        if (node.isNumber()) {
            return !node.equals(canonicalNumber(node));
        }
        for (JsonNode child : node) {
            if (readsBackDifferently(child)) {
                return true;
            }
        }
        return false;
    }

    private static JsonNode canonical(JsonNode node) {
        if (node.isNumber()) {
            return canonicalNumber(node);
        }
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                field.setValue(canonical(field.getValue()));
            }
        } else if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                array.set(i, canonical(array.get(i)));
            }
        }
        return node;
    }

    // The node type the mappers produce when reading this number's JSON text.
    private static JsonNode canonicalNumber(JsonNode node) {
        if (node.isFloat() || node.isDouble()) {
            if (!Double.isFinite(node.doubleValue())) {
                return node;
            }
            return DecimalNode.valueOf(node.isFloat()
                    ? new BigDecimal(Float.toString(node.floatValue()))
                    : BigDecimal.valueOf(node.doubleValue()));
        }
        if (node.isBigDecimal() && node.decimalValue().scale() != 0) {
            return node;
        }
        if (node.canConvertToInt()) {
            return IntNode.valueOf(node.intValue());
        }
        if (node.canConvertToLong()) {
            return LongNode.valueOf(node.longValue());
        }
        return BigIntegerNode.valueOf(node.bigIntegerValue());
    }
}
