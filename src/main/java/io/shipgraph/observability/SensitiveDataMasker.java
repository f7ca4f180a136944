package io.shipgraph.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.shipgraph.util.Jsons;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

public final class SensitiveDataMasker {
    static final String MASK = "***";
    static final String REDACTED = "[REDACTED]";

    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential", "cookie"
    );
    private static final List<Pattern> SECRET_PATTERNS = List.of(
            Pattern.compile("sk-ant-[A-Za-z0-9_-]{10,}"),
            Pattern.compile("sk-[A-Za-z0-9]{20,}"),
            Pattern.compile("\\beyJ[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+\\b"),
            Pattern.compile("(?i)\\bBearer\\s+[A-Za-z0-9._-]{10,}"),
            Pattern.compile("(?i)\\bBasic\\s+[A-Za-z0-9+/=]{10,}"),
            Pattern.compile("-----BEGIN [A-Z ]+-----[\\s\\S]*?-----END [A-Z ]+-----"),
            Pattern.compile("\\bAKIA[0-9A-Z]{16}\\b"),
            Pattern.compile("\\b[a-fA-F0-9]{64,}\\b"),
            Pattern.compile("(?i)Authorization:\\s*\\S+")
    );
    private static final Pattern URL_CREDENTIALS = Pattern.compile("//[^/\\s:@]+:[^/\\s@]+@");
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^[A-Za-z0-9+/=_\\-:.]{24,}$");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            String text = input.asText("");
            if (likelySecretValue(text)) {
                return TextNode.valueOf(MASK);
            }
            String redacted = redact(text);
            return redacted.equals(text) ? input : TextNode.valueOf(redacted);
        }
        return input;
    }

    public static String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String out = text;
        for (Pattern pattern : SECRET_PATTERNS) {
            out = pattern.matcher(out).replaceAll(REDACTED);
        }
        return URL_CREDENTIALS.matcher(out).replaceAll("//" + REDACTED + "@");
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        String v = value.trim();
        return v.length() >= 24 && OPAQUE_TOKEN.matcher(v).matches();
    }
}
