package io.koios.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Extracts a JSON object from model output that may be wrapped in prose or
 * Markdown fences.
 */
public final class StructuredOutput {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StructuredOutput() {
    }

    public static ObjectNode parse(String raw) {
        String text = raw == null ? "" : stripFences(raw.trim());
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return errorPayload("no JSON object found", raw);
        }

        try {
            JsonNode node = MAPPER.readTree(text.substring(start, end + 1));
            if (node instanceof ObjectNode object) {
                return object;
            }
            return errorPayload("JSON value is not an object", raw);
        } catch (JsonProcessingException e) {
            return errorPayload("invalid JSON: " + e.getOriginalMessage(), raw);
        }
    }

    public static boolean isError(JsonNode node) {
        return node != null && node.has("error") && node.has("raw");
    }

    private static String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        String body = firstNewline < 0 ? "" : text.substring(firstNewline + 1);
        int closing = body.lastIndexOf("```");
        return closing < 0 ? body : body.substring(0, closing);
    }

    private static ObjectNode errorPayload(String reason, String raw) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("error", reason);
        node.put("raw", raw == null ? "" : raw);
        return node;
    }
}
