package io.koios.core.toon;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes JSON trees as Token-Oriented Object Notation. Arrays of flat objects
 * sharing one key set become a table whose header names the fields once.
 */
public final class ToonEncoder {
    private static final Logger LOG = LoggerFactory.getLogger(ToonEncoder.class);
    private static final Pattern SAFE_KEY = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]*$");
    private static final Pattern NUMERIC_LIKE = Pattern.compile("^-?\\d+(?:\\.\\d+)?(?:[eE][+-]?\\d+)?$|^0\\d+$");

    private final ObjectMapper mapper;
    private final int indent;
    private final char delimiter;

    public ToonEncoder() {
        this(new ObjectMapper(), 2, ',');
    }

    public ToonEncoder(ObjectMapper mapper, int indent, char delimiter) {
        if (delimiter != ',' && delimiter != '\t' && delimiter != '|') {
            throw new IllegalArgumentException("Unsupported delimiter: " + delimiter);
        }
        this.mapper = mapper;
        this.indent = Math.max(1, indent);
        this.delimiter = delimiter;
    }

    public String encode(Object value) {
        JsonNode node;
        try {
            node = value instanceof JsonNode json ? json : mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            LOG.warn("TOON conversion failed, using plain text: {}", e.getMessage());
            return String.valueOf(value);
        }
        return encode(node);
    }

    public String encode(JsonNode node) {
        try {
            List<String> lines = new ArrayList<>();
            if (node == null || node.isNull() || node.isMissingNode()) {
                return "null";
            }
            if (node.isObject()) {
                writeObject(lines, (ObjectNode) node, 0);
            } else if (node.isArray()) {
                writeArray(lines, null, (ArrayNode) node, 0);
            } else {
                return primitive(node);
            }
            return String.join("\n", lines);
        } catch (RuntimeException e) {
            LOG.warn("TOON encoding failed, using JSON text: {}", e.getMessage());
            return node.toString();
        }
    }

    private void writeObject(List<String> lines, ObjectNode object, int depth) {
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            writeField(lines, field.getKey(), field.getValue(), depth);
        }
    }

    private void writeField(List<String> lines, String key, JsonNode value, int depth) {
        String encodedKey = key(key);
        if (value.isObject()) {
            lines.add(pad(depth) + encodedKey + ":");
            writeObject(lines, (ObjectNode) value, depth + 1);
        } else if (value.isArray()) {
            writeArray(lines, encodedKey, (ArrayNode) value, depth);
        } else {
            lines.add(pad(depth) + encodedKey + ": " + primitive(value));
        }
    }

    private void writeArray(List<String> lines, String encodedKey, ArrayNode array, int depth) {
        String prefix = pad(depth) + (encodedKey == null ? "" : encodedKey);
        int size = array.size();
        if (size == 0) {
            lines.add(prefix + "[0]:");
            return;
        }

        if (allPrimitive(array)) {
            lines.add(prefix + "[" + size + "]: " + inlineRow(array));
            return;
        }

        List<String> header = tabularHeader(array);
        if (header != null) {
            lines.add(prefix + "[" + size + "]{" + joinKeys(header) + "}:");
            for (JsonNode row : array) {
                List<String> cells = new ArrayList<>();
                for (String field : header) {
                    cells.add(primitive(row.get(field)));
                }
                lines.add(pad(depth + 1) + String.join(String.valueOf(delimiter), cells));
            }
            return;
        }

        lines.add(prefix + "[" + size + "]:");
        for (JsonNode item : array) {
            writeListItem(lines, item, depth + 1);
        }
    }

    private void writeListItem(List<String> lines, JsonNode item, int depth) {
        if (item.isObject()) {
            ObjectNode object = (ObjectNode) item;
            if (object.isEmpty()) {
                lines.add(pad(depth) + "-");
                return;
            }
            List<String> nested = new ArrayList<>();
            writeObject(nested, object, depth + 1);
            // first field moves onto the hyphen line
            String first = nested.get(0).substring(pad(depth + 1).length());
            lines.add(pad(depth) + "- " + first);
            lines.addAll(nested.subList(1, nested.size()));
        } else if (item.isArray()) {
            ArrayNode array = (ArrayNode) item;
            if (allPrimitive(array)) {
                lines.add(pad(depth) + "- [" + array.size() + "]:" + (array.isEmpty() ? "" : " " + inlineRow(array)));
            } else {
                lines.add(pad(depth) + "- [" + array.size() + "]:");
                for (JsonNode nested : array) {
                    writeListItem(lines, nested, depth + 1);
                }
            }
        } else {
            lines.add(pad(depth) + "- " + primitive(item));
        }
    }

    private List<String> tabularHeader(ArrayNode array) {
        List<String> header = null;
        for (JsonNode item : array) {
            if (!item.isObject() || item.isEmpty()) {
                return null;
            }
            List<String> keys = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isContainerNode()) {
                    return null;
                }
                keys.add(field.getKey());
            }
            if (header == null) {
                header = keys;
            } else if (header.size() != keys.size() || !header.containsAll(keys)) {
                return null;
            }
        }
        return header;
    }

    private boolean allPrimitive(ArrayNode array) {
        for (JsonNode item : array) {
            if (item.isContainerNode()) {
                return false;
            }
        }
        return true;
    }

    private String inlineRow(ArrayNode array) {
        List<String> cells = new ArrayList<>();
        for (JsonNode item : array) {
            cells.add(primitive(item));
        }
        return String.join(String.valueOf(delimiter), cells);
    }

    private String joinKeys(List<String> keys) {
        List<String> encoded = new ArrayList<>();
        for (String key : keys) {
            encoded.add(key(key));
        }
        return String.join(String.valueOf(delimiter), encoded);
    }

    private String primitive(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "null";
        }
        if (node.isBoolean()) {
            return node.asBoolean() ? "true" : "false";
        }
        if (node.isNumber()) {
            return number(node);
        }
        return string(node.asText());
    }

    private String number(JsonNode node) {
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue().toString();
        }
        double value = node.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "null";
        }
        BigDecimal decimal = node.decimalValue().stripTrailingZeros();
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.toPlainString();
    }

    private String key(String key) {
        return SAFE_KEY.matcher(key).matches() ? key : quote(key);
    }

    String string(String value) {
        return needsQuotes(value) ? quote(value) : value;
    }

    private boolean needsQuotes(String value) {
        if (value.isEmpty()) {
            return true;
        }
        if (Character.isWhitespace(value.charAt(0)) || Character.isWhitespace(value.charAt(value.length() - 1))) {
            return true;
        }
        if ("true".equals(value) || "false".equals(value) || "null".equals(value)) {
            return true;
        }
        if (NUMERIC_LIKE.matcher(value).matches() || value.startsWith("-")) {
            return true;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == delimiter || c == ':' || c == '"' || c == '\\' || c == '[' || c == ']'
                || c == '{' || c == '}' || Character.isISOControl(c)) {
                return true;
            }
        }
        return false;
    }

    private String quote(String value) {
        StringBuilder out = new StringBuilder(value.length() + 2);
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> out.append(c);
            }
        }
        return out.append('"').toString();
    }

    private String pad(int depth) {
        return " ".repeat(depth * indent);
    }
}
