package com.quill.script.json;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quill.script.parser.Value;

/** Conversion between runtime values and Jackson JSON trees. Only scalars map across. */
public final class ValueJson {

    private static final ObjectMapper om = new ObjectMapper();
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private ValueJson() {}

    public static ObjectMapper mapper() { return om; }

    public static JsonNode toJson(Value v) {
        if (v == null) throw new IllegalArgumentException("value must not be null");
        switch (v.getType()) {
            case NUMBER: {
                double d = v.asNumber();
                // JSON has no NaN/Infinity; fall back to the script's own spelling.
                if (Double.isNaN(d) || Double.isInfinite(d)) return nodes.textNode(Value.formatNumber(d));
                return nodes.numberNode(d);
            }
            case STRING: return nodes.textNode(v.asString());
            case BOOL:   return nodes.booleanNode(v.asBool());
            default:     return nodes.nullNode();
        }
    }

    public static Value fromJson(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return Value.nil();
        if (n.isNumber()) return Value.number(n.asDouble());
        if (n.isTextual()) return Value.string(n.asText());
        if (n.isBoolean()) return Value.bool(n.asBoolean());
        throw new IllegalArgumentException("Only scalar JSON maps to a script value, got " + n.getNodeType());
    }

    public static ObjectNode toJson(Map<String, Value> vars) {
        ObjectNode out = nodes.objectNode();
        for (Map.Entry<String, Value> e : vars.entrySet()) {
            out.set(e.getKey(), toJson(e.getValue()));
        }
        return out;
    }

    public static Map<String, Value> fromJsonObject(JsonNode obj) {
        if (obj == null || !obj.isObject()) {
            throw new IllegalArgumentException("Expected a JSON object, got "
                    + (obj == null ? "nothing" : obj.getNodeType()));
        }
        Map<String, Value> out = new LinkedHashMap<>();
        obj.fields().forEachRemaining(e -> out.put(e.getKey(), fromJson(e.getValue())));
        return out;
    }

    public static String pretty(JsonNode n) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(n);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new IllegalStateException("Cannot render JSON: " + e.getOriginalMessage(), e);
        }
    }
}
