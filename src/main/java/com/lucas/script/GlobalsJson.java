package com.lucas.script;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lucas.script.parser.Value;

/** JSON export of a global snapshot, used by {@code --dump-globals} and the REPL {@code json} command. */
public final class GlobalsJson {
    private static final ObjectMapper om = new ObjectMapper();
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private GlobalsJson() {}

    public static String toJson(Map<String, Value> globals) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(globals));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize globals", e);
        }
    }

    public static ObjectNode toTree(Map<String, Value> globals) {
        ObjectNode root = nodes.objectNode();
        for (Map.Entry<String, Value> e : globals.entrySet()) {
            root.set(e.getKey(), toNode(e.getValue(), Collections.newSetFromMap(new IdentityHashMap<>())));
        }
        return root;
    }

    private static JsonNode toNode(Value v, Set<Object> inProgress) {
        switch (v.getType()) {
            case NIL: return nodes.nullNode();
            case BOOL: return nodes.booleanNode(v.asBool());
            case TEXT: return nodes.textNode(v.asText());
            case NUMBER: {
                double d = v.asNumber();
                if (Double.isNaN(d) || Double.isInfinite(d)) return nodes.textNode(Value.formatNumber(d));
                if (d == Math.rint(d) && Math.abs(d) < 9.0e15) return nodes.numberNode((long) d);
                return nodes.numberNode(d);
            }
            case FUNCTION: return nodes.textNode(v.stringify());
            case ARRAY: {
                List<Value> items = v.asArray();
                if (!inProgress.add(items)) return nodes.textNode("[...]");
                ArrayNode arr = nodes.arrayNode();
                for (Value item : items) arr.add(toNode(item, inProgress));
                inProgress.remove(items);
                return arr;
            }
            default: return nodes.textNode(v.stringify());
        }
    }
}
