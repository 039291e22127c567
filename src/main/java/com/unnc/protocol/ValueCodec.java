package com.unnc.protocol;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.unnc.script.data.PersistentList;
import com.unnc.script.data.PersistentTree;
import com.unnc.script.parser.Value;

/**
 * Maps engine values to JSON and back.
 *
 * <pre>
 *   INT / FLOAT / BOOL / STRING  -> number / boolean / string
 *   empty list, NONE             -> null
 *   list                         -> array, front to back, null-mapping elements dropped
 *   leaf                         -> {"_type":"leaf"}
 *   node                         -> {"_type":"node","left":..,"value":..,"right":..}
 * </pre>
 */
public final class ValueCodec {

    public static final String TYPE_FIELD = "_type";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper om;

    public ValueCodec() {
        this(new ObjectMapper());
    }

    public ValueCodec(ObjectMapper om) {
        this.om = om;
    }

    // ===================== ENCODE =====================

    public JsonNode encode(Value v) {
        switch (v.type) {
            case INT: return NODES.numberNode(v.asInt());
            case FLOAT: return NODES.numberNode(v.asDouble());
            case BOOL: return NODES.booleanNode(v.asBool());
            case STRING: return NODES.textNode(v.asString());
            case NONE: return NODES.nullNode();
            case LIST: return encodeList(v.asList());
            case TREE: return encodeTree(v.asTree());
            default: throw new IllegalArgumentException("Cannot encode " + v.describe());
        }
    }

    private JsonNode encodeList(PersistentList<Value> list) {
        if (list.isEmpty()) return NODES.nullNode();
        ArrayNode arr = NODES.arrayNode();
        for (Value item : list) {
            JsonNode n = encode(item);
            if (!n.isNull()) arr.add(n);
        }
        return arr;
    }

    private JsonNode encodeTree(PersistentTree<Value> tree) {
        ObjectNode o = NODES.objectNode();
        if (tree.isLeaf()) {
            o.put(TYPE_FIELD, "leaf");
            return o;
        }
        o.put(TYPE_FIELD, "node");
        o.set("left", encodeTree(tree.left()));
        o.set("value", encode(tree.root()));
        o.set("right", encodeTree(tree.right()));
        return o;
    }

    // ===================== DECODE =====================

    /** Inverse of {@link #encode}; strings stay strings at every depth. */
    public Value decode(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return Value.emptyList();
        if (n.isBoolean()) return Value.bool(n.booleanValue());
        if (n.isIntegralNumber()) {
            if (!n.canConvertToLong()) throw new IllegalArgumentException("Integer out of range: " + n);
            return Value.integer(n.longValue());
        }
        if (n.isNumber()) return Value.floating(n.doubleValue());
        if (n.isTextual()) return Value.string(n.textValue());
        if (n.isArray()) {
            List<Value> items = new ArrayList<>(n.size());
            for (JsonNode item : n) items.add(decode(item));
            return Value.list(PersistentList.of(items));
        }
        if (n.isObject()) return Value.tree(decodeTree(n));
        throw new IllegalArgumentException("Unsupported JSON value: " + n);
    }

    private PersistentTree<Value> decodeTree(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return PersistentTree.leaf();
        String type = n.path(TYPE_FIELD).asText("");
        if (type.equals("leaf")) return PersistentTree.leaf();
        if (type.equals("node")) {
            return PersistentTree.node(decodeTree(n.get("left")), decode(n.get("value")), decodeTree(n.get("right")));
        }
        throw new IllegalArgumentException("Expected a {\"" + TYPE_FIELD + "\": \"node\"|\"leaf\"} object, got " + n);
    }

    public String toJson(Value v) {
        try {
            return om.writeValueAsString(encode(v));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + v.describe(), e);
        }
    }
}
