package com.unnc.protocol.util;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.unnc.protocol.ValueCodec;

/**
 * ASCII rendering of an encoded tree, root first:
 *
 * <pre>
 * 2
 *     |-- 1
 *     `-- 3
 * </pre>
 *
 * Leaves are not drawn; a single child is always drawn as the last one.
 */
public final class TreeRenderer {

    private static final ObjectWriter LABELS = new ObjectMapper().writer(new SpacedPrinter());

    private TreeRenderer() {}

    public static String render(JsonNode tree) {
        if (!isNode(tree)) return "";
        List<String> lines = new ArrayList<>();
        draw(tree, "", true, true, lines);
        return String.join("\n", lines);
    }

    private static void draw(JsonNode node, String prefix, boolean tail, boolean root, List<String> out) {
        String label = label(node.get("value"));
        if (root) {
            out.add(label);
        } else {
            out.add(prefix + (tail ? "`-- " : "|-- ") + label);
        }

        JsonNode left = node.get("left");
        JsonNode right = node.get("right");
        boolean hasLeft = isNode(left);
        boolean hasRight = isNode(right);
        String extension = prefix + (tail || root ? "    " : "|   ");

        if (hasLeft && hasRight) {
            draw(left, extension, false, false, out);
            draw(right, extension, true, false, out);
        } else if (hasLeft) {
            draw(left, extension, true, false, out);
        } else if (hasRight) {
            draw(right, extension, true, false, out);
        }
    }

    private static boolean isNode(JsonNode n) {
        return n != null && n.isObject() && "node".equals(n.path(ValueCodec.TYPE_FIELD).asText());
    }

    private static String label(JsonNode v) {
        if (v == null || v.isNull()) return "None";
        if (v.isTextual()) return v.textValue();
        if (v.isBoolean()) return v.booleanValue() ? "True" : "False";
        if (v.isObject() && "leaf".equals(v.path(ValueCodec.TYPE_FIELD).asText())) return "";
        try {
            return LABELS.writeValueAsString(v);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render tree label " + v, e);
        }
    }
}
