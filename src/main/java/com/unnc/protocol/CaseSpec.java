package com.unnc.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One batch item.
 *
 * <pre>
 *   {"algo": "Sum", "args": [[1, 2, 3]], "store": "s"}     INVOKE
 *   {"type": "var_assign", "var": "t", "value": "node(leaf, 1, leaf)"}   ASSIGN
 *   {"type": "dsl_expr", "expr": "size(t)"}                 EXPRESSION
 * </pre>
 */
public final class CaseSpec {

    public enum Kind { INVOKE, ASSIGN, EXPRESSION, INVALID }

    public static final String TYPE_ASSIGN = "var_assign";
    public static final String TYPE_EXPRESSION = "dsl_expr";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public final Kind kind;
    /** INVOKE: algorithm name, may be null when the case names none. */
    public final String algorithm;
    /** INVOKE: arguments as JSON; unparsed tokens are JSON strings. */
    public final List<JsonNode> args;
    /** INVOKE: global to store the result under, or null. */
    public final String store;
    /** ASSIGN: target global. */
    public final String variable;
    /** ASSIGN: value expression; EXPRESSION: the expression. */
    public final String expression;
    /** INVALID: why the case cannot run. */
    public final String problem;

    private final JsonNode source;

    private CaseSpec(Kind kind, String algorithm, List<JsonNode> args, String store,
                     String variable, String expression, String problem, JsonNode source) {
        this.kind = kind;
        this.algorithm = algorithm;
        this.args = args;
        this.store = store;
        this.variable = variable;
        this.expression = expression;
        this.problem = problem;
        this.source = source;
    }

    public static CaseSpec invoke(String algorithm, List<JsonNode> args, String store) {
        ObjectNode o = NODES.objectNode();
        o.put("algo", algorithm);
        ArrayNode a = o.putArray("args");
        a.addAll(args);
        if (store != null) o.put("store", store);
        return new CaseSpec(Kind.INVOKE, algorithm, Collections.unmodifiableList(new ArrayList<>(args)),
                store, null, null, null, o);
    }

    public static CaseSpec assign(String variable, String expression) {
        ObjectNode o = NODES.objectNode();
        o.put("type", TYPE_ASSIGN);
        o.put("var", variable);
        o.put("value", expression);
        return new CaseSpec(Kind.ASSIGN, null, List.of(), null, variable, expression, null, o);
    }

    public static CaseSpec expression(String expression) {
        ObjectNode o = NODES.objectNode();
        o.put("type", TYPE_EXPRESSION);
        o.put("expr", expression);
        return new CaseSpec(Kind.EXPRESSION, null, List.of(), null, null, expression, null, o);
    }

    /** Reads the JSON case form. Never throws: unusable input becomes an INVALID case. */
    public static CaseSpec fromJson(JsonNode n) {
        if (n == null || !n.isObject()) {
            return new CaseSpec(Kind.INVALID, null, List.of(), null, null, null,
                    "Case is not a JSON object: " + n, n);
        }
        String type = n.path("type").asText("");
        if (type.equals(TYPE_ASSIGN)) {
            return new CaseSpec(Kind.ASSIGN, null, List.of(), null,
                    n.path("var").asText(""), n.path("value").asText(""), null, n);
        }
        if (type.equals(TYPE_EXPRESSION)) {
            return new CaseSpec(Kind.EXPRESSION, null, List.of(), null, null, n.path("expr").asText(""), null, n);
        }

        JsonNode algo = n.get("algo");
        List<JsonNode> args = new ArrayList<>();
        JsonNode a = n.get("args");
        if (a != null && a.isArray()) {
            a.forEach(args::add);
        } else if (a != null && !a.isNull()) {
            args.add(a);
        }
        JsonNode store = n.get("store");
        return new CaseSpec(Kind.INVOKE,
                algo == null || algo.isNull() ? null : algo.asText(),
                Collections.unmodifiableList(args),
                store == null || store.isNull() ? null : store.asText(),
                null, null, null, n);
    }

    /** The case in its JSON form, as written by case-file export. */
    public JsonNode toJson() {
        return source == null ? NODES.nullNode() : source.deepCopy();
    }

    @Override
    public String toString() {
        switch (kind) {
            case INVOKE: return algorithm + args;
            case ASSIGN: return variable + " = " + expression;
            case EXPRESSION: return expression;
            default: return "invalid: " + problem;
        }
    }
}
