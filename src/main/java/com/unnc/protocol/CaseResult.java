package com.unnc.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.unnc.script.parser.Value;

/** Output slot of one case: the value and its JSON form, or an error record. */
public final class CaseResult {
    private final Value value;
    private final JsonNode output;
    private final String error;

    private CaseResult(Value value, JsonNode output, String error) {
        this.value = value;
        this.output = output;
        this.error = error;
    }

    public static CaseResult success(Value value, JsonNode output) {
        return new CaseResult(value, output, null);
    }

    public static CaseResult failure(String message) {
        ObjectNode o = JsonNodeFactory.instance.objectNode();
        o.put("error", message);
        return new CaseResult(null, o, message);
    }

    public boolean isSuccess() { return error == null; }

    /** Null for failures. */
    public Value value() { return value; }

    public JsonNode output() { return output; }

    /** Null for successes. */
    public String error() { return error; }

    /** True when the output is an encoded (non-leaf) tree. */
    public boolean isTree() {
        return output.isObject() && "node".equals(output.path(ValueCodec.TYPE_FIELD).asText());
    }

    @Override
    public String toString() {
        return isSuccess() ? output.toString() : "error: " + error;
    }
}
