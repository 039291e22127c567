package com.unnc.protocol;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.unnc.debug.Debug;
import com.unnc.script.parser.ExpressionCompiler;

/**
 * Reads batch cases from an input file or from {@code --exec} values.
 *
 * <p>An input file is either one JSON document (an object with a {@code cases} array, or an
 * array) or a line-based listing:
 *
 * <pre>
 * # comment
 * Sum: [1, 2, 3]
 * Insert(node(leaf, 5, leaf),
 *        3)
 * t = node(leaf, 2, leaf)
 * {"algo": "Size", "args": ["t"]}
 * &#64;cases/extra.json
 * </pre>
 */
public final class CaseLoader {

    private static final String TAG = "unnc.cli";

    private static final Pattern COLON_FORM = Pattern.compile("([A-Za-z_]\\w*)\\s*:(.*)", Pattern.DOTALL);
    private static final Pattern CALL_FORM = Pattern.compile("([A-Za-z_]\\w*)\\s*\\((.*)", Pattern.DOTALL);
    private static final Pattern ASSIGNMENT = Pattern.compile("([A-Za-z_]\\w*)\\s*=(?!=)(.*)", Pattern.DOTALL);

    private final ObjectReader strict;

    public CaseLoader() {
        this(new ObjectMapper());
    }

    public CaseLoader(ObjectMapper om) {
        this.strict = om.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /** Cases listed in {@code path}; an absent file yields no cases. */
    public List<CaseSpec> loadFile(Path path) throws IOException {
        if (path == null || !Files.exists(path)) return new ArrayList<>();
        String text = Files.readString(path, StandardCharsets.UTF_8);
        return parse(text);
    }

    public List<CaseSpec> parse(String text) {
        if (text.startsWith("\uFEFF")) text = text.substring(1);

        JsonNode whole = readJson(text);
        if (whole != null) {
            if (whole.isObject() && whole.has("cases")) return fromArray(whole.get("cases"));
            if (whole.isArray()) return fromArray(whole);
        }

        List<CaseSpec> cases = new ArrayList<>();
        String[] lines = text.split("\\r?\\n", -1);
        int i = 0;
        while (i < lines.length) {
            String ln = lines[i].trim();
            i++;
            if (ln.isEmpty() || ln.startsWith("#")) continue;

            if (ln.startsWith("@")) {
                CaseSpec fromFile = loadReference(ln.substring(1).trim());
                if (fromFile != null) {
                    cases.add(fromFile);
                    continue;
                }
            }

            Matcher colon = COLON_FORM.matcher(ln);
            if (colon.matches() && !colon.group(1).startsWith("node")) {
                StringBuilder args = new StringBuilder(colon.group(2));
                i = continueUnbalanced(lines, i, args);
                cases.add(CaseSpec.invoke(colon.group(1), parseArgs(args.toString()), null));
                continue;
            }

            Matcher call = CALL_FORM.matcher(ln);
            if (call.matches() && !call.group(1).startsWith("node")) {
                // count the call's own '(' so a multi-line argument list is joined
                StringBuilder args = new StringBuilder("(").append(call.group(2));
                i = continueUnbalanced(lines, i, args);
                String joined = args.toString().trim();
                if (closeOfFirst(joined) == joined.length() - 1) {
                    String inner = joined.substring(1, joined.length() - 1);
                    cases.add(CaseSpec.invoke(call.group(1), parseArgs(inner), null));
                } else {
                    // "size(t) == 1": the call is only part of an expression
                    cases.add(statementCase(call.group(1) + joined));
                }
                continue;
            }

            if (ln.contains("node(") || ln.contains("leaf") || ln.contains("=")) {
                StringBuilder stmt = new StringBuilder(ln);
                i = continueUnbalanced(lines, i, stmt);
                cases.add(statementCase(stmt.toString()));
                continue;
            }

            JsonNode json = readJson(ln);
            if (json != null) {
                cases.add(CaseSpec.fromJson(json));
            } else {
                Debug.get().w(TAG, "input line " + i + " not understood, skipped: " + ln);
            }
        }
        return cases;
    }

    /** One {@code --exec} value: JSON, {@code @file}, or {@code Algo: args}. Null when unusable. */
    public CaseSpec parseExec(String value) {
        String v = value.trim();
        if (v.startsWith("@")) return loadReference(v.substring(1).trim());
        JsonNode json = readJson(v);
        if (json != null) return CaseSpec.fromJson(json);
        Matcher colon = COLON_FORM.matcher(v);
        if (colon.matches()) return CaseSpec.invoke(colon.group(1), parseArgs(colon.group(2)), null);
        Debug.get().w(TAG, "--exec value not understood: " + value);
        return null;
    }

    // -------------------------
    // Helpers
    // -------------------------

    private List<CaseSpec> fromArray(JsonNode arr) {
        List<CaseSpec> out = new ArrayList<>();
        if (arr != null && arr.isArray()) {
            for (JsonNode c : arr) out.add(CaseSpec.fromJson(c));
        }
        return out;
    }

    private CaseSpec loadReference(String file) {
        Path p = Path.of(file);
        if (!Files.exists(p)) {
            Debug.get().w(TAG, "case file not found: " + file);
            return null;
        }
        try {
            JsonNode json = readJson(Files.readString(p, StandardCharsets.UTF_8));
            if (json != null) return CaseSpec.fromJson(json);
            Debug.get().w(TAG, "case file is not JSON: " + file);
        } catch (IOException e) {
            Debug.get().w(TAG, "failed to read case file " + file + ": " + e.getMessage());
        }
        return null;
    }

    private CaseSpec statementCase(String stmt) {
        Matcher assign = ASSIGNMENT.matcher(stmt.trim());
        if (assign.matches()) return CaseSpec.assign(assign.group(1), assign.group(2).trim());
        JsonNode json = readJson(stmt);
        if (json != null) return CaseSpec.fromJson(json);
        return CaseSpec.expression(stmt.trim());
    }

    /** Appends following lines to {@code buf} while its brackets are unbalanced. */
    private static int continueUnbalanced(String[] lines, int next, StringBuilder buf) {
        int i = next;
        while (depth(buf) > 0 && i < lines.length) {
            buf.append('\n').append(lines[i]);
            i++;
        }
        return i;
    }

    /** Index of the bracket closing the one at position 0, or -1. */
    private static int closeOfFirst(String s) {
        int d = 0;
        for (int k = 0; k < s.length(); k++) {
            char c = s.charAt(k);
            if (c == '[' || c == '(' || c == '{') d++;
            else if (c == ']' || c == ')' || c == '}') {
                d--;
                if (d == 0) return k;
            }
        }
        return -1;
    }

    private static int depth(CharSequence s) {
        int d = 0;
        for (int k = 0; k < s.length(); k++) {
            char c = s.charAt(k);
            if (c == '[' || c == '(' || c == '{') d++;
            else if (c == ']' || c == ')' || c == '}') d--;
        }
        return d;
    }

    /** Top-level comma split; each token is JSON when it parses, its raw text otherwise. */
    List<JsonNode> parseArgs(String text) {
        List<JsonNode> out = new ArrayList<>();
        for (String token : ExpressionCompiler.splitTopLevel(text)) {
            if (token.isEmpty()) continue;
            JsonNode json = readJson(token);
            out.add(json != null ? json : JsonNodeFactory.instance.textNode(token));
        }
        return out;
    }

    private JsonNode readJson(String text) {
        String t = text.trim();
        if (t.isEmpty()) return null;
        try {
            return strict.readTree(t);
        } catch (IOException e) {
            return null;
        }
    }
}
