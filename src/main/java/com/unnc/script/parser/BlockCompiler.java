package com.unnc.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.unnc.debug.Debug;
import com.unnc.script.error.CompilationException;
import com.unnc.script.parser.Statement.Block;

/**
 * Splits pseudocode source into {@code Algorithm} blocks and registers one
 * {@link AlgorithmDefinition} per block.
 *
 * <pre>
 * Algorithm: Sum(L)
 *   Requires: a list L            (dropped)
 *   Step 1: if isEmpty(L) then    (label stripped)
 * </pre>
 */
public class BlockCompiler {

    private static final String TAG = "unnc.compile";

    private static final Pattern BLOCK_START = Pattern.compile("\\s*Algorithm\\b");
    private static final Pattern HEADER = Pattern.compile("\\s*Algorithm\\s*:?\\s*([A-Za-z_]\\w*)\\s*\\((.*?)\\)\\s*$");
    private static final Pattern STEP_LABEL = Pattern.compile("^(?:Step\\s*\\d+:|\\d+\\s*:)\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPEC_COMMENT = Pattern.compile("^(?:requires|returns)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");

    /** Compiles {@code source} into {@code env}; returns the definitions in source order. */
    public List<AlgorithmDefinition> compile(String source, Environment env) {
        List<AlgorithmDefinition> out = new ArrayList<>();
        String[] lines = source.split("\\r?\\n", -1);

        int headerIndex = -1;
        for (int i = 0; i < lines.length; i++) {
            if (BLOCK_START.matcher(lines[i]).lookingAt()) {
                if (headerIndex >= 0) out.add(compileBlock(lines, headerIndex, i));
                headerIndex = i;
            } else if (headerIndex < 0 && !lines[i].trim().isEmpty()) {
                Debug.get().w(TAG, "line " + (i + 1) + " is outside any Algorithm block, ignored: " + lines[i].trim());
            }
        }
        if (headerIndex >= 0) out.add(compileBlock(lines, headerIndex, lines.length));

        for (AlgorithmDefinition def : out) {
            env.register(def);
            Debug.get().d(TAG, "registered " + def + " (" + def.bodyLines.size() + " body lines)");
        }
        return out;
    }

    private AlgorithmDefinition compileBlock(String[] lines, int header, int end) {
        int headerLine = header + 1;
        Matcher m = HEADER.matcher(lines[header]);
        if (!m.matches()) {
            throw new CompilationException("Invalid algorithm header: " + lines[header].trim(), headerLine);
        }
        String name = m.group(1);
        List<String> params = parameters(name, m.group(2), headerLine);

        List<SourceLine> body = new ArrayList<>();
        for (int i = header + 1; i < end; i++) {
            String stripped = STEP_LABEL.matcher(lines[i].trim()).replaceFirst("").trim();
            if (stripped.isEmpty() || SPEC_COMMENT.matcher(stripped).lookingAt()) continue;
            body.add(new SourceLine(i + 1, stripped));
        }
        body = Collections.unmodifiableList(body);

        Block parsed = StatementParser.parse(name, body);
        return new AlgorithmDefinition(name, params, body, parsed, headerLine);
    }

    private static List<String> parameters(String algorithm, String raw, int line) {
        if (raw.trim().isEmpty()) return List.of();
        Set<String> seen = new LinkedHashSet<>();
        for (String p : raw.split(",", -1)) {
            String param = p.trim();
            if (!IDENTIFIER.matcher(param).matches()) {
                throw new CompilationException("Invalid parameter '" + param + "' in " + algorithm, line);
            }
            if (!seen.add(param)) {
                throw new CompilationException("Duplicate parameter '" + param + "' in " + algorithm, line);
            }
        }
        return List.copyOf(seen);
    }
}
