package com.unnc.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.unnc.script.parser.Expr.ExprInterface;

/**
 * Turns expression text into a {@link Resolvable}. Pure and syntactic: nothing here looks at
 * scopes or the algorithm registry.
 */
public final class ExpressionCompiler {

    private static final Pattern CALL = Pattern.compile("([A-Za-z_]\\w*)\\((.*)\\)", Pattern.DOTALL);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern FLOAT = Pattern.compile("-?\\d+\\.\\d+");

    // Word operators are never call targets: "not(x)" is negation, not a call to "not".
    private static final Set<String> WORD_OPERATORS = Set.of("and", "or", "not", "AND", "OR", "NOT", "mod", "X");

    private ExpressionCompiler() {}

    public static Resolvable compile(String source) {
        String text = source == null ? "" : source.trim();

        Resolvable call = compileCall(text);
        if (call != null) return call;

        Value literal = parseLiteral(text);
        if (literal != null) return new Resolvable.Literal(text, literal);

        if (IDENTIFIER.matcher(text).matches()) {
            return new Resolvable.Name(text, compileFallback(text));
        }

        return compileFallback(text);
    }

    /** Literal step of the resolution order; null when {@code text} is not a literal. */
    public static Value parseLiteral(String text) {
        if (text.equals("Nil")) return Value.emptyList();
        if (text.equals("leaf")) return Value.leaf();
        if (INTEGER.matcher(text).matches()) {
            try {
                return Value.integer(Long.parseLong(text));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (FLOAT.matcher(text).matches()) return Value.floating(Double.parseDouble(text));
        if (text.length() >= 2) {
            char q = text.charAt(0);
            if ((q == '"' || q == '\'') && text.charAt(text.length() - 1) == q
                    && text.indexOf(q, 1) == text.length() - 1) {
                return Value.string(text.substring(1, text.length() - 1));
            }
        }
        return null;
    }

    public static Resolvable.Fallback compileFallback(String text) {
        String normalized = OperatorNormalizer.normalize(text);
        try {
            List<Token> tokens = new Lexer(normalized).tokenize();
            ExprInterface tree = new Parser(tokens).parse();
            return new Resolvable.Fallback(text, normalized, tree, null);
        } catch (RuntimeException e) {
            return new Resolvable.Fallback(text, normalized, null, e);
        }
    }

    private static Resolvable compileCall(String text) {
        Matcher m = CALL.matcher(text);
        if (!m.matches()) return null;
        String name = m.group(1);
        if (WORD_OPERATORS.contains(name)) return null;

        // the '(' after the name must close at the very last character
        int open = name.length();
        if (closingParen(text, open) != text.length() - 1) return null;

        String inner = m.group(2);
        List<Resolvable> args = new ArrayList<>();
        if (!inner.trim().isEmpty()) {
            for (String part : splitTopLevel(inner)) {
                args.add(compile(part));
            }
        }
        return new Resolvable.Call(text, name, Collections.unmodifiableList(args));
    }

    /** Index of the bracket closing the one at {@code open}, or -1. Quotes are skipped. */
    static int closingParen(String text, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    /** Splits on commas that are outside brackets and quotes. Parts are trimmed. */
    public static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                cur.append(c);
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(cur.toString().trim());
                cur.setLength(0);
                continue;
            }
            cur.append(c);
        }
        parts.add(cur.toString().trim());
        return parts;
    }
}
