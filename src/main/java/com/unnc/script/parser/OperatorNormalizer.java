package com.unnc.script.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites the surface spellings of pseudocode operators into the canonical forms the
 * {@link Lexer} understands. Quoted string contents are left untouched.
 *
 * <pre>
 *   mod            -> %
 *   AND, and, &&   -> &&
 *   OR, or, ||     -> ||
 *   NOT, not       -> !
 *   ×, X           -> *
 *   ≤ ≥ ≠          -> <= >= !=
 *   ;              -> (removed)
 * </pre>
 *
 * Word operators only match as whole words, so identifiers such as {@code model} or
 * {@code Xs} survive.
 */
public final class OperatorNormalizer {

    private static final Pattern MOD = Pattern.compile("\\bmod\\b");
    private static final Pattern AND = Pattern.compile("\\b(?:AND|and)\\b");
    private static final Pattern OR = Pattern.compile("\\b(?:OR|or)\\b");
    private static final Pattern NOT = Pattern.compile("\\b(?:NOT|not)\\b");
    private static final Pattern TIMES_X = Pattern.compile("\\bX\\b");

    private OperatorNormalizer() {}

    public static String normalize(String text) {
        if (text == null) return "";
        StringBuilder out = new StringBuilder(text.length());
        StringBuilder plain = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                int close = text.indexOf(c, i + 1);
                if (close < 0) {
                    // unterminated: leave the rest for the lexer to reject
                    plain.append(text, i, text.length());
                    break;
                }
                out.append(rewrite(plain.toString()));
                plain.setLength(0);
                out.append(text, i, close + 1);
                i = close + 1;
                continue;
            }
            plain.append(c);
            i++;
        }
        out.append(rewrite(plain.toString()));
        return out.toString().trim();
    }

    private static String rewrite(String s) {
        if (s.isEmpty()) return s;
        String r = replace(MOD, s, "%");
        r = replace(AND, r, "&&");
        r = replace(OR, r, "||");
        r = replace(NOT, r, "!");
        r = r.replace("×", "*");
        r = replace(TIMES_X, r, "*");
        r = r.replace("≤", "<=").replace("≥", ">=").replace("≠", "!=");
        r = r.replace(";", "");
        return r;
    }

    private static String replace(Pattern p, String s, String replacement) {
        Matcher m = p.matcher(s);
        return m.find() ? m.replaceAll(Matcher.quoteReplacement(replacement)) : s;
    }
}
