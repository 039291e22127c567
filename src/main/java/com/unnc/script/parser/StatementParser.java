package com.unnc.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.unnc.debug.Debug;
import com.unnc.script.error.CompilationException;
import com.unnc.script.parser.Statement.Block;
import com.unnc.script.parser.Statement.Branch;
import com.unnc.script.parser.Statement.Stmt;

/**
 * Builds the statement tree of one algorithm body.
 *
 * <p>Lines are first split at inline block keywords ({@code if c then return 1 endif} becomes
 * three lines), then every piece is classified by its leading keyword and blocks are matched by
 * nesting depth. A construct whose terminator is missing extends to the end of the enclosing
 * block. Keywords are case-insensitive.
 */
public final class StatementParser {

    private static final String TAG = "unnc.compile";

    private enum Kind { IF, ELSEIF, ELSE, ENDIF, WHILE, ENDWHILE, FOR, ENDFOR, LET, ASSIGN, RETURN, EXPR }

    private static final Set<String> TERMINATOR_WORDS = Set.of("elseif", "else", "endif", "endwhile", "endfor");

    private static final Pattern FOR_RANGE =
            Pattern.compile("for\\s+([A-Za-z_]\\w*)\\s+from\\s+(.*?)\\s+to\\s+(.*?)(?:\\s+do)?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern FOR_EACH =
            Pattern.compile("for\\s+([A-Za-z_]\\w*)\\s+in\\s+(.*?)(?:\\s+do)?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern LET =
            Pattern.compile("let\\s+([A-Za-z_]\\w*)\\s*(?:=|←)\\s*(.*)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ARROW = Pattern.compile("([A-Za-z_]\\w*)\\s*←\\s*(.*)", Pattern.DOTALL);
    private static final Pattern ASSIGN = Pattern.compile("([A-Za-z_]\\w*)\\s*=(?!=)\\s*(.*)", Pattern.DOTALL);
    private static final Pattern TRAILING_THEN = Pattern.compile("(?:^|\\s+)then\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_DO = Pattern.compile("(?:^|\\s+)do\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ELSE_IF = Pattern.compile("else\\s+if\\b", Pattern.CASE_INSENSITIVE);

    private final String algorithm;
    private final List<SourceLine> lines;
    private int current = 0;

    private StatementParser(String algorithm, List<SourceLine> lines) {
        this.algorithm = algorithm;
        this.lines = lines;
    }

    /** Parses a body into its statement tree. */
    public static Block parse(String algorithm, List<SourceLine> body) {
        List<SourceLine> split = new ArrayList<>();
        for (SourceLine line : body) {
            for (String piece : splitInline(line.text)) {
                if (!piece.isEmpty()) split.add(new SourceLine(line.number, piece));
            }
        }
        StatementParser parser = new StatementParser(algorithm, split);
        int firstLine = body.isEmpty() ? 0 : body.get(0).number;
        return parser.block(firstLine, EnumSet.noneOf(Kind.class));
    }

    // ===================== BLOCK MATCHING =====================

    /** Statements up to (not including) the next line whose kind is in {@code stopAt}. */
    private Block block(int line, Set<Kind> stopAt) {
        List<Stmt> out = new ArrayList<>();
        while (!isAtEnd()) {
            Kind kind = classify(peek().text);
            if (stopAt.contains(kind)) break;
            out.add(statement(kind, stopAt));
        }
        return new Block(line, Collections.unmodifiableList(out));
    }

    private Stmt statement(Kind kind, Set<Kind> enclosing) {
        SourceLine line = advance();
        String text = line.text;
        switch (kind) {
            case IF:
                return ifStatement(line, enclosing);
            case WHILE: {
                Resolvable condition = condition(line, stripKeyword(text, 5), TRAILING_DO, "while");
                Block body = block(line.number, with(enclosing, Kind.ENDWHILE));
                expect(Kind.ENDWHILE, "while", line);
                return new Statement.While(line.number, condition, body);
            }
            case FOR:
                return forStatement(line, enclosing);
            case LET: {
                Matcher m = LET.matcher(text);
                if (!m.matches()) {
                    throw new CompilationException("Malformed let in " + algorithm + ": '" + text + "'", line.number);
                }
                return new Statement.Let(line.number, m.group(1), ExpressionCompiler.compile(m.group(2)));
            }
            case ASSIGN: {
                Matcher m = ARROW.matcher(text);
                if (!m.matches()) {
                    m = ASSIGN.matcher(text);
                    if (!m.matches()) {
                        throw new CompilationException("Malformed assignment in " + algorithm + ": '" + text + "'", line.number);
                    }
                }
                return new Statement.Let(line.number, m.group(1), ExpressionCompiler.compile(m.group(2)));
            }
            case RETURN: {
                String rest = stripKeyword(text, 6);
                Resolvable value = rest.isEmpty() ? null : ExpressionCompiler.compile(rest);
                return new Statement.ReturnStmt(line.number, value);
            }
            case ELSEIF:
            case ELSE:
            case ENDIF:
            case ENDWHILE:
            case ENDFOR:
                // no open construct owns it; it evaluates (and fails quietly) as an expression
                Debug.get().w(TAG, algorithm + " line " + line.number + ": unmatched '" + text + "'");
                return new Statement.ExprStmt(line.number, ExpressionCompiler.compile(text));
            default:
                return new Statement.ExprStmt(line.number, ExpressionCompiler.compile(text));
        }
    }

    private Stmt ifStatement(SourceLine line, Set<Kind> enclosing) {
        Set<Kind> stopAt = with(enclosing, Kind.ELSEIF, Kind.ELSE, Kind.ENDIF);
        List<Branch> branches = new ArrayList<>();

        Resolvable condition = condition(line, stripKeyword(line.text, 2), TRAILING_THEN, "if");
        branches.add(new Branch(condition, block(line.number, stopAt)));

        Block elseBranch = null;
        while (!isAtEnd()) {
            Kind next = classify(peek().text);
            if (next == Kind.ELSEIF && elseBranch == null) {
                SourceLine arm = advance();
                Resolvable c = condition(arm, stripElseIf(arm.text), TRAILING_THEN, "elseif");
                branches.add(new Branch(c, block(arm.number, stopAt)));
            } else if (next == Kind.ELSE && elseBranch == null) {
                SourceLine arm = advance();
                elseBranch = block(arm.number, with(enclosing, Kind.ENDIF));
            } else {
                break;
            }
        }
        expect(Kind.ENDIF, "if", line);
        return new Statement.If(line.number, Collections.unmodifiableList(branches), elseBranch);
    }

    private Stmt forStatement(SourceLine line, Set<Kind> enclosing) {
        String text = line.text;
        Matcher range = FOR_RANGE.matcher(text);
        Matcher each = FOR_EACH.matcher(text);
        Stmt result;
        if (range.matches()) {
            Block body = block(line.number, with(enclosing, Kind.ENDFOR));
            result = new Statement.ForRange(line.number, range.group(1),
                    ExpressionCompiler.compile(range.group(2)), ExpressionCompiler.compile(range.group(3)), body);
        } else if (each.matches()) {
            Block body = block(line.number, with(enclosing, Kind.ENDFOR));
            result = new Statement.ForEach(line.number, each.group(1), ExpressionCompiler.compile(each.group(2)), body);
        } else {
            throw new CompilationException("Malformed for loop in " + algorithm + ": '" + text + "'", line.number);
        }
        expect(Kind.ENDFOR, "for", line);
        return result;
    }

    private Resolvable condition(SourceLine line, String rest, Pattern trailing, String keyword) {
        String cond = trailing.matcher(rest).replaceFirst("").trim();
        if (cond.isEmpty()) {
            throw new CompilationException(keyword + " without a condition in " + algorithm, line.number);
        }
        return ExpressionCompiler.compile(cond);
    }

    private void expect(Kind terminator, String construct, SourceLine opener) {
        if (!isAtEnd() && classify(peek().text) == terminator) {
            advance();
            return;
        }
        Debug.get().w(TAG, algorithm + " line " + opener.number + ": " + construct
                + " block is not closed; it runs to the end of the enclosing block");
    }

    private static Set<Kind> with(Set<Kind> base, Kind... extra) {
        EnumSet<Kind> out = base.isEmpty() ? EnumSet.noneOf(Kind.class) : EnumSet.copyOf(base);
        Collections.addAll(out, extra);
        return out;
    }

    private boolean isAtEnd() { return current >= lines.size(); }
    private SourceLine peek() { return lines.get(current); }
    private SourceLine advance() { return lines.get(current++); }

    // ===================== CLASSIFICATION =====================

    private static Kind classify(String text) {
        String head = firstWord(text).toLowerCase(Locale.ROOT);
        switch (head) {
            case "if": return Kind.IF;
            case "elseif": return Kind.ELSEIF;
            case "else": return ELSE_IF.matcher(text).lookingAt() ? Kind.ELSEIF : Kind.ELSE;
            case "endif": return Kind.ENDIF;
            case "while": return Kind.WHILE;
            case "endwhile": return Kind.ENDWHILE;
            case "for": return Kind.FOR;
            case "endfor": return Kind.ENDFOR;
            case "let": return Kind.LET;
            case "return": return Kind.RETURN;
            default:
                break;
        }
        if (ARROW.matcher(text).matches() || ASSIGN.matcher(text).matches()) return Kind.ASSIGN;
        return Kind.EXPR;
    }

    private static String firstWord(String text) {
        int end = 0;
        while (end < text.length() && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_')) end++;
        return text.substring(0, end);
    }

    private static String stripKeyword(String text, int length) {
        return text.substring(length).trim();
    }

    private static String stripElseIf(String text) {
        Matcher m = ELSE_IF.matcher(text);
        if (m.lookingAt()) return text.substring(m.end()).trim();
        return stripKeyword(text, 6);
    }

    // ===================== INLINE SPLITTING =====================

    /**
     * Splits a physical line at inline block keywords. Keywords inside quotes or brackets are
     * never split points.
     */
    static List<String> splitInline(String line) {
        List<String> pieces = new ArrayList<>();
        String rest = line.trim();
        while (!rest.isEmpty()) {
            int cut = cutPoint(rest);
            if (cut <= 0 || cut >= rest.length()) {
                pieces.add(rest);
                break;
            }
            pieces.add(rest.substring(0, cut).trim());
            rest = rest.substring(cut).trim();
        }
        return pieces;
    }

    /** Where the first statement of {@code text} ends, or -1 if it spans the whole text. */
    private static int cutPoint(String text) {
        List<int[]> words = topLevelWords(text);
        if (words.isEmpty()) return -1;
        String head = word(text, words.get(0));

        int from = 1;
        String opener = null;
        if (head.equals("else") && words.size() > 1 && word(text, words.get(1)).equals("if")) {
            opener = "then";
            from = 2;
        } else if (head.equals("if") || head.equals("elseif")) {
            opener = "then";
        } else if (head.equals("while") || head.equals("for")) {
            opener = "do";
        } else if (TERMINATOR_WORDS.contains(head)) {
            // "else return 0" -> "else" | "return 0"
            int end = words.get(0)[1];
            return end < text.length() && !text.substring(end).trim().isEmpty() ? end : -1;
        }

        for (int i = from; i < words.size(); i++) {
            int[] w = words.get(i);
            String lw = word(text, w);
            if (opener != null && lw.equals(opener)) {
                return text.substring(w[1]).trim().isEmpty() ? -1 : w[1];
            }
            if (TERMINATOR_WORDS.contains(lw)) return w[0];
        }
        return -1;
    }

    private static String word(String text, int[] span) {
        return text.substring(span[0], span[1]).toLowerCase(Locale.ROOT);
    }

    /** Spans of identifier-like words at bracket depth 0 and outside quotes. */
    private static List<int[]> topLevelWords(String text) {
        List<int[]> out = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                i++;
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
                i++;
            } else if (c == '(' || c == '[') {
                depth++;
                i++;
            } else if (c == ')' || c == ']') {
                depth--;
                i++;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) i++;
                if (depth == 0) out.add(new int[] { start, i });
            } else if (Character.isDigit(c)) {
                while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) i++;
            } else {
                i++;
            }
        }
        return out;
    }
}
