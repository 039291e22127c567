package com.unnc.script.parser;

import java.util.List;

import com.unnc.script.parser.Expr.ExprInterface;

/**
 * Compiled form of one expression text. Which form a text compiles to is decided syntactically by
 * {@link ExpressionCompiler}; {@link ExpressionEvaluator} resolves it at run time.
 */
public abstract class Resolvable {
    /** The expression as written (trimmed). */
    public final String text;

    private Resolvable(String text) {
        this.text = text;
    }

    @Override
    public String toString() {
        return text;
    }

    /** {@code name(arg, ...)} spanning the whole text. */
    public static final class Call extends Resolvable {
        public final String name;
        public final List<Resolvable> arguments;

        Call(String text, String name, List<Resolvable> arguments) {
            super(text);
            this.name = name;
            this.arguments = arguments;
        }
    }

    public static final class Literal extends Resolvable {
        public final Value value;

        Literal(String text, Value value) {
            super(text);
            this.value = value;
        }
    }

    /** A bare identifier: local, then global, then the fallback path. */
    public static final class Name extends Resolvable {
        public final String name;
        public final Fallback fallback;

        Name(String text, Fallback fallback) {
            super(text);
            this.name = text;
            this.fallback = fallback;
        }
    }

    /**
     * Anything else. Holds the parsed tree, or the syntax error that parsing produced; the error
     * is raised only when the expression is actually evaluated.
     */
    public static final class Fallback extends Resolvable {
        public final String normalized;
        public final ExprInterface tree;
        public final RuntimeException syntaxError;

        Fallback(String text, String normalized, ExprInterface tree, RuntimeException syntaxError) {
            super(text);
            this.normalized = normalized;
            this.tree = tree;
            this.syntaxError = syntaxError;
        }

        public boolean isValid() {
            return syntaxError == null;
        }
    }
}
