package com.unnc.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.unnc.debug.Debug;
import com.unnc.script.error.EvaluationException;
import com.unnc.script.error.NameResolutionException;
import com.unnc.script.error.UnncException;
import com.unnc.script.parser.Statement.Block;
import com.unnc.script.parser.Statement.Branch;
import com.unnc.script.parser.Statement.ExprStmt;
import com.unnc.script.parser.Statement.ForEach;
import com.unnc.script.parser.Statement.ForRange;
import com.unnc.script.parser.Statement.If;
import com.unnc.script.parser.Statement.Let;
import com.unnc.script.parser.Statement.ReturnStmt;
import com.unnc.script.parser.Statement.Stmt;
import com.unnc.script.parser.Statement.StmtVisitor;
import com.unnc.script.parser.Statement.While;

/**
 * Walks compiled algorithm bodies. One interpreter serves one case execution: it owns the scope
 * arena and call stack, and reads the shared {@link Environment}.
 */
public class Interpreter implements StmtVisitor {

    private static final String TAG = "unnc.exec";

    final Environment environment;
    final ScopeArena arena = new ScopeArena();
    final Deque<CallFrame> callStack = new ArrayDeque<>();
    final ExpressionEvaluator evaluator;

    /** Scope frame statements currently read and write. */
    int scope = ScopeArena.NO_FRAME;

    private List<String> failureTrace;

    public Interpreter(Environment environment) {
        this.environment = environment;
        this.evaluator = new ExpressionEvaluator(this);
    }

    // ===================== DRIVER =====================

    /**
     * Invokes algorithm {@code name}. The callee can read every binding visible from
     * {@code callerScope} but writes only to its own frame.
     */
    public Value invoke(String name, List<Value> args, int callerScope) {
        AlgorithmDefinition def = environment.algorithm(name);
        if (def == null) throw NameResolutionException.unknownAlgorithm(name);
        Debug.get().t(TAG, "enter " + name + " (" + args.size() + " args, depth " + callStack.size() + ")");
        return def.call(this, args, callerScope);
    }

    /** Top-level entry: no caller bindings beyond the globals. */
    public Value invoke(String name, List<Value> args) {
        failureTrace = null;
        try {
            return invoke(name, args, ScopeArena.NO_FRAME);
        } catch (UnncException e) {
            if (failureTrace != null) {
                Debug.get().d(TAG, name + " failed in " + String.join(" <- ", failureTrace) + ": " + e.getMessage());
            }
            throw e;
        }
    }

    /** Evaluates {@code expression} in an empty top-level frame. */
    public Value evaluate(String expression) {
        Resolvable compiled = ExpressionCompiler.compile(expression);
        int frame = arena.push(ScopeArena.NO_FRAME);
        int previous = scope;
        scope = frame;
        try {
            return evaluator.evaluate(compiled);
        } finally {
            scope = previous;
            arena.release(frame);
        }
    }

    /** Records the executing chain when a failure first leaves an invocation. */
    void noteFailure() {
        if (failureTrace == null) failureTrace = stackTrace();
    }

    /** Names of the algorithms currently executing, innermost first. */
    public List<String> stackTrace() {
        List<String> out = new ArrayList<>();
        for (CallFrame f : callStack) out.add(f.algorithmName);
        return out;
    }

    // ===================== STATEMENTS =====================

    @Override
    public void visitBlockStmt(Block stmt) {
        for (Stmt s : stmt.statements) s.accept(this);
    }

    @Override
    public void visitIfStmt(If stmt) {
        for (Branch branch : stmt.branches) {
            if (evaluator.evaluate(branch.condition).isTruthy()) {
                branch.body.accept(this);
                return;
            }
        }
        if (stmt.elseBranch != null) stmt.elseBranch.accept(this);
    }

    @Override
    public void visitWhileStmt(While stmt) {
        while (evaluator.evaluate(stmt.condition).isTruthy()) {
            stmt.body.accept(this);
        }
    }

    @Override
    public void visitForRangeStmt(ForRange stmt) {
        long from = bound(stmt.from);
        long to = bound(stmt.to);
        for (long i = from; i <= to; i++) {
            arena.bind(scope, stmt.variable, Value.integer(i));
            stmt.body.accept(this);
            if (i == Long.MAX_VALUE) break;
        }
    }

    @Override
    public void visitForEachStmt(ForEach stmt) {
        Value collection = evaluator.evaluate(stmt.collection);
        if (collection.isList()) {
            for (Value item : collection.asList()) {
                arena.bind(scope, stmt.variable, item);
                stmt.body.accept(this);
            }
        } else {
            // a non-list runs the body once with the value itself
            arena.bind(scope, stmt.variable, collection);
            stmt.body.accept(this);
        }
    }

    @Override
    public void visitLetStmt(Let stmt) {
        arena.bind(scope, stmt.name, evaluator.evaluate(stmt.value));
    }

    @Override
    public void visitReturnStmt(ReturnStmt stmt) {
        Value value = stmt.value == null ? Value.none() : evaluator.evaluate(stmt.value);
        throw new ReturnSignal(value);
    }

    @Override
    public void visitExprStmt(ExprStmt stmt) {
        try {
            evaluator.evaluate(stmt.expression);
        } catch (EvaluationException e) {
            failureTrace = null;
            String where = callStack.isEmpty() ? "" : callStack.peek().algorithmName + " ";
            Debug.get().d(TAG, where + "line " + stmt.line() + " skipped: " + e.getMessage());
        }
    }

    private long bound(Resolvable expr) {
        Value v = evaluator.evaluate(expr);
        switch (v.type) {
            case INT:
                return v.asInt();
            case BOOL:
                return v.asBool() ? 1 : 0;
            case FLOAT:
                return (long) v.asDouble();
            case STRING:
                try {
                    return Long.parseLong(v.asString().trim());
                } catch (NumberFormatException e) {
                    throw new EvaluationException(expr.text, OperatorNormalizer.normalize(expr.text), e);
                }
            default:
                throw new EvaluationException(expr.text, OperatorNormalizer.normalize(expr.text),
                        new IllegalArgumentException("for-range bound must be a number, got " + v.describe()));
        }
    }

    public static final class ReturnSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        final Value value;
        ReturnSignal(Value value) { super(null, null, false, false); this.value = value; }
    }
}
