package com.unnc.script.parser;

import java.util.List;

import com.unnc.script.error.ArityException;
import com.unnc.script.parser.Interpreter.ReturnSignal;
import com.unnc.script.parser.Statement.Block;
import com.unnc.script.parser.Statement.Stmt;

/** One compiled {@code Algorithm Name(p1, ..., pn)} block. Immutable once registered. */
public class AlgorithmDefinition {
    public final String name;
    public final List<String> parameters;
    public final List<SourceLine> bodyLines;
    final Block body;
    /** Line of the header in the source text. */
    public final int line;

    AlgorithmDefinition(String name, List<String> parameters, List<SourceLine> bodyLines, Block body, int line) {
        this.name = name;
        this.parameters = parameters;
        this.bodyLines = bodyLines;
        this.body = body;
        this.line = line;
    }

    /**
     * Runs the body in a fresh frame chained to {@code callerScope}: parameters are bound
     * locally, the caller's bindings stay readable, writes never reach the caller.
     */
    Value call(Interpreter interpreter, List<Value> args, int callerScope) {
        if (args.size() != parameters.size()) {
            throw new ArityException(name, parameters.size(), args.size());
        }

        ScopeArena arena = interpreter.arena;
        int frame = arena.push(callerScope);
        for (int i = 0; i < parameters.size(); i++) {
            arena.bind(frame, parameters.get(i), args.get(i));
        }

        int previous = interpreter.scope;
        interpreter.scope = frame;
        interpreter.callStack.push(new CallFrame(name, args));
        try {
            try {
                for (Stmt s : body.statements) s.accept(interpreter);
            } catch (ReturnSignal rs) {
                return rs.value;
            }
            return Value.none();
        } catch (RuntimeException e) {
            interpreter.noteFailure();
            throw e;
        } finally {
            interpreter.callStack.pop();
            interpreter.scope = previous;
            arena.release(frame);
        }
    }

    @Override
    public String toString() {
        return name + "(" + String.join(", ", parameters) + ")";
    }
}
