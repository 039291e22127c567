package com.unnc.protocol;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.unnc.debug.Debug;
import com.unnc.script.UnncScript;
import com.unnc.script.error.UnncException;
import com.unnc.script.parser.Environment;
import com.unnc.script.parser.Value;

/**
 * Runs cases in order against one compiled {@link Environment}. A failing case records
 * {@code {"error": message}} in its slot and the batch carries on.
 */
public class BatchRunner {

    private static final String TAG = "unnc.batch";

    private final UnncScript engine;
    private final Environment env;
    private final ValueCodec codec;

    public BatchRunner(UnncScript engine, Environment env, ValueCodec codec) {
        this.engine = engine;
        this.env = env;
        this.codec = codec;
    }

    /** One result per case that produces output; successful assignments produce none. */
    public List<CaseResult> run(List<CaseSpec> cases) {
        List<CaseResult> out = new ArrayList<>();
        int n = 0;
        for (CaseSpec c : cases) {
            n++;
            CaseResult r = runOne(n, c);
            if (r != null) out.add(r);
        }
        return out;
    }

    /** Runs {@code c}; null when it is an assignment that succeeded. */
    public CaseResult runOne(int number, CaseSpec c) {
        try {
            switch (c.kind) {
                case ASSIGN:
                    engine.assignGlobal(c.variable, c.expression, env);
                    Debug.get().d(TAG, "case " + number + ": " + c.variable + " assigned");
                    return null;
                case EXPRESSION:
                    return success(number, engine.evaluate(c.expression, env));
                case INVOKE: {
                    if (c.algorithm == null) throw new IllegalArgumentException("Case has no 'algo'");
                    List<Value> args = new ArrayList<>(c.args.size());
                    for (JsonNode a : c.args) args.add(argument(a));
                    Value result = engine.execute(c.algorithm, args, env);
                    if (c.store != null && !c.store.isEmpty()) env.setGlobal(c.store, result);
                    return success(number, result);
                }
                default:
                    throw new IllegalArgumentException(c.problem);
            }
        } catch (StackOverflowError e) {
            return failure(number, c, "maximum recursion depth exceeded", e);
        } catch (RuntimeException e) {
            String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return failure(number, c, msg.replace('\n', ' '), e);
        }
    }

    /** Top-level strings are tried as expressions over the globals, else kept as strings. */
    private Value argument(JsonNode a) {
        if (a.isTextual()) {
            try {
                return engine.evaluate(a.textValue(), env);
            } catch (UnncException e) {
                return Value.string(a.textValue());
            }
        }
        return codec.decode(a);
    }

    private CaseResult success(int number, Value v) {
        Debug.get().d(TAG, "case " + number + " ok");
        return CaseResult.success(v, codec.encode(v));
    }

    private CaseResult failure(int number, CaseSpec c, String message, Throwable error) {
        Debug.get().e(TAG, "case " + number + " (" + c + ") failed: " + message, error);
        return CaseResult.failure(message);
    }
}
