package com.unnc.script;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.unnc.script.data.PersistentList;
import com.unnc.script.data.PersistentTree;
import com.unnc.script.error.ArityException;
import com.unnc.script.error.CompilationException;
import com.unnc.script.error.StructuralTypeException;
import com.unnc.script.parser.BlockCompiler;
import com.unnc.script.parser.Environment;
import com.unnc.script.parser.Interpreter;
import com.unnc.script.parser.Value;

/**
 * Entry point of the pseudocode engine.
 *
 * Language surface:
 * - Algorithms: {@code Algorithm: Name(p1, p2)} followed by body lines
 * - Optional {@code Step N:} labels, {@code Requires}/{@code Returns} lines are ignored
 * - Statements: let / {@code ←} / bare assignment, return, if/elseif/else/endif,
 *   while/endwhile, for-from-to and for-in with endfor
 * - Values: integers, floats, strings, booleans, persistent lists and trees
 * - Built-ins (registered via registerFunction): Nil, cons, isEmpty, value, tail, merge,
 *   node, isLeaf, root, left, right, size; {@code leaf} is a constant
 *
 * A compiled {@link Environment} is the handle every execution runs against; nothing is kept in
 * static state.
 */
public class UnncScript {

    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private static final Pattern ASSIGNMENT_TARGET = Pattern.compile("[A-Za-z_]\\w*");

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();
    private final Map<String, Value> constants = new LinkedHashMap<>();

    public UnncScript() {
        registerCoreBuiltins();
    }

    public void registerFunction(String name, BuiltinFunction fn) { functions.put(name, fn); }

    /** Compiles every {@code Algorithm} block of {@code source}. */
    public Environment compile(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        Environment env = new Environment(functions, constants);
        new BlockCompiler().compile(source, env);
        return env;
    }

    public Value execute(String algorithm, List<Value> args, Environment env) {
        return new Interpreter(env).invoke(algorithm, args);
    }

    /** Evaluates {@code expression} at top level: globals are visible, no locals. */
    public Value evaluate(String expression, Environment env) {
        return new Interpreter(env).evaluate(expression);
    }

    /** Evaluates {@code expression} and stores the result as global {@code name}. */
    public Value assignGlobal(String name, String expression, Environment env) {
        Matcher m = ASSIGNMENT_TARGET.matcher(name == null ? "" : name.trim());
        if (!m.matches()) throw new CompilationException("Invalid assignment target '" + name + "'", 0);
        Value v = evaluate(expression, env);
        env.setGlobal(m.group(), v);
        return v;
    }

    /** Compile and run in one step. */
    public Value run(String source, String algorithm, List<Value> args) {
        return execute(algorithm, args, compile(source));
    }

    // ===================== BUILTINS =====================

    private void registerCoreBuiltins() {
        constants.put("leaf", Value.leaf());
        constants.put("Nil", Value.emptyList());

        registerFunction("Nil", args -> {
            requireArgCount("Nil", args, 0);
            return Value.emptyList();
        });

        registerFunction("cons", args -> {
            requireArgCount("cons", args, 2);
            return Value.list(list("cons", args.get(1)).cons(args.get(0)));
        });

        registerFunction("isEmpty", args -> {
            requireArgCount("isEmpty", args, 1);
            return Value.bool(args.get(0).isEmptyList());
        });

        registerFunction("value", args -> {
            requireArgCount("value", args, 1);
            return list("value", args.get(0)).value();
        });

        registerFunction("tail", args -> {
            requireArgCount("tail", args, 1);
            return Value.list(list("tail", args.get(0)).tail());
        });

        registerFunction("merge", args -> {
            requireArgCount("merge", args, 2);
            PersistentList<Value> first = list("merge", args.get(0));
            PersistentList<Value> second = list("merge", args.get(1));
            return Value.list(first.merge(second));
        });

        registerFunction("node", args -> {
            requireArgCount("node", args, 3);
            PersistentTree<Value> l = tree("node", args.get(0));
            PersistentTree<Value> r = tree("node", args.get(2));
            return Value.tree(PersistentTree.node(l, args.get(1), r));
        });

        registerFunction("isLeaf", args -> {
            requireArgCount("isLeaf", args, 1);
            return Value.bool(args.get(0).isLeaf());
        });

        registerFunction("root", args -> {
            requireArgCount("root", args, 1);
            return tree("root", args.get(0)).root();
        });

        registerFunction("left", args -> {
            requireArgCount("left", args, 1);
            return Value.tree(tree("left", args.get(0)).left());
        });

        registerFunction("right", args -> {
            requireArgCount("right", args, 1);
            return Value.tree(tree("right", args.get(0)).right());
        });

        registerFunction("size", args -> {
            requireArgCount("size", args, 1);
            return Value.integer(tree("size", args.get(0)).size());
        });
    }

    private static PersistentList<Value> list(String fn, Value v) {
        if (!v.isList()) throw new StructuralTypeException(fn + " expects a list, got " + v.describe());
        return v.asList();
    }

    private static PersistentTree<Value> tree(String fn, Value v) {
        if (!v.isTree()) throw new StructuralTypeException(fn + " expects a tree, got " + v.describe());
        return v.asTree();
    }

    private static void requireArgCount(String name, List<Value> args, int expected) {
        if (args.size() != expected) {
            throw new ArityException(name, expected, args.size());
        }
    }
}
