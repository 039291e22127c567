package com.unnc.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.unnc.debug.Debug;
import com.unnc.script.UnncScript.BuiltinFunction;

/**
 * Program-wide registry shared by every case of a run: compiled algorithms, global variables,
 * the builtin table and named constants. Builtins and constants are fixed at construction.
 */
public class Environment {

    private final Map<String, AlgorithmDefinition> algorithms = new LinkedHashMap<>();
    private final Map<String, Value> globals = new LinkedHashMap<>();
    private final Map<String, BuiltinFunction> builtins;
    private final Map<String, Value> constants;

    public Environment(Map<String, BuiltinFunction> builtins, Map<String, Value> constants) {
        this.builtins = Collections.unmodifiableMap(new LinkedHashMap<>(builtins));
        this.constants = Collections.unmodifiableMap(new LinkedHashMap<>(constants));
    }

    // -------------------------
    // Algorithms
    // -------------------------

    /** Registers {@code def}; a later definition with the same name replaces the earlier one. */
    public void register(AlgorithmDefinition def) {
        AlgorithmDefinition previous = algorithms.put(def.name, def);
        if (previous != null) {
            Debug.get().w("unnc.compile", "Algorithm " + def.name + " redefined at line " + def.line
                    + " (previous definition at line " + previous.line + ")");
        }
    }

    public AlgorithmDefinition algorithm(String name) {
        return algorithms.get(name);
    }

    public boolean hasAlgorithm(String name) {
        return algorithms.containsKey(name);
    }

    public Set<String> algorithmNames() {
        return Collections.unmodifiableSet(algorithms.keySet());
    }

    // -------------------------
    // Globals
    // -------------------------

    public void setGlobal(String name, Value value) {
        globals.put(name, value);
    }

    public Value getGlobal(String name) {
        return globals.get(name);
    }

    // -------------------------
    // Builtins / constants
    // -------------------------

    public BuiltinFunction builtin(String name) {
        return builtins.get(name);
    }

    public Value constant(String name) {
        return constants.get(name);
    }
}
