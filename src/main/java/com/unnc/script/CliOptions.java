package com.unnc.script;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.unnc.debug.Debug;
import com.unnc.debug.DebugLevel;

/**
 * Command-line flags of {@link UnncCli}:
 *
 * <pre>
 *   --src=algorithm.txt       pseudocode source
 *   --in=input.in             case listing (alias --input)
 *   --out=output.out          result file
 *   --exec='Sum: [1,2]'       one case; repeatable, replaces --in
 *   --generate                also write case_N.json next to the output
 *   --log=WARN | --verbose    stderr log threshold
 * </pre>
 *
 * Both {@code --flag=value} and {@code --flag value} are accepted.
 */
public final class CliOptions {

    private static final Set<String> VALUED = Set.of("src", "in", "input", "out", "exec", "log");
    private static final Set<String> SWITCHES = Set.of("generate", "verbose");

    public Path src = Path.of("algorithm.txt");
    public Path input = Path.of("input.in");
    public Path out = Path.of("output.out");
    public List<String> execs = new ArrayList<>();
    public boolean generate = false;
    public DebugLevel logLevel = DebugLevel.WARN;

    /** @throws IllegalArgumentException on a valued flag without a value */
    public static CliOptions parse(String[] args) {
        CliOptions o = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (!a.startsWith("--")) {
                Debug.get().w("unnc.cli", "ignoring argument " + a);
                continue;
            }
            String key;
            String value = null;
            int eq = a.indexOf('=');
            if (eq >= 0) {
                key = a.substring(2, eq);
                value = a.substring(eq + 1);
            } else {
                key = a.substring(2);
            }

            if (SWITCHES.contains(key)) {
                boolean on = value == null || Boolean.parseBoolean(value);
                if (key.equals("generate")) o.generate = on;
                else if (on) o.logLevel = DebugLevel.DEBUG;
                continue;
            }
            if (!VALUED.contains(key)) {
                Debug.get().w("unnc.cli", "ignoring unknown flag --" + key);
                continue;
            }
            if (value == null) {
                if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
                    throw new IllegalArgumentException("--" + key + " requires a value");
                }
                value = args[++i];
            }
            switch (key) {
                case "src": o.src = Path.of(value); break;
                case "in":
                case "input": o.input = Path.of(value); break;
                case "out": o.out = Path.of(value); break;
                case "exec": o.execs.add(value); break;
                case "log": o.logLevel = DebugLevel.parse(value, o.logLevel); break;
                default: break;
            }
        }
        o.execs = Collections.unmodifiableList(o.execs);
        return o;
    }

    static String usage() {
        return "Usage: UnncCli [--src=FILE] [--in=FILE] [--out=FILE] [--exec=CASE]... [--generate] [--log=LEVEL|--verbose]";
    }
}
