package com.unnc.script;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.unnc.debug.Debug;
import com.unnc.protocol.BatchRunner;
import com.unnc.protocol.CaseLoader;
import com.unnc.protocol.CaseResult;
import com.unnc.protocol.CaseSpec;
import com.unnc.protocol.OutputWriter;
import com.unnc.protocol.ValueCodec;
import com.unnc.script.error.CompilationException;
import com.unnc.script.parser.Environment;

/**
 * Compiles a pseudocode file and runs a batch of cases against it.
 *
 * Usage:
 *   java com.unnc.script.UnncCli --src=algorithm.txt --in=input.in --out=output.out
 *   java com.unnc.script.UnncCli --src=algorithm.txt --exec='Reverse: [1, 2, 3]'
 *
 * Exit codes: 0 ok, 2 usage, 3 unreadable source, 1 compile error, 4 output not written.
 */
public final class UnncCli {

    private static final String TAG = "unnc.cli";

    public static void main(String[] args) {
        int code = run(args, System.err);
        if (code != 0) System.exit(code);
    }

    public static int run(String[] args, PrintStream err) {
        CliOptions opts;
        try {
            opts = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CliOptions.usage());
            return 2;
        }
        Debug.get().setSink(Debug.printing(err, opts.logLevel));

        String source;
        try {
            source = Files.readString(opts.src, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read source: " + opts.src);
            return 3;
        }

        UnncScript engine = new UnncScript();
        Environment env;
        try {
            env = engine.compile(source);
        } catch (CompilationException e) {
            err.println("Error compiling " + opts.src + ": " + e.getMessage());
            return 1;
        }
        Debug.get().i(TAG, "compiled " + env.algorithmNames().size() + " algorithms from " + opts.src);

        ObjectMapper om = new ObjectMapper();
        CaseLoader loader = new CaseLoader(om);
        List<CaseSpec> cases = new ArrayList<>();
        if (!opts.execs.isEmpty()) {
            for (String e : opts.execs) {
                CaseSpec c = loader.parseExec(e);
                if (c != null) cases.add(c);
            }
        } else {
            try {
                cases.addAll(loader.loadFile(opts.input));
            } catch (IOException e) {
                err.println("Failed to read input: " + opts.input);
                return 3;
            }
        }
        if (cases.isEmpty()) {
            Debug.get().i(TAG, "no cases to run");
            return 0;
        }

        if (opts.generate) {
            try {
                writeCaseFiles(om, cases, opts.out);
            } catch (IOException e) {
                err.println("Failed to write case files: " + e.getMessage());
                return 4;
            }
        }

        List<CaseResult> results = new BatchRunner(engine, env, new ValueCodec(om)).run(cases);
        try {
            new OutputWriter(om).write(results, opts.out);
        } catch (IOException e) {
            err.println("Failed to write output file: " + opts.out);
            return 4;
        }
        Debug.get().i(TAG, results.size() + " results written to " + opts.out);
        return 0;
    }

    /** Writes case_1.json, case_2.json, ... next to {@code out}. */
    static List<Path> writeCaseFiles(ObjectMapper om, List<CaseSpec> cases, Path out) throws IOException {
        Path dir = out.toAbsolutePath().getParent();
        List<Path> written = new ArrayList<>();
        for (int i = 0; i < cases.size(); i++) {
            Path p = dir.resolve("case_" + (i + 1) + ".json");
            Files.writeString(p, om.writerWithDefaultPrettyPrinter().writeValueAsString(cases.get(i).toJson()),
                    StandardCharsets.UTF_8);
            written.add(p);
        }
        Debug.get().i(TAG, "wrote " + written.size() + " case files to " + dir);
        return written;
    }

    private UnncCli() {}
}
