package com.lox.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.lox.debug.Debug;
import com.lox.script.parser.Diagnostics.Diagnostic;

/**
 * Command-line driver.
 *
 * Usage: LoxCli [--json] [--debug] [--max-depth N] [script]
 *
 * Without a script it reads one line at a time from stdin, keeping globals
 * between lines.
 */
public final class LoxCli {

    public static final int EXIT_USAGE = 64;
    public static final int EXIT_DATA_ERROR = 65;
    public static final int EXIT_SOFTWARE = 70;
    public static final int EXIT_IO = 74;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        boolean json = false;
        String scriptArg = null;
        LoxScript engine = new LoxScript();

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if ("--json".equals(a)) {
                json = true;
            } else if ("--debug".equals(a)) {
                Debug.useSysOut();
            } else if ("--max-depth".equals(a) && i + 1 < args.length) {
                try {
                    engine.setMaxCallDepth(Integer.parseInt(args[++i]));
                } catch (IllegalArgumentException e) {
                    System.err.println("Invalid --max-depth: " + args[i]);
                    return EXIT_USAGE;
                }
            } else if (scriptArg == null && !a.startsWith("--")) {
                scriptArg = a;
            } else {
                return usage();
            }
        }

        if (scriptArg == null) {
            return runPrompt(engine);
        }

        final Path scriptPath = Path.of(scriptArg);
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read script file: " + scriptPath);
            Debug.get().e("LoxCli", "read failed: " + scriptPath, e);
            return EXIT_IO;
        }

        if (json) engine.setPrinter(null);
        RunResult result = engine.run(script);

        if (json) {
            System.out.println(DiagnosticsJson.toJson(result));
        } else {
            report(result);
        }

        if (result.hadError()) return EXIT_DATA_ERROR;
        if (result.hadRuntimeError()) return EXIT_SOFTWARE;
        return 0;
    }

    private static int runPrompt(LoxScript engine) {
        LoxScript.Session session = engine.newSession();
        Debug.get().i("LoxCli", "interactive session, max call depth " + engine.getMaxCallDepth());
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            while (true) {
                System.out.print("> ");
                System.out.flush();
                String line = stdin.readLine();
                if (line == null) break;
                // each line gets fresh diagnostics, so one typo does not end the session
                report(session.run(line));
            }
        } catch (IOException e) {
            System.err.println("Failed to read from stdin: " + e.getMessage());
            return EXIT_IO;
        }
        return 0;
    }

    private static void report(RunResult result) {
        for (Diagnostic d : result.diagnostics().all()) {
            System.err.println(d);
        }
    }

    private static int usage() {
        System.err.println("Usage: LoxCli [--json] [--debug] [--max-depth N] [script]");
        return EXIT_USAGE;
    }

    private LoxCli() {}
}
