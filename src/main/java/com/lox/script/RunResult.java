package com.lox.script;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.lox.script.parser.Diagnostics;
import com.lox.script.parser.Diagnostics.Phase;
import com.lox.script.parser.Value;

public class RunResult {
    private final Map<String, Value> globals;
    private final List<String> output;
    private final Diagnostics diagnostics;

    public RunResult(Map<String, Value> globals, List<String> output, Diagnostics diagnostics) {
        this.globals = globals;
        this.output = Collections.unmodifiableList(output);
        this.diagnostics = diagnostics;
    }

    /** Global bindings after the run, natives included. */
    public Map<String, Value> globals() { return globals; }

    /** Lines written by 'print', in order. */
    public List<String> output() { return output; }

    public Diagnostics diagnostics() { return diagnostics; }

    /** A lexical, syntax or semantic error kept the program from running. */
    public boolean hadError() {
        return diagnostics.has(Phase.LEXICAL) || diagnostics.has(Phase.SYNTAX) || diagnostics.has(Phase.SEMANTIC);
    }

    public boolean hadRuntimeError() {
        return diagnostics.has(Phase.RUNTIME);
    }
}
