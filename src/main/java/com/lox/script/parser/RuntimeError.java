package com.lox.script.parser;

import java.util.Collections;
import java.util.List;

/** A runtime failure in script code. Aborts the current run; never the host. */
public class RuntimeError extends RuntimeException {
    public final Token token;
    private List<String> frames = Collections.emptyList();

    public RuntimeError(Token token, String message) {
        super(message);
        this.token = token;
    }

    /** Script call stack at the point of failure, innermost first. */
    public List<String> frames() {
        return frames;
    }

    void recordFrames(List<String> trace) {
        // the innermost call sees the deepest stack; outer calls must not overwrite it
        if (frames.isEmpty()) frames = Collections.unmodifiableList(trace);
    }

    public int line() {
        return (token == null) ? 0 : token.line;
    }
}
