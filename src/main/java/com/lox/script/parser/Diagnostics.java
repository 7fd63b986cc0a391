package com.lox.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates diagnostics for one run. Never aborts anything by itself:
 * the caller checks {@link #hasErrors()} between stages.
 */
public class Diagnostics {

    public enum Phase { LEXICAL, SYNTAX, SEMANTIC, RUNTIME }

    public static final class Diagnostic {
        public final Phase phase;
        public final int line;
        /** Location hint such as " at 'x'" or " at end"; empty when unknown. */
        public final String where;
        public final String message;

        public Diagnostic(Phase phase, int line, String where, String message) {
            this.phase = phase;
            this.line = line;
            this.where = (where == null) ? "" : where;
            this.message = message;
        }

        @Override
        public String toString() {
            if (phase == Phase.RUNTIME) {
                return message + "\n[line " + line + "]";
            }
            return "[line " + line + "] Error" + where + ": " + message;
        }
    }

    private final List<Diagnostic> entries = new ArrayList<>();

    public void report(Phase phase, int line, String message) {
        report(phase, line, "", message);
    }

    public void report(Phase phase, int line, String where, String message) {
        entries.add(new Diagnostic(phase, line, where, message));
    }

    /** Reports against a token, deriving the location hint from it. */
    public void report(Phase phase, Token token, String message) {
        if (token.type == TokenType.EOF) {
            report(phase, token.line, " at end", message);
        } else {
            report(phase, token.line, " at '" + token.lexeme + "'", message);
        }
    }

    public boolean hasErrors() {
        return !entries.isEmpty();
    }

    public boolean has(Phase phase) {
        for (Diagnostic d : entries) {
            if (d.phase == phase) return true;
        }
        return false;
    }

    public List<Diagnostic> all() {
        return Collections.unmodifiableList(entries);
    }
}
