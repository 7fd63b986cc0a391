package com.lox.script.parser;

/**
 * How a statement finished. RETURN travels up to the call that created the
 * frame, BREAK to the innermost loop; everything else completes NORMAL.
 */
public final class Completion {

    public enum Kind { NORMAL, RETURN, BREAK }

    static final Completion NORMAL = new Completion(Kind.NORMAL, null);
    static final Completion BREAK = new Completion(Kind.BREAK, null);

    public final Kind kind;
    public final Value value; // only set for RETURN

    private Completion(Kind kind, Value value) {
        this.kind = kind;
        this.value = value;
    }

    static Completion returning(Value value) {
        return new Completion(Kind.RETURN, value);
    }

    boolean isNormal() {
        return kind == Kind.NORMAL;
    }
}
