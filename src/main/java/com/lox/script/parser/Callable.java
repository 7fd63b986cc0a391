package com.lox.script.parser;

import java.util.List;

/** Anything a call expression can invoke: natives, functions, bound methods, classes. */
public interface Callable {
    int arity();

    /** Called with exactly {@link #arity()} arguments; the interpreter checks the count first. */
    Value call(Interpreter interpreter, List<Value> arguments);

    /** Name used in call frames and stack traces. */
    String name();
}
