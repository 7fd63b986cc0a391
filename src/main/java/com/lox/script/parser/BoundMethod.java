package com.lox.script.parser;

import java.util.List;

/** A method fetched from an instance; its function already sees 'this'. */
public final class BoundMethod implements Callable {
    final ClassInstance receiver;
    final UserFunction function;

    BoundMethod(ClassInstance receiver, UserFunction function) {
        this.receiver = receiver;
        this.function = function;
    }

    @Override
    public int arity() {
        return function.arity();
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> arguments) {
        return function.call(interpreter, arguments);
    }

    @Override
    public String name() {
        return receiver.klass.name + "." + function.name();
    }

    @Override
    public String toString() {
        return function.toString();
    }
}
