package com.lox.script.parser;

import java.util.List;

import com.lox.script.LoxScript.BuiltinFunction;

/** Host-provided function with a fixed arity. */
public final class NativeFunction implements Callable {
    private final String name;
    private final int arity;
    private final BuiltinFunction body;

    public NativeFunction(String name, int arity, BuiltinFunction body) {
        this.name = name;
        this.arity = arity;
        this.body = body;
    }

    @Override
    public int arity() {
        return arity;
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> arguments) {
        Value out = body.call(arguments);
        return (out == null) ? Value.nil() : out;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "<native fn>";
    }
}
