package com.lox.script.parser;

import java.util.List;

import com.lox.script.parser.Statement.FunctionStmt;

/** A function or method declared in script code, closed over its defining environment. */
public class UserFunction implements Callable {
    final FunctionStmt declaration;
    final Environment closure;
    final boolean isInitializer;

    UserFunction(FunctionStmt declaration, Environment closure, boolean isInitializer) {
        this.declaration = declaration;
        this.closure = closure;
        this.isInitializer = isInitializer;
    }

    @Override
    public int arity() {
        return declaration.params.size();
    }

    @Override
    public String name() {
        return declaration.name.lexeme;
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        // New call frame is a child of the closure (lexical scoping), not of the caller.
        Environment frame = closure.childScope();
        for (int i = 0; i < declaration.params.size(); i++) {
            frame.define(declaration.params.get(i).lexeme, args.get(i));
        }

        Completion completion = interpreter.executeBlock(declaration.body, frame);

        if (isInitializer) return closure.getAt(0, "this");
        if (completion.kind == Completion.Kind.RETURN) return completion.value;
        return Value.nil();
    }

    /** Binds 'this' in a scope between the closure and the call frame. */
    BoundMethod bind(ClassInstance instance) {
        Environment env = closure.childScope();
        env.define("this", Value.instance(instance));
        return new BoundMethod(instance, new UserFunction(declaration, env, isInitializer));
    }

    @Override
    public String toString() {
        return "<fn " + declaration.name.lexeme + ">";
    }
}
