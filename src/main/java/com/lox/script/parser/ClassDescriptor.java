package com.lox.script.parser;

import java.util.List;
import java.util.Map;

/** A script class. Calling it allocates an instance and runs 'init' if present. */
public final class ClassDescriptor implements Callable {
    static final String INITIALIZER = "init";

    public final String name;
    public final ClassDescriptor superclass; // may be null
    private final Map<String, UserFunction> methods;

    ClassDescriptor(String name, ClassDescriptor superclass, Map<String, UserFunction> methods) {
        this.name = name;
        this.superclass = superclass;
        this.methods = methods;
    }

    /** Looks in this class first, then up the superclass chain. */
    UserFunction findMethod(String methodName) {
        UserFunction method = methods.get(methodName);
        if (method != null) return method;
        if (superclass != null) return superclass.findMethod(methodName);
        return null;
    }

    public boolean hasMethod(String methodName) {
        return findMethod(methodName) != null;
    }

    @Override
    public int arity() {
        UserFunction initializer = findMethod(INITIALIZER);
        return (initializer == null) ? 0 : initializer.arity();
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> arguments) {
        ClassInstance instance = new ClassInstance(this);
        UserFunction initializer = findMethod(INITIALIZER);
        if (initializer != null) {
            initializer.bind(instance).call(interpreter, arguments);
        }
        return Value.instance(instance);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
