package com.lox.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime object. Shared by reference: every holder sees the same fields.
 */
public final class ClassInstance {
    final ClassDescriptor klass;
    private final Map<String, Value> fields = new LinkedHashMap<>();

    ClassInstance(ClassDescriptor klass) {
        this.klass = klass;
    }

    public ClassDescriptor klass() {
        return klass;
    }

    /** Fields shadow methods. */
    Value get(Token name) {
        Value field = fields.get(name.lexeme);
        if (field != null) return field;

        UserFunction method = klass.findMethod(name.lexeme);
        if (method != null) return Value.callable(method.bind(this));

        throw new RuntimeError(name, "Undefined property '" + name.lexeme + "'.");
    }

    void set(Token name, Value value) {
        fields.put(name.lexeme, value);
    }

    public Map<String, Value> fields() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public String toString() {
        return klass.name + " instance";
    }
}
