package com.lox.script.parser;

import java.math.BigDecimal;

public class Value {
    public enum Type { NIL, BOOL, NUMBER, STRING, CALLABLE, INSTANCE }

    private static final Value NIL = new Value(Type.NIL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value nil() { return NIL; }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value callable(Callable c) { return new Value(Type.CALLABLE, c); }
    public static Value instance(ClassInstance i) { return new Value(Type.INSTANCE, i); }

    public Type getType() { return type; }

    public boolean isNil() { return type == Type.NIL; }

    /** nil and false are falsy; everything else, 0 and "" included, is truthy. */
    public boolean isTruthy() {
        if (type == Type.NIL) return false;
        if (type == Type.BOOL) return (boolean) value;
        return true;
    }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    public Callable asCallable() {
        if (type != Type.CALLABLE) throw new IllegalStateException("Expected callable, got " + type);
        return (Callable) value;
    }

    public boolean isClass() {
        return type == Type.CALLABLE && value instanceof ClassDescriptor;
    }

    public ClassDescriptor asClass() {
        if (!isClass()) throw new IllegalStateException("Expected class, got " + type);
        return (ClassDescriptor) value;
    }

    public ClassInstance asInstance() {
        if (type != Type.INSTANCE) throw new IllegalStateException("Expected instance, got " + type);
        return (ClassInstance) value;
    }

    /**
     * Language equality: nil only equals nil, primitives compare by value,
     * callables and instances by identity, different types never match.
     */
    public static boolean isEqual(Value a, Value b) {
        if (a.type != b.type) return false;
        switch (a.type) {
            case NIL:
                return true;
            case NUMBER:
                return a.asNumber() == b.asNumber();
            case BOOL:
            case STRING:
                return a.value.equals(b.value);
            default:
                return a.value == b.value;
        }
    }

    /** Canonical printed form, as produced by the 'print' statement. */
    @Override
    public String toString() {
        switch (type) {
            case NIL:
                return "nil";
            case NUMBER:
                return formatNumber(asNumber());
            case BOOL:
                return Boolean.toString(asBool());
            case STRING:
                return asString();
            default:
                return String.valueOf(value);
        }
    }

    /**
     * Integral values print without a fraction and never in exponent form;
     * fractional values print the shortest plain decimal.
     */
    public static String formatNumber(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "Infinity" : "-Infinity";
        if (d == 0.0) return (1.0 / d < 0) ? "-0" : "0";
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}
