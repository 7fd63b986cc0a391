package com.lox.script.parser;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Hop counts for local variable references, keyed by node identity.
 * A node without an entry is a global reference.
 */
public final class ResolutionTable {
    private final Map<Expr.ExprInterface, Integer> depths;

    ResolutionTable(IdentityHashMap<Expr.ExprInterface, Integer> depths) {
        this.depths = depths;
    }

    static ResolutionTable empty() {
        return new ResolutionTable(new IdentityHashMap<>());
    }

    /** @return the hop count, or null when the reference is global */
    public Integer depthOf(Expr.ExprInterface expr) {
        return depths.get(expr);
    }

    public boolean isLocal(Expr.ExprInterface expr) {
        return depths.containsKey(expr);
    }

    public int size() {
        return depths.size();
    }

    /** Returns a table holding the entries of both; {@code other} wins on overlap. */
    ResolutionTable merge(ResolutionTable other) {
        IdentityHashMap<Expr.ExprInterface, Integer> merged = new IdentityHashMap<>(depths);
        merged.putAll(other.depths);
        return new ResolutionTable(merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolutionTable)) return false;
        ResolutionTable other = (ResolutionTable) o;
        if (depths.size() != other.depths.size()) return false;
        for (Map.Entry<Expr.ExprInterface, Integer> e : depths.entrySet()) {
            if (!other.depths.containsKey(e.getKey())) return false;
            if (!Objects.equals(e.getValue(), other.depths.get(e.getKey()))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Map.Entry<Expr.ExprInterface, Integer> e : depths.entrySet()) {
            h += System.identityHashCode(e.getKey()) ^ e.getValue();
        }
        return h;
    }
}
