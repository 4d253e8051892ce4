package com.moonshift.scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lexical scope of one block. Lookups walk parent links outward; parents never own children.
 * A name declared twice in the same scope (e.g. {@code local x = 1 local x = x + 1})
 * resolves to the most recent declaration, matching Lua's sequential visibility.
 */
public final class Scope {

    private final Scope parent;
    private final boolean functionScope;
    private final Map<String, Symbol> visible = new HashMap<>();
    private final List<Symbol> declared = new ArrayList<>();

    public Scope(Scope parent, boolean functionScope) {
        this.parent = parent;
        this.functionScope = functionScope;
    }

    public Scope parent() {
        return parent;
    }

    /**
     * True for function bodies and chunk roots: the boundary of a closure.
     */
    public boolean isFunctionScope() {
        return functionScope;
    }

    public Scope functionScope() {
        Scope s = this;
        while (!s.functionScope && s.parent != null) {
            s = s.parent;
        }
        return s;
    }

    void add(Symbol symbol) {
        visible.put(symbol.name(), symbol);
        declared.add(symbol);
    }

    /**
     * @return the visible symbol for {@code name}, or null if no enclosing scope declares it
     */
    public Symbol resolve(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            Symbol symbol = s.visible.get(name);
            if (symbol != null) {
                return symbol;
            }
        }
        return null;
    }

    /**
     * Every symbol declared directly in this scope, in declaration order.
     */
    public List<Symbol> symbols() {
        return Collections.unmodifiableList(declared);
    }
}
