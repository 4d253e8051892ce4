package com.moonshift.scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Issues symbol ids for one chunk. Code parsed later into the same chunk (inlined
 * loadstring payloads, injected helpers) shares the table so ids stay unique.
 */
public final class SymbolTable {

    private final Map<String, Symbol> globals = new LinkedHashMap<>();
    private final List<Symbol> all = new ArrayList<>();
    private int nextId = 1;

    /**
     * Declares a new symbol in {@code scope}.
     */
    public Symbol declare(String name, Symbol.Kind kind, Scope scope) {
        if (kind == Symbol.Kind.GLOBAL) {
            return global(name);
        }
        Symbol symbol = new Symbol(nextId++, name, kind, scope);
        scope.add(symbol);
        all.add(symbol);
        return symbol;
    }

    /**
     * The single global symbol for {@code name}.
     */
    public Symbol global(String name) {
        return globals.computeIfAbsent(name, n -> {
            Symbol symbol = new Symbol(nextId++, n, Symbol.Kind.GLOBAL, null);
            all.add(symbol);
            return symbol;
        });
    }

    /**
     * Resolves {@code name} in {@code scope}, falling back to the global symbol.
     */
    public Symbol resolve(String name, Scope scope) {
        Symbol symbol = scope == null ? null : scope.resolve(name);
        return symbol != null ? symbol : global(name);
    }

    public List<Symbol> symbols() {
        return Collections.unmodifiableList(all);
    }

    public Map<String, Symbol> globals() {
        return Collections.unmodifiableMap(globals);
    }
}
