package com.moonshift.ast;

import com.moonshift.scope.Symbol;

/**
 * A variable reference or binding. {@code symbol} is resolved at parse time and is never null
 * in a parsed tree.
 */
public record Identifier(
    SourceLocation loc,
    String name,
    Symbol symbol
) implements Expression {
    public Identifier(String name, Symbol symbol) {
        this(SourceLocation.SYNTHETIC, name, symbol);
    }

    public Identifier withName(String newName) {
        return new Identifier(loc, newName, symbol);
    }

    /**
     * True when this names the unshadowed global {@code globalName}.
     */
    public boolean isGlobal(String globalName) {
        return symbol != null && symbol.isGlobal() && name.equals(globalName);
    }

    @Override
    public String type() {
        return "Identifier";
    }
}
