package com.moonshift.scope;

/**
 * A resolved name. Rewrite passes rename symbols, never raw name strings: every
 * {@code Identifier} that refers to the same variable shares one {@code Symbol}.
 *
 * <p>Globals are symbols too (kind {@link Kind#GLOBAL}, one per name per chunk),
 * but their names are looked up at run time and must never change.</p>
 */
public final class Symbol {

    public enum Kind {
        LOCAL,
        PARAMETER,
        /** Implicit first parameter of {@code function a:b()} */
        SELF,
        FOR_VARIABLE,
        GLOBAL
    }

    private final int id;
    private final String name;
    private final Kind kind;
    private final Scope scope;

    Symbol(int id, String name, Kind kind, Scope scope) {
        this.id = id;
        this.name = name;
        this.kind = kind;
        this.scope = scope;
    }

    public int id() {
        return id;
    }

    /**
     * The name as declared in the source.
     */
    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Declaring scope; null for globals.
     */
    public Scope scope() {
        return scope;
    }

    public boolean isGlobal() {
        return kind == Kind.GLOBAL;
    }

    /**
     * The innermost function scope (or chunk scope) that declares this symbol, null for globals.
     */
    public Scope functionScope() {
        return scope == null ? null : scope.functionScope();
    }

    @Override
    public String toString() {
        return name + "#" + id + "(" + kind + ")";
    }
}
