package com.moonshift.ast;

import java.util.List;

/**
 * {@code function a.b.c:m() end} or {@code local function f() end}.
 * For the dotted form {@code name} is the base variable {@code a}, {@code path} holds
 * {@code b, c} and {@code method} is {@code m} (null when absent).
 */
public record FunctionDeclaration(
    SourceLocation loc,
    boolean local,
    Identifier name,
    List<String> path,
    String method,
    FunctionExpression function
) implements Statement {
    public FunctionDeclaration(boolean local, Identifier name, List<String> path, String method, FunctionExpression function) {
        this(SourceLocation.SYNTHETIC, local, name, path, method, function);
    }

    /**
     * True when the statement assigns the variable itself rather than a field of it.
     */
    public boolean assignsName() {
        return path.isEmpty() && method == null;
    }

    @Override
    public String type() {
        return "FunctionDeclaration";
    }
}
