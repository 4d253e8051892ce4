package com.moonshift.ast;

/**
 * Luau {@code continue}.
 */
public record ContinueStatement(SourceLocation loc) implements Statement {
    public ContinueStatement() {
        this(SourceLocation.SYNTHETIC);
    }

    @Override
    public String type() {
        return "ContinueStatement";
    }
}
