package com.moonshift.ast;

/**
 * One {@code if}/{@code elseif} arm.
 */
public record IfClause(
    SourceLocation loc,
    Expression condition,
    Block body
) implements Node {
    public IfClause(Expression condition, Block body) {
        this(SourceLocation.SYNTHETIC, condition, body);
    }

    @Override
    public String type() {
        return "IfClause";
    }
}
