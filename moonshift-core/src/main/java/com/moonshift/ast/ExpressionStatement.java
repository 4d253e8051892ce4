package com.moonshift.ast;

/**
 * A call used as a statement.
 */
public record ExpressionStatement(
    SourceLocation loc,
    Expression expression
) implements Statement {
    public ExpressionStatement(Expression expression) {
        this(SourceLocation.SYNTHETIC, expression);
    }

    @Override
    public String type() {
        return "ExpressionStatement";
    }
}
