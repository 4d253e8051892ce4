package com.moonshift.ast;

/**
 * Source parentheses. Kept because they truncate calls and {@code ...} to one value.
 */
public record ParenExpression(
    SourceLocation loc,
    Expression expression
) implements Expression {
    public ParenExpression(Expression expression) {
        this(SourceLocation.SYNTHETIC, expression);
    }

    @Override
    public String type() {
        return "ParenExpression";
    }
}
