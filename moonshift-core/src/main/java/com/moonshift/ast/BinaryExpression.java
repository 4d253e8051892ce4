package com.moonshift.ast;

public record BinaryExpression(
    SourceLocation loc,
    BinaryOperator operator,
    Expression left,
    Expression right
) implements Expression {
    public BinaryExpression(BinaryOperator operator, Expression left, Expression right) {
        this(SourceLocation.SYNTHETIC, operator, left, right);
    }

    @Override
    public String type() {
        return "BinaryExpression";
    }
}
