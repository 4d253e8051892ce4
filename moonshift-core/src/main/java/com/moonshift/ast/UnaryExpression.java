package com.moonshift.ast;

public record UnaryExpression(
    SourceLocation loc,
    UnaryOperator operator,
    Expression operand
) implements Expression {
    public UnaryExpression(UnaryOperator operator, Expression operand) {
        this(SourceLocation.SYNTHETIC, operator, operand);
    }

    @Override
    public String type() {
        return "UnaryExpression";
    }
}
