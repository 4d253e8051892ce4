package com.moonshift.ast;

/**
 * Luau {@code x += 1} and friends.
 */
public record CompoundAssignment(
    SourceLocation loc,
    Expression target,
    BinaryOperator operator,
    Expression value
) implements Statement {
    public CompoundAssignment(Expression target, BinaryOperator operator, Expression value) {
        this(SourceLocation.SYNTHETIC, target, operator, value);
    }

    @Override
    public String type() {
        return "CompoundAssignment";
    }
}
