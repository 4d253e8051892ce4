package com.moonshift.ast;

/**
 * {@code repeat ... until cond}. The condition sees the body's locals.
 */
public record RepeatStatement(
    SourceLocation loc,
    Block body,
    Expression condition
) implements Statement {
    public RepeatStatement(Block body, Expression condition) {
        this(SourceLocation.SYNTHETIC, body, condition);
    }

    @Override
    public String type() {
        return "RepeatStatement";
    }
}
