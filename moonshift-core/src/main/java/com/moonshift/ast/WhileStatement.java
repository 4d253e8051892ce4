package com.moonshift.ast;

public record WhileStatement(
    SourceLocation loc,
    Expression condition,
    Block body
) implements Statement {
    public WhileStatement(Expression condition, Block body) {
        this(SourceLocation.SYNTHETIC, condition, body);
    }

    @Override
    public String type() {
        return "WhileStatement";
    }
}
