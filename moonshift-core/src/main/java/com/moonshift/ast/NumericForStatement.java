package com.moonshift.ast;

public record NumericForStatement(
    SourceLocation loc,
    Identifier variable,
    Expression start,
    Expression limit,
    Expression step,  // Can be null
    Block body
) implements Statement {
    public NumericForStatement(Identifier variable, Expression start, Expression limit, Expression step, Block body) {
        this(SourceLocation.SYNTHETIC, variable, start, limit, step, body);
    }

    @Override
    public String type() {
        return "NumericForStatement";
    }
}
