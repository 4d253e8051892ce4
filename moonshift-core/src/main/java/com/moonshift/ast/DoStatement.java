package com.moonshift.ast;

public record DoStatement(
    SourceLocation loc,
    Block body
) implements Statement {
    public DoStatement(Block body) {
        this(SourceLocation.SYNTHETIC, body);
    }

    @Override
    public String type() {
        return "DoStatement";
    }
}
