package com.moonshift.ast;

public record BreakStatement(SourceLocation loc) implements Statement {
    public BreakStatement() {
        this(SourceLocation.SYNTHETIC);
    }

    @Override
    public String type() {
        return "BreakStatement";
    }
}
