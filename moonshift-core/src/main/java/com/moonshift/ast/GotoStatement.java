package com.moonshift.ast;

public record GotoStatement(
    SourceLocation loc,
    String label
) implements Statement {
    @Override
    public String type() {
        return "GotoStatement";
    }
}
