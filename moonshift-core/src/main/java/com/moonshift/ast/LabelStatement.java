package com.moonshift.ast;

/**
 * {@code ::name::}
 */
public record LabelStatement(
    SourceLocation loc,
    String name
) implements Statement {
    @Override
    public String type() {
        return "LabelStatement";
    }
}
