package com.moonshift.ast;

public record VarargExpression(SourceLocation loc) implements Expression {
    public VarargExpression() {
        this(SourceLocation.SYNTHETIC);
    }

    @Override
    public String type() {
        return "VarargExpression";
    }
}
