package com.moonshift.ast;

import java.util.List;

public record CallExpression(
    SourceLocation loc,
    Expression callee,
    List<Expression> arguments
) implements Expression {
    public CallExpression(Expression callee, List<Expression> arguments) {
        this(SourceLocation.SYNTHETIC, callee, arguments);
    }

    @Override
    public String type() {
        return "CallExpression";
    }
}
