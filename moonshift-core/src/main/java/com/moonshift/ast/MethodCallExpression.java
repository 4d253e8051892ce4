package com.moonshift.ast;

import java.util.List;

/**
 * {@code object:method(arguments)}
 */
public record MethodCallExpression(
    SourceLocation loc,
    Expression object,
    String method,
    List<Expression> arguments
) implements Expression {
    public MethodCallExpression(Expression object, String method, List<Expression> arguments) {
        this(SourceLocation.SYNTHETIC, object, method, arguments);
    }

    @Override
    public String type() {
        return "MethodCallExpression";
    }
}
