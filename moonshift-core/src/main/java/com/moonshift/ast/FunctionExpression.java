package com.moonshift.ast;

import java.util.List;

/**
 * Function body. Parameters are declared in {@code body.scope()}, which is a function scope.
 * The implicit {@code self} of a method declaration is not listed in {@code parameters}.
 */
public record FunctionExpression(
    SourceLocation loc,
    List<Identifier> parameters,
    boolean vararg,
    Block body
) implements Expression {
    public FunctionExpression(List<Identifier> parameters, boolean vararg, Block body) {
        this(SourceLocation.SYNTHETIC, parameters, vararg, body);
    }

    @Override
    public String type() {
        return "FunctionExpression";
    }
}
