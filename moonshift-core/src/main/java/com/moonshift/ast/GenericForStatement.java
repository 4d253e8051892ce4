package com.moonshift.ast;

import java.util.List;

public record GenericForStatement(
    SourceLocation loc,
    List<Identifier> variables,
    List<Expression> iterators,
    Block body
) implements Statement {
    public GenericForStatement(List<Identifier> variables, List<Expression> iterators, Block body) {
        this(SourceLocation.SYNTHETIC, variables, iterators, body);
    }

    @Override
    public String type() {
        return "GenericForStatement";
    }
}
