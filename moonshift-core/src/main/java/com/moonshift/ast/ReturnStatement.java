package com.moonshift.ast;

import java.util.List;

public record ReturnStatement(
    SourceLocation loc,
    List<Expression> values
) implements Statement {
    public ReturnStatement(List<Expression> values) {
        this(SourceLocation.SYNTHETIC, values);
    }

    @Override
    public String type() {
        return "ReturnStatement";
    }
}
