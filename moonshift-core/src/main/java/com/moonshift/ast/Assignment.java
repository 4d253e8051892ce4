package com.moonshift.ast;

import java.util.List;

/**
 * Each target is an {@link Identifier} or an {@link IndexExpression}.
 */
public record Assignment(
    SourceLocation loc,
    List<Expression> targets,
    List<Expression> values
) implements Statement {
    public Assignment(List<Expression> targets, List<Expression> values) {
        this(SourceLocation.SYNTHETIC, targets, values);
    }

    @Override
    public String type() {
        return "Assignment";
    }
}
