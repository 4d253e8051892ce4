package com.moonshift.ast;

import java.util.List;

/**
 * {@code local a, b = x, y}. {@code values} is empty for a bare declaration.
 */
public record LocalDeclaration(
    SourceLocation loc,
    List<Identifier> names,
    List<Expression> values
) implements Statement {
    public LocalDeclaration(List<Identifier> names, List<Expression> values) {
        this(SourceLocation.SYNTHETIC, names, values);
    }

    @Override
    public String type() {
        return "LocalDeclaration";
    }
}
