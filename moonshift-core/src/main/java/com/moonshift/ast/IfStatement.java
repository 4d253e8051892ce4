package com.moonshift.ast;

import java.util.List;

public record IfStatement(
    SourceLocation loc,
    List<IfClause> clauses,
    Block elseBlock  // Can be null
) implements Statement {
    public IfStatement(List<IfClause> clauses, Block elseBlock) {
        this(SourceLocation.SYNTHETIC, clauses, elseBlock);
    }

    @Override
    public String type() {
        return "IfStatement";
    }
}
