package com.moonshift.ast;

import java.util.List;

public record TableConstructor(
    SourceLocation loc,
    List<TableField> fields
) implements Expression {
    public TableConstructor(List<TableField> fields) {
        this(SourceLocation.SYNTHETIC, fields);
    }

    @Override
    public String type() {
        return "TableConstructor";
    }
}
