package com.moonshift.ast;

/**
 * One table constructor entry. {@code key} is null for positional entries and a string
 * {@link Literal} for {@code name = value} entries.
 */
public record TableField(
    SourceLocation loc,
    Kind kind,
    Expression key,
    Expression value
) implements Node {

    public enum Kind {
        /** {@code value} */
        POSITIONAL,
        /** {@code name = value} */
        NAMED,
        /** {@code [key] = value} */
        KEYED
    }

    public static TableField positional(Expression value) {
        return new TableField(SourceLocation.SYNTHETIC, Kind.POSITIONAL, null, value);
    }

    public TableField withParts(Expression newKey, Expression newValue) {
        return new TableField(loc, kind, newKey, newValue);
    }

    @Override
    public String type() {
        return "TableField";
    }
}
