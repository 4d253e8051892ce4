package com.moonshift.ast;

import com.moonshift.value.LuaValue;

/**
 * {@code object[key]}, or {@code object.name} when {@code dotted} (then {@code key} is a
 * string literal holding a valid name).
 */
public record IndexExpression(
    SourceLocation loc,
    Expression object,
    Expression key,
    boolean dotted
) implements Expression {
    public IndexExpression(Expression object, Expression key, boolean dotted) {
        this(SourceLocation.SYNTHETIC, object, key, dotted);
    }

    public static IndexExpression field(Expression object, String name) {
        return new IndexExpression(object, Literal.ofBytes(name), true);
    }

    /**
     * @return the field name for {@code a.name} and {@code a["name"]}, null otherwise
     */
    public String fieldName() {
        if (key instanceof Literal literal && literal.value() instanceof LuaValue.Str s) {
            return s.bytes();
        }
        return null;
    }

    @Override
    public String type() {
        return "IndexExpression";
    }
}
