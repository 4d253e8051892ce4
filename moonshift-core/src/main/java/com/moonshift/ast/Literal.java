package com.moonshift.ast;

import com.moonshift.value.LuaValue;

/**
 * nil, boolean, number or string constant.
 *
 * @param raw source spelling, kept so beautify/minify reproduce the literal exactly;
 *            null for literals built by a pass
 */
public record Literal(
    SourceLocation loc,
    LuaValue value,
    String raw
) implements Expression {
    public Literal(LuaValue value) {
        this(SourceLocation.SYNTHETIC, value, null);
    }

    public static Literal nil() {
        return new Literal(LuaValue.NIL);
    }

    public static Literal of(boolean value) {
        return new Literal(LuaValue.of(value));
    }

    public static Literal of(double value) {
        return new Literal(LuaValue.of(value));
    }

    public static Literal ofBytes(String bytes) {
        return new Literal(LuaValue.ofBytes(bytes));
    }

    public boolean isString() {
        return value instanceof LuaValue.Str;
    }

    public boolean isNumber() {
        return value instanceof LuaValue.Num;
    }

    @Override
    public String type() {
        return "Literal";
    }
}
