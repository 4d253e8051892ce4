package com.moonshift.value;

/**
 * Closed set of values the engine can reason about at compile time.
 * Anything outside this set (tables, functions, userdata) is never folded.
 */
public sealed interface LuaValue permits LuaValue.Nil, LuaValue.Bool, LuaValue.Num, LuaValue.Str {

    Nil NIL = new Nil();
    Bool TRUE = new Bool(true);
    Bool FALSE = new Bool(false);

    String typeName();

    /**
     * Lua truthiness: only nil and false are falsy.
     */
    default boolean isTruthy() {
        if (this instanceof Nil) {
            return false;
        }
        return !(this instanceof Bool b) || b.value();
    }

    static Bool of(boolean b) {
        return b ? TRUE : FALSE;
    }

    static Num of(double d) {
        return new Num(d);
    }

    /**
     * @param bytes one byte (0..255) per char
     */
    static Str ofBytes(String bytes) {
        return new Str(bytes);
    }

    record Nil() implements LuaValue {
        @Override
        public String typeName() {
            return "nil";
        }
    }

    record Bool(boolean value) implements LuaValue {
        @Override
        public String typeName() {
            return "boolean";
        }
    }

    record Num(double value) implements LuaValue {
        @Override
        public String typeName() {
            return "number";
        }

        public boolean isIntegral() {
            return !Double.isInfinite(value) && value == Math.rint(value);
        }
    }

    /**
     * A Lua string. Lua strings are byte strings, so {@code bytes} holds one byte per char.
     */
    record Str(String bytes) implements LuaValue {
        @Override
        public String typeName() {
            return "string";
        }

        public int length() {
            return bytes.length();
        }
    }
}
