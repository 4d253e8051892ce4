package com.moonshift;

import com.moonshift.value.LuaValue;

/**
 * One lexical unit. {@code lexeme} is the exact source spelling; {@code value} is the
 * decoded literal for numbers and strings (null otherwise). Lines and columns are 1-based,
 * positions are offsets into the source text.
 */
public record Token(
    TokenType type,
    String lexeme,
    LuaValue value,
    int line,
    int column,
    int position,
    int endPosition
) {
    public TokenType.Kind kind() {
        return type.kind();
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    /**
     * Text used in "near ..." error messages.
     */
    public String describe() {
        if (type == TokenType.EOF) {
            return "<eof>";
        }
        String text = lexeme.length() > 24 ? lexeme.substring(0, 24) + "..." : lexeme;
        return "'" + text + "'";
    }

    @Override
    public String toString() {
        return type + "(" + lexeme + ") at " + line + ":" + column;
    }
}
