package com.moonshift.ast;

import com.moonshift.TokenType;

public enum UnaryOperator {
    NEG("-"),
    NOT("not"),
    LEN("#");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static UnaryOperator fromToken(TokenType type) {
        return switch (type) {
            case MINUS -> NEG;
            case NOT -> NOT;
            case HASH -> LEN;
            default -> null;
        };
    }
}
