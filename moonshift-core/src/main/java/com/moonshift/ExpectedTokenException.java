package com.moonshift;

public class ExpectedTokenException extends ParseException {

    private final Token token;

    public ExpectedTokenException(String message, Token token) {
        super(message + " near " + token.describe(), token.line(), token.column(), token.position());
        this.token = token;
    }

    public Token getToken() {
        return token;
    }
}
