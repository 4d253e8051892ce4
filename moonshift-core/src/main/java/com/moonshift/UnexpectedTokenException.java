package com.moonshift;

public class UnexpectedTokenException extends ParseException {

    private final Token token;

    public UnexpectedTokenException(Token token, String context) {
        super("unexpected symbol " + token.describe() + " in " + context, token.line(), token.column(), token.position());
        this.token = token;
    }

    public Token getToken() {
        return token;
    }
}
