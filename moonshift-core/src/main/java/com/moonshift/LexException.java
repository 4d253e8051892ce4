package com.moonshift;

/**
 * Malformed literal, escape or symbol in the source text.
 */
public class LexException extends ParseException {

    public LexException(String message, int line, int column, int position) {
        super(message, line, column, position);
    }
}
