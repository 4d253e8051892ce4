package com.moonshift;

/**
 * Base class for failures while turning source text into a tree. Always fatal for
 * the invocation that raised it.
 */
public class ParseException extends RuntimeException {

    private final int line;
    private final int column;
    private final int position;

    public ParseException(String message, int line, int column, int position) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
        this.position = position;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getPosition() {
        return position;
    }

    /**
     * The message without the trailing position.
     */
    public String getReason() {
        String message = getMessage();
        int at = message.lastIndexOf(" at line ");
        return at >= 0 ? message.substring(0, at) : message;
    }
}
