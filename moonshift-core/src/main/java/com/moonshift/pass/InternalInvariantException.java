package com.moonshift.pass;

import com.moonshift.ast.SourceLocation;

/**
 * An engine bug: a tree that should be impossible, such as an identifier with no symbol.
 * Always fatal.
 */
public class InternalInvariantException extends RuntimeException {

    private final int line;
    private final int column;

    public InternalInvariantException(String message, SourceLocation loc) {
        super(message);
        this.line = loc == null ? 0 : loc.line();
        this.column = loc == null ? 0 : loc.column();
    }

    public InternalInvariantException(String message, Throwable cause) {
        super(message, cause);
        this.line = 0;
        this.column = 0;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
