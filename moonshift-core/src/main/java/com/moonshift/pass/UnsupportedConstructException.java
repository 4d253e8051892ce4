package com.moonshift.pass;

import com.moonshift.ast.SourceLocation;

/**
 * Raised inside a pass for a recognized shape it cannot rewrite. The enclosing statement
 * is left as it was and the failure becomes a warning.
 */
public class UnsupportedConstructException extends RuntimeException {

    private final int line;
    private final int column;

    public UnsupportedConstructException(String message, SourceLocation loc) {
        super(message);
        this.line = loc.line();
        this.column = loc.column();
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
