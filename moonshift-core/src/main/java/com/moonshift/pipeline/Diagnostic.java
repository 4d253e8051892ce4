package com.moonshift.pipeline;

import com.moonshift.LexException;
import com.moonshift.ParseException;
import com.moonshift.pass.InternalInvariantException;
import com.moonshift.pass.UnsupportedConstructException;

/**
 * Why an invocation failed, with a 1-based source position (0 when unknown).
 */
public record Diagnostic(
    Kind kind,
    String message,
    int line,
    int column
) {

    public enum Kind {
        LEX_ERROR,
        SYNTAX_ERROR,
        UNSUPPORTED_CONSTRUCT,
        INTERNAL_INVARIANT_VIOLATION
    }

    static Diagnostic of(RuntimeException e) {
        if (e instanceof ParseException) {
            return from((ParseException) e);
        }
        if (e instanceof UnsupportedConstructException) {
            return from((UnsupportedConstructException) e);
        }
        if (e instanceof InternalInvariantException) {
            return from((InternalInvariantException) e);
        }
        throw new IllegalArgumentException("No diagnostic kind for " + e.getClass().getName(), e);
    }

    public static Diagnostic from(ParseException e) {
        Kind kind = e instanceof LexException ? Kind.LEX_ERROR : Kind.SYNTAX_ERROR;
        return new Diagnostic(kind, e.getReason(), e.getLine(), e.getColumn());
    }

    public static Diagnostic from(InternalInvariantException e) {
        return new Diagnostic(Kind.INTERNAL_INVARIANT_VIOLATION, e.getMessage(), e.getLine(), e.getColumn());
    }

    public static Diagnostic from(UnsupportedConstructException e) {
        return new Diagnostic(Kind.UNSUPPORTED_CONSTRUCT, e.getMessage(), e.getLine(), e.getColumn());
    }

    @Override
    public String toString() {
        return kind + ": " + message + " at line " + line + ", column " + column;
    }
}
