package com.moonshift.pipeline;

/**
 * Thrown by {@link Pipeline#transform} when an invocation fails.
 */
public class TransformException extends RuntimeException {

    private final Diagnostic diagnostic;

    public TransformException(Diagnostic diagnostic) {
        super(diagnostic.toString());
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
