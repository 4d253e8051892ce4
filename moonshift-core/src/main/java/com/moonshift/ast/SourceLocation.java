package com.moonshift.ast;

/**
 * Source span of a node; 1-based lines and columns. Nodes synthesized by rewrite
 * passes carry {@link #SYNTHETIC}.
 */
public record SourceLocation(Position start, Position end) {

    public static final SourceLocation SYNTHETIC = new SourceLocation(new Position(0, 0), new Position(0, 0));

    public record Position(int line, int column) {
    }

    public static SourceLocation of(int startLine, int startColumn, int endLine, int endColumn) {
        return new SourceLocation(new Position(startLine, startColumn), new Position(endLine, endColumn));
    }

    public boolean isSynthetic() {
        return start.line() == 0;
    }

    public int line() {
        return start.line();
    }

    public int column() {
        return start.column();
    }
}
