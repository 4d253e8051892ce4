package com.moonshift.ast;

/**
 * A source comment kept at a statement boundary. Formatting only: readable output
 * prints it, compact output drops it, and no pass inspects it.
 *
 * @param text the full comment including its {@code --} prefix
 */
public record CommentStatement(
    SourceLocation loc,
    String text
) implements Statement {
    @Override
    public String type() {
        return "CommentStatement";
    }
}
