package com.moonshift.pipeline;

import com.moonshift.ast.SourceLocation;

/**
 * Non-fatal report attached to a result.
 *
 * @param source the pass (or "parser") that raised it
 * @param line   1-based, 0 when the construct was synthesized
 */
public record Warning(
    Category category,
    String source,
    String message,
    int line,
    int column
) {

    public enum Category {
        /** A pass met a shape it does not handle and left the subtree unchanged. */
        UNSUPPORTED_CONSTRUCT,
        /** The fixer or the repairing parser changed the script. */
        REPAIR,
        /** A pattern that may break after obfuscation. */
        LINT,
        /** Informational, e.g. a wrapper that was flattened. */
        NOTE
    }

    public static Warning at(Category category, String source, String message, SourceLocation loc) {
        return new Warning(category, source, message, loc.line(), loc.column());
    }

    @Override
    public String toString() {
        String where = line > 0 ? " (line " + line + ", column " + column + ")" : "";
        return category + " [" + source + "] " + message + where;
    }
}
