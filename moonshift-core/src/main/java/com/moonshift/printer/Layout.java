package com.moonshift.printer;

public enum Layout {
    /** Indented, one statement per line, comments kept. */
    READABLE,
    /** No comments and only the whitespace the grammar needs. */
    COMPACT
}
