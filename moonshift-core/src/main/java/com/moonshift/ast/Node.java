package com.moonshift.ast;

/**
 * Base interface for all AST nodes.
 */
public sealed interface Node permits
    Chunk,
    Block,
    Statement,
    Expression,
    IfClause,
    TableField {

    String type();
    SourceLocation loc();
}
