package com.moonshift.ast;

public sealed interface Expression extends Node permits
    Literal,
    Identifier,
    BinaryExpression,
    UnaryExpression,
    TableConstructor,
    FunctionExpression,
    IndexExpression,
    CallExpression,
    MethodCallExpression,
    VarargExpression,
    ParenExpression {

    /**
     * True for expressions that may appear before {@code (}, {@code [}, {@code .} or {@code :}
     * without parentheses.
     */
    default boolean isPrefix() {
        return this instanceof Identifier
            || this instanceof IndexExpression
            || this instanceof CallExpression
            || this instanceof MethodCallExpression
            || this instanceof ParenExpression;
    }

    /**
     * True for expressions that can produce more than one value (calls and {@code ...}).
     */
    default boolean isMultiValued() {
        return this instanceof CallExpression
            || this instanceof MethodCallExpression
            || this instanceof VarargExpression;
    }
}
