package com.moonshift.ast;

public sealed interface Statement extends Node permits
    LocalDeclaration,
    Assignment,
    CompoundAssignment,
    ExpressionStatement,
    FunctionDeclaration,
    IfStatement,
    WhileStatement,
    RepeatStatement,
    NumericForStatement,
    GenericForStatement,
    DoStatement,
    ReturnStatement,
    BreakStatement,
    ContinueStatement,
    GotoStatement,
    LabelStatement,
    CommentStatement {
}
