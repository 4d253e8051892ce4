package com.moonshift.ast;

import com.moonshift.scope.Scope;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered statements sharing one lexical scope.
 */
public record Block(
    SourceLocation loc,
    List<Statement> statements,
    Scope scope
) implements Node {
    public Block(List<Statement> statements, Scope scope) {
        this(SourceLocation.SYNTHETIC, statements, scope);
    }

    public Block withStatements(List<Statement> newStatements) {
        return new Block(loc, newStatements, scope);
    }

    /**
     * Statements without comments.
     */
    public List<Statement> codeStatements() {
        List<Statement> code = new ArrayList<>(statements.size());
        for (Statement statement : statements) {
            if (!(statement instanceof CommentStatement)) {
                code.add(statement);
            }
        }
        return code;
    }

    /**
     * @return the last non-comment statement, or null for an empty block
     */
    public Statement lastCodeStatement() {
        for (int i = statements.size() - 1; i >= 0; i--) {
            if (!(statements.get(i) instanceof CommentStatement)) {
                return statements.get(i);
            }
        }
        return null;
    }

    public boolean isEmpty() {
        return lastCodeStatement() == null;
    }

    @Override
    public String type() {
        return "Block";
    }
}
