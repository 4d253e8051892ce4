package com.moonshift.pass;

import com.moonshift.ast.*;

/**
 * Read-only traversal. Identifiers in binding positions are reported through
 * {@link #declare} and {@link #write} instead of {@link #enter}, so {@code enter}
 * only ever sees identifiers that are read.
 */
public abstract class AstWalker {

    /**
     * Called before a node's children. Return false to skip them.
     */
    protected boolean enter(Node node) {
        return true;
    }

    protected void leave(Node node) {
    }

    /**
     * A local, parameter or loop variable coming into scope.
     */
    protected void declare(Identifier identifier) {
    }

    /**
     * An existing variable being assigned.
     */
    protected void write(Identifier identifier) {
    }

    public void walk(Node node) {
        if (node == null || !enter(node)) {
            return;
        }
        if (node instanceof Chunk chunk) {
            walk(chunk.body());
        } else if (node instanceof Block block) {
            for (Statement statement : block.statements()) {
                walk(statement);
            }
        } else if (node instanceof Statement statement) {
            walkStatement(statement);
        } else if (node instanceof IfClause clause) {
            walk(clause.condition());
            walk(clause.body());
        } else if (node instanceof TableField field) {
            if (field.kind() == TableField.Kind.KEYED) {
                walk(field.key());
            }
            walk(field.value());
        } else if (node instanceof Expression expression) {
            walkExpression(expression);
        }
        leave(node);
    }

    private void walkStatement(Statement statement) {
        if (statement instanceof LocalDeclaration local) {
            local.values().forEach(this::walk);
            local.names().forEach(this::declare);
        } else if (statement instanceof Assignment assignment) {
            assignment.targets().forEach(this::walkTarget);
            assignment.values().forEach(this::walk);
        } else if (statement instanceof CompoundAssignment compound) {
            walkTarget(compound.target());
            walk(compound.value());
        } else if (statement instanceof ExpressionStatement expressionStatement) {
            walk(expressionStatement.expression());
        } else if (statement instanceof FunctionDeclaration declaration) {
            if (declaration.local()) {
                declare(declaration.name());
            } else if (declaration.assignsName()) {
                write(declaration.name());
            } else {
                walk(declaration.name());
            }
            walk(declaration.function());
        } else if (statement instanceof IfStatement ifStatement) {
            ifStatement.clauses().forEach(this::walk);
            walk(ifStatement.elseBlock());
        } else if (statement instanceof WhileStatement whileStatement) {
            walk(whileStatement.condition());
            walk(whileStatement.body());
        } else if (statement instanceof RepeatStatement repeat) {
            walk(repeat.body());
            walk(repeat.condition());
        } else if (statement instanceof NumericForStatement numericFor) {
            walk(numericFor.start());
            walk(numericFor.limit());
            walk(numericFor.step());
            declare(numericFor.variable());
            walk(numericFor.body());
        } else if (statement instanceof GenericForStatement genericFor) {
            genericFor.iterators().forEach(this::walk);
            genericFor.variables().forEach(this::declare);
            walk(genericFor.body());
        } else if (statement instanceof DoStatement doStatement) {
            walk(doStatement.body());
        } else if (statement instanceof ReturnStatement returnStatement) {
            returnStatement.values().forEach(this::walk);
        }
    }

    private void walkTarget(Expression target) {
        if (target instanceof Identifier identifier) {
            write(identifier);
        } else {
            walk(target);
        }
    }

    private void walkExpression(Expression expression) {
        if (expression instanceof BinaryExpression binary) {
            walk(binary.left());
            walk(binary.right());
        } else if (expression instanceof UnaryExpression unary) {
            walk(unary.operand());
        } else if (expression instanceof TableConstructor table) {
            table.fields().forEach(this::walk);
        } else if (expression instanceof FunctionExpression function) {
            function.parameters().forEach(this::declare);
            walk(function.body());
        } else if (expression instanceof IndexExpression index) {
            walk(index.object());
            if (!index.dotted()) {
                walk(index.key());
            }
        } else if (expression instanceof CallExpression call) {
            walk(call.callee());
            call.arguments().forEach(this::walk);
        } else if (expression instanceof MethodCallExpression methodCall) {
            walk(methodCall.object());
            methodCall.arguments().forEach(this::walk);
        } else if (expression instanceof ParenExpression paren) {
            walk(paren.expression());
        }
    }
}
