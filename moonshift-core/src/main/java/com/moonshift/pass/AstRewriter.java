package com.moonshift.pass;

import com.moonshift.ast.*;
import com.moonshift.pipeline.Warning;
import com.moonshift.scope.Scope;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Post-order rebuilding traversal. Children are rewritten first, then the rebuilt node is
 * offered to {@link #transformExpression} or {@link #transformStatement}. The input tree is
 * never modified.
 *
 * <p>Identifiers in binding positions (declarations and assignment targets) go through
 * {@link #rewriteBinding} and never through {@code transformExpression}, so a pass that
 * substitutes values for reads cannot break a declaration. Names after {@code .}, names
 * of {@code name = value} table fields and method names are not expressions and are
 * not visited.</p>
 *
 * <p>An {@link UnsupportedConstructException} raised while rewriting a statement leaves
 * that statement as it was and is reported as a warning.</p>
 */
public abstract class AstRewriter {

    protected final PassContext context;
    private final String passName;
    private final Deque<Scope> functionScopes = new ArrayDeque<>();

    protected AstRewriter(String passName, PassContext context) {
        this.passName = passName;
        this.context = context;
    }

    public Chunk rewrite(Chunk chunk) {
        functionScopes.push(chunk.body().scope());
        try {
            return chunk.withBody(rewriteBlock(chunk.body()));
        } finally {
            functionScopes.pop();
        }
    }

    /**
     * Scope of the function (or chunk) whose body is being rewritten.
     */
    protected Scope currentFunctionScope() {
        return functionScopes.peek();
    }

    // ========================================================================
    // Hooks
    // ========================================================================

    protected Expression transformExpression(Expression expression) {
        return expression;
    }

    /**
     * @return replacement statements; empty to delete, several to splice
     */
    protected List<Statement> transformStatement(Statement statement) {
        return List.of(statement);
    }

    protected Identifier rewriteBinding(Identifier identifier) {
        return identifier;
    }

    /**
     * Called with every rebuilt block, after its statements were rewritten.
     */
    protected Block finishBlock(Block block) {
        return block;
    }

    // ========================================================================
    // Statements
    // ========================================================================

    public Block rewriteBlock(Block block) {
        List<Statement> statements = new ArrayList<>(block.statements().size());
        for (Statement statement : block.statements()) {
            statements.addAll(rewriteStatement(statement));
        }
        return finishBlock(block.withStatements(statements));
    }

    protected List<Statement> rewriteStatement(Statement statement) {
        if (statement instanceof CommentStatement) {
            return List.of(statement);
        }
        try {
            return transformStatement(rebuildStatement(statement));
        } catch (UnsupportedConstructException e) {
            context.warn(passName, Warning.Category.UNSUPPORTED_CONSTRUCT, e.getMessage(), statement.loc());
            return List.of(statement);
        }
    }

    private Statement rebuildStatement(Statement statement) {
        if (statement instanceof LocalDeclaration local) {
            List<Expression> values = rewriteExpressions(local.values());
            List<Identifier> names = new ArrayList<>();
            for (Identifier name : local.names()) {
                names.add(rewriteBinding(name));
            }
            return new LocalDeclaration(local.loc(), names, values);
        }
        if (statement instanceof Assignment assignment) {
            List<Expression> targets = new ArrayList<>();
            for (Expression target : assignment.targets()) {
                targets.add(rewriteTarget(target));
            }
            return new Assignment(assignment.loc(), targets, rewriteExpressions(assignment.values()));
        }
        if (statement instanceof CompoundAssignment compound) {
            return new CompoundAssignment(compound.loc(), rewriteTarget(compound.target()),
                compound.operator(), rewriteExpression(compound.value()));
        }
        if (statement instanceof ExpressionStatement expressionStatement) {
            Expression rewritten = rewriteExpression(expressionStatement.expression());
            if (!(rewritten instanceof CallExpression) && !(rewritten instanceof MethodCallExpression)) {
                // Only calls may stand as statements
                rewritten = expressionStatement.expression();
            }
            return new ExpressionStatement(expressionStatement.loc(), rewritten);
        }
        if (statement instanceof FunctionDeclaration declaration) {
            return new FunctionDeclaration(declaration.loc(), declaration.local(), rewriteBinding(declaration.name()),
                declaration.path(), declaration.method(), rewriteFunction(declaration.function()));
        }
        if (statement instanceof IfStatement ifStatement) {
            List<IfClause> clauses = new ArrayList<>();
            for (IfClause clause : ifStatement.clauses()) {
                clauses.add(new IfClause(clause.loc(), rewriteExpression(clause.condition()), rewriteBlock(clause.body())));
            }
            Block elseBlock = ifStatement.elseBlock() == null ? null : rewriteBlock(ifStatement.elseBlock());
            return new IfStatement(ifStatement.loc(), clauses, elseBlock);
        }
        if (statement instanceof WhileStatement whileStatement) {
            return new WhileStatement(whileStatement.loc(), rewriteExpression(whileStatement.condition()),
                rewriteBlock(whileStatement.body()));
        }
        if (statement instanceof RepeatStatement repeat) {
            Block body = rewriteBlock(repeat.body());
            return new RepeatStatement(repeat.loc(), body, rewriteExpression(repeat.condition()));
        }
        if (statement instanceof NumericForStatement numericFor) {
            Expression start = rewriteExpression(numericFor.start());
            Expression limit = rewriteExpression(numericFor.limit());
            Expression step = numericFor.step() == null ? null : rewriteExpression(numericFor.step());
            return new NumericForStatement(numericFor.loc(), rewriteBinding(numericFor.variable()),
                start, limit, step, rewriteBlock(numericFor.body()));
        }
        if (statement instanceof GenericForStatement genericFor) {
            List<Expression> iterators = rewriteExpressions(genericFor.iterators());
            List<Identifier> variables = new ArrayList<>();
            for (Identifier variable : genericFor.variables()) {
                variables.add(rewriteBinding(variable));
            }
            return new GenericForStatement(genericFor.loc(), variables, iterators, rewriteBlock(genericFor.body()));
        }
        if (statement instanceof DoStatement doStatement) {
            return new DoStatement(doStatement.loc(), rewriteBlock(doStatement.body()));
        }
        if (statement instanceof ReturnStatement returnStatement) {
            return new ReturnStatement(returnStatement.loc(), rewriteExpressions(returnStatement.values()));
        }
        // break, continue, goto, labels
        return statement;
    }

    private Expression rewriteTarget(Expression target) {
        if (target instanceof Identifier identifier) {
            return rewriteBinding(identifier);
        }
        return rewriteExpression(target);
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    protected List<Expression> rewriteExpressions(List<Expression> expressions) {
        List<Expression> rewritten = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            rewritten.add(rewriteExpression(expression));
        }
        return rewritten;
    }

    public Expression rewriteExpression(Expression expression) {
        return transformExpression(rebuildExpression(expression));
    }

    private Expression rebuildExpression(Expression expression) {
        if (expression instanceof BinaryExpression binary) {
            return new BinaryExpression(binary.loc(), binary.operator(),
                rewriteExpression(binary.left()), rewriteExpression(binary.right()));
        }
        if (expression instanceof UnaryExpression unary) {
            return new UnaryExpression(unary.loc(), unary.operator(), rewriteExpression(unary.operand()));
        }
        if (expression instanceof TableConstructor table) {
            List<TableField> fields = new ArrayList<>();
            for (TableField field : table.fields()) {
                Expression key = field.kind() == TableField.Kind.KEYED ? rewriteExpression(field.key()) : field.key();
                fields.add(field.withParts(key, rewriteExpression(field.value())));
            }
            return new TableConstructor(table.loc(), fields);
        }
        if (expression instanceof FunctionExpression function) {
            return rewriteFunction(function);
        }
        if (expression instanceof IndexExpression index) {
            Expression key = index.dotted() ? index.key() : rewriteExpression(index.key());
            return new IndexExpression(index.loc(), rewriteExpression(index.object()), key, index.dotted());
        }
        if (expression instanceof CallExpression call) {
            return new CallExpression(call.loc(), rewriteExpression(call.callee()), rewriteExpressions(call.arguments()));
        }
        if (expression instanceof MethodCallExpression methodCall) {
            return new MethodCallExpression(methodCall.loc(), rewriteExpression(methodCall.object()),
                methodCall.method(), rewriteExpressions(methodCall.arguments()));
        }
        if (expression instanceof ParenExpression paren) {
            return new ParenExpression(paren.loc(), rewriteExpression(paren.expression()));
        }
        // Literal, Identifier, VarargExpression
        return expression;
    }

    protected FunctionExpression rewriteFunction(FunctionExpression function) {
        List<Identifier> parameters = new ArrayList<>();
        for (Identifier parameter : function.parameters()) {
            parameters.add(rewriteBinding(parameter));
        }
        functionScopes.push(function.body().scope());
        try {
            return new FunctionExpression(function.loc(), parameters, function.vararg(), rewriteBlock(function.body()));
        } finally {
            functionScopes.pop();
        }
    }
}
