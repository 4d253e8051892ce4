package com.moonshift.pass;

import com.moonshift.ast.*;
import com.moonshift.pipeline.Warning;
import com.moonshift.value.LuaStrings;
import com.moonshift.value.LuaValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Undoes control-flow and expression noise: redundant parentheses, double negation in
 * conditions, negated comparisons, {@code and}/{@code or} with a constant left side,
 * {@code t["name"]} spelled as {@code t.name}, branches on constant conditions, loops that
 * provably run once or never, and {@code do ... end} blocks that scope nothing.
 *
 * <p>Blocks that get inlined are first wrapped in {@code do ... end}; the wrapper is dropped
 * when the block declares no locals or labels and does not end in a jump that would
 * stop being last.</p>
 */
public class ExpressionSimplifier implements Pass {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionSimplifier.class);

    public static final String NAME = "expression-simplifier";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Chunk apply(Chunk chunk, PassContext context) {
        Chunk result = new Simplifier(context).rewrite(chunk);
        LOG.debug("Simplification done");
        return result;
    }

    private static final class Simplifier extends AstRewriter {

        Simplifier(PassContext context) {
            super(NAME, context);
        }

        // ====================================================================
        // Expressions
        // ====================================================================

        @Override
        protected Expression transformExpression(Expression expression) {
            if (expression instanceof ParenExpression paren && !paren.expression().isMultiValued()) {
                return paren.expression();
            }
            if (expression instanceof UnaryExpression unary && unary.operator() == UnaryOperator.NOT
                && unary.operand() instanceof BinaryExpression comparison) {
                BinaryOperator flipped = switch (comparison.operator()) {
                    case EQ -> BinaryOperator.NE;
                    case NE -> BinaryOperator.EQ;
                    default -> null;
                };
                if (flipped != null) {
                    return new BinaryExpression(unary.loc(), flipped, comparison.left(), comparison.right());
                }
            }
            if (expression instanceof BinaryExpression binary && binary.left() instanceof Literal left
                && (binary.operator() == BinaryOperator.AND || binary.operator() == BinaryOperator.OR)) {
                boolean keepLeft = binary.operator() == BinaryOperator.AND ? !left.value().isTruthy() : left.value().isTruthy();
                if (keepLeft) {
                    return left;
                }
                // The result of and/or is a single value
                Expression right = binary.right();
                return right.isMultiValued() ? new ParenExpression(right.loc(), right) : right;
            }
            if (expression instanceof IndexExpression index && !index.dotted()
                && index.key() instanceof Literal key && key.value() instanceof LuaValue.Str name
                && LuaStrings.isIdentifier(name.bytes())) {
                return new IndexExpression(index.loc(), index.object(), new Literal(key.loc(), name, null), true);
            }
            return expression;
        }

        private static Expression condition(Expression condition) {
            Expression result = condition;
            while (result instanceof UnaryExpression outer && outer.operator() == UnaryOperator.NOT
                && outer.operand() instanceof UnaryExpression inner && inner.operator() == UnaryOperator.NOT) {
                result = inner.operand();
            }
            return result;
        }

        // ====================================================================
        // Statements
        // ====================================================================

        @Override
        protected List<Statement> transformStatement(Statement statement) {
            if (statement instanceof IfStatement ifStatement) {
                return simplifyIf(ifStatement);
            }
            if (statement instanceof WhileStatement whileStatement) {
                return simplifyWhile(whileStatement);
            }
            if (statement instanceof RepeatStatement repeat) {
                return simplifyRepeat(repeat);
            }
            if (statement instanceof DoStatement doStatement && doStatement.body().isEmpty()) {
                // Keep any comments it held
                return doStatement.body().statements();
            }
            return List.of(statement);
        }

        private List<Statement> simplifyIf(IfStatement ifStatement) {
            List<IfClause> kept = new ArrayList<>();
            Block elseBlock = ifStatement.elseBlock();
            for (IfClause clause : ifStatement.clauses()) {
                Expression condition = condition(clause.condition());
                if (condition instanceof Literal literal) {
                    if (!literal.value().isTruthy()) {
                        continue;
                    }
                    if (kept.isEmpty()) {
                        return inline(clause.body());
                    }
                    // Later clauses are unreachable
                    elseBlock = clause.body();
                    break;
                }
                kept.add(new IfClause(clause.loc(), condition, clause.body()));
            }
            if (kept.isEmpty()) {
                return elseBlock == null ? List.of() : inline(elseBlock);
            }
            return List.of(new IfStatement(ifStatement.loc(), kept, elseBlock));
        }

        private List<Statement> simplifyWhile(WhileStatement whileStatement) {
            Expression condition = condition(whileStatement.condition());
            WhileStatement simplified = new WhileStatement(whileStatement.loc(), condition, whileStatement.body());
            if (!(condition instanceof Literal literal)) {
                return List.of(simplified);
            }
            if (!literal.value().isTruthy()) {
                return List.of();
            }
            // while true do ... break end runs its body exactly once
            Block body = whileStatement.body();
            Statement last = body.lastCodeStatement();
            if (!(last instanceof BreakStatement)) {
                return List.of(simplified);
            }
            List<Statement> statements = new ArrayList<>(body.statements());
            statements.remove(last);
            Block once = body.withStatements(statements);
            if (!runsOnce(once, whileStatement)) {
                return List.of(simplified);
            }
            return inline(once);
        }

        private List<Statement> simplifyRepeat(RepeatStatement repeat) {
            Expression condition = condition(repeat.condition());
            RepeatStatement simplified = new RepeatStatement(repeat.loc(), repeat.body(), condition);
            if (condition instanceof Literal literal && literal.value().isTruthy() && runsOnce(repeat.body(), repeat)) {
                return inline(repeat.body());
            }
            return List.of(simplified);
        }

        // A single-pass loop body may be inlined only when nothing in it exits the loop
        private boolean runsOnce(Block body, Statement loop) {
            if (LoopExits.hasGoto(body)) {
                context.warn(NAME, Warning.Category.UNSUPPORTED_CONSTRUCT,
                    "single-pass loop containing goto was kept", loop.loc());
                return false;
            }
            return !LoopExits.exitsLoop(body);
        }

        private static List<Statement> inline(Block block) {
            return List.of(new DoStatement(block.loc(), block));
        }

        // ====================================================================
        // Flattening
        // ====================================================================

        @Override
        protected Block finishBlock(Block block) {
            List<Statement> statements = block.statements();
            boolean hasDo = false;
            for (Statement statement : statements) {
                if (statement instanceof DoStatement) {
                    hasDo = true;
                    break;
                }
            }
            if (!hasDo) {
                return block;
            }
            List<Statement> flattened = new ArrayList<>();
            for (int i = 0; i < statements.size(); i++) {
                Statement statement = statements.get(i);
                if (statement instanceof DoStatement doStatement && canFlatten(doStatement.body(), isLastCode(statements, i))) {
                    flattened.addAll(doStatement.body().statements());
                } else {
                    flattened.add(statement);
                }
            }
            return block.withStatements(flattened);
        }

        private static boolean isLastCode(List<Statement> statements, int index) {
            for (int i = index + 1; i < statements.size(); i++) {
                if (!(statements.get(i) instanceof CommentStatement)) {
                    return false;
                }
            }
            return true;
        }

        private static boolean canFlatten(Block body, boolean last) {
            for (Statement statement : body.statements()) {
                if (statement instanceof LocalDeclaration
                    || statement instanceof LabelStatement
                    || statement instanceof GotoStatement
                    || (statement instanceof FunctionDeclaration declaration && declaration.local())) {
                    return false;
                }
            }
            Statement tail = body.lastCodeStatement();
            boolean endsInJump = tail instanceof ReturnStatement || tail instanceof BreakStatement || tail instanceof ContinueStatement;
            return !endsInJump || last;
        }
    }

    /**
     * Finds statements that leave or restart the innermost loop around a block.
     */
    static final class LoopExits {

        private LoopExits() {
        }

        static boolean exitsLoop(Block body) {
            boolean[] found = {false};
            new AstWalker() {
                @Override
                protected boolean enter(Node node) {
                    if (node instanceof BreakStatement || node instanceof ContinueStatement) {
                        found[0] = true;
                    }
                    return !found[0] && !isLoop(node) && !(node instanceof FunctionExpression);
                }
            }.walk(body);
            return found[0];
        }

        static boolean hasGoto(Block body) {
            boolean[] found = {false};
            new AstWalker() {
                @Override
                protected boolean enter(Node node) {
                    if (node instanceof GotoStatement) {
                        found[0] = true;
                    }
                    return !found[0] && !(node instanceof FunctionExpression);
                }
            }.walk(body);
            return found[0];
        }

        private static boolean isLoop(Node node) {
            return node instanceof WhileStatement
                || node instanceof RepeatStatement
                || node instanceof NumericForStatement
                || node instanceof GenericForStatement;
        }
    }
}
