package com.moonshift.pass;

import com.moonshift.ast.*;
import com.moonshift.scope.Symbol;
import com.moonshift.value.LuaValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Folds operators over literal operands and propagates constant locals.
 *
 * <p>A local is propagated only when it is initialized with a literal and never assigned
 * anywhere, and only into reads in the same function: a closure could run after any
 * assignment, so uses inside nested functions keep the variable. Declarations are never
 * removed. Folding and propagation repeat until nothing changes (bounded).</p>
 */
public class ConstantFolder implements Pass {

    private static final Logger LOG = LoggerFactory.getLogger(ConstantFolder.class);

    public static final String NAME = "constant-folder";

    private static final int MAX_ITERATIONS = 4;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Chunk apply(Chunk chunk, PassContext context) {
        Chunk current = chunk;
        for (int iteration = 1; iteration <= MAX_ITERATIONS; iteration++) {
            Map<Symbol, Literal> constants = findConstants(current, context.options().maxPropagatedStringLength());
            Folder folder = new Folder(context, constants);
            current = folder.rewrite(current);
            LOG.debug("Folding iteration {}: {} constant locals, {} rewrites", iteration, constants.size(), folder.rewrites);
            if (folder.rewrites == 0) {
                break;
            }
        }
        return current;
    }

    /**
     * Locals with a literal initializer and no assignment anywhere in the chunk.
     */
    static Map<Symbol, Literal> findConstants(Chunk chunk, int maxStringLength) {
        Map<Symbol, Literal> candidates = new HashMap<>();
        Set<Symbol> written = new HashSet<>();
        new AstWalker() {
            @Override
            protected boolean enter(Node node) {
                if (node instanceof LocalDeclaration local) {
                    for (int i = 0; i < local.names().size() && i < local.values().size(); i++) {
                        if (local.values().get(i) instanceof Literal literal && isPropagatable(literal, maxStringLength)) {
                            candidates.put(local.names().get(i).symbol(), literal);
                        }
                    }
                }
                return true;
            }

            @Override
            protected void write(Identifier identifier) {
                written.add(identifier.symbol());
            }
        }.walk(chunk);
        candidates.keySet().removeAll(written);
        return candidates;
    }

    private static boolean isPropagatable(Literal literal, int maxStringLength) {
        return !(literal.value() instanceof LuaValue.Str s) || s.length() <= maxStringLength;
    }

    private static final class Folder extends AstRewriter {
        private final Map<Symbol, Literal> constants;
        private int rewrites = 0;

        Folder(PassContext context, Map<Symbol, Literal> constants) {
            super(NAME, context);
            this.constants = constants;
        }

        @Override
        protected Expression transformExpression(Expression expression) {
            if (expression instanceof Identifier identifier) {
                return propagate(identifier);
            }
            if (expression instanceof ParenExpression paren && paren.expression() instanceof Literal literal) {
                rewrites++;
                return literal;
            }
            if (expression instanceof BinaryExpression binary
                && binary.left() instanceof Literal left && binary.right() instanceof Literal right) {
                return fold(binary, ConstantEvaluator.binary(binary.operator(), left.value(), right.value()));
            }
            if (expression instanceof UnaryExpression unary && unary.operand() instanceof Literal operand) {
                return fold(unary, ConstantEvaluator.unary(unary.operator(), operand.value()));
            }
            return expression;
        }

        private Expression propagate(Identifier identifier) {
            Symbol symbol = identifier.symbol();
            if (symbol == null) {
                throw new InternalInvariantException("identifier '" + identifier.name() + "' has no symbol", identifier.loc());
            }
            Literal value = constants.get(symbol);
            if (value == null || symbol.functionScope() != currentFunctionScope()) {
                return identifier;
            }
            rewrites++;
            return new Literal(identifier.loc(), value.value(), value.raw());
        }

        private Expression fold(Expression original, LuaValue result) {
            if (result == null) {
                return original;
            }
            rewrites++;
            return new Literal(original.loc(), result, null);
        }
    }
}
