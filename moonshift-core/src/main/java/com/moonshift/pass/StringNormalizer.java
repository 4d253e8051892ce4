package com.moonshift.pass;

import com.moonshift.ast.*;
import com.moonshift.value.LuaStrings;
import com.moonshift.value.LuaValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes strings that are built at run time from constants: {@code string.char(72, 105)},
 * {@code string.byte("A")}, {@code table.concat({"a", "b"})}, {@code ("x"):rep(3)},
 * {@code ("olleh"):reverse()} and escape-heavy literals. Literal {@code loadstring} payloads
 * are parsed and inlined as functions.
 *
 * <p>Library calls are only folded when the library global is pristine (never assigned,
 * never shadowed by a local), so a script that redefines {@code string.char} through a
 * local {@code string} table is left alone.</p>
 */
public class StringNormalizer implements Pass {

    private static final Logger LOG = LoggerFactory.getLogger(StringNormalizer.class);

    public static final String NAME = "string-normalizer";

    // Upper bound on strings produced by rep()
    static final int MAX_REPEAT_LENGTH = 4096;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Chunk apply(Chunk chunk, PassContext context) {
        GlobalUsage globals = GlobalUsage.of(chunk);
        Chunk result = new Rewriter(context, globals, chunk, 0).rewrite(chunk);
        LOG.debug("String normalization done");
        return result;
    }

    static final class Rewriter extends AstRewriter {
        private final GlobalUsage globals;
        private final Chunk chunk;
        private final int loadstringDepth;

        Rewriter(PassContext context, GlobalUsage globals, Chunk chunk, int loadstringDepth) {
            super(NAME, context);
            this.globals = globals;
            this.chunk = chunk;
            this.loadstringDepth = loadstringDepth;
        }

        @Override
        protected Expression transformExpression(Expression expression) {
            if (expression instanceof Literal literal) {
                return respell(literal);
            }
            if (expression instanceof CallExpression call) {
                return foldCall(call);
            }
            if (expression instanceof MethodCallExpression methodCall) {
                return foldMethodCall(methodCall);
            }
            return expression;
        }

        private Expression foldCall(CallExpression call) {
            Expression callee = call.callee();
            List<Expression> arguments = call.arguments();
            if (globals.isLibraryFunction(callee, "string", "char")) {
                String decoded = charCodes(arguments);
                if (decoded == null && arguments.size() == 1) {
                    decoded = unpackedCharCodes(arguments.get(0), globals);
                }
                return decoded != null ? stringLiteral(call, decoded) : call;
            }
            if (globals.isLibraryFunction(callee, "string", "byte") && arguments.size() == 1) {
                String s = stringValue(arguments.get(0));
                return s != null && !s.isEmpty() ? new Literal(call.loc(), LuaValue.of(s.charAt(0)), null) : call;
            }
            if (globals.isLibraryFunction(callee, "string", "rep") && arguments.size() == 2) {
                String repeated = repeat(stringValue(arguments.get(0)), arguments.get(1));
                return repeated != null ? stringLiteral(call, repeated) : call;
            }
            if (globals.isLibraryFunction(callee, "string", "reverse") && arguments.size() == 1) {
                String s = stringValue(arguments.get(0));
                return s != null ? stringLiteral(call, new StringBuilder(s).reverse().toString()) : call;
            }
            if (globals.isLibraryFunction(callee, "table", "concat") && !arguments.isEmpty() && arguments.size() <= 2) {
                String joined = concat(arguments);
                return joined != null ? stringLiteral(call, joined) : call;
            }
            if ((globals.isPristineGlobal(callee, "loadstring") || globals.isPristineGlobal(callee, "load"))
                && arguments.size() == 1) {
                String payload = stringValue(arguments.get(0));
                if (payload != null) {
                    return LoadstringInliner.inline(call, payload, this);
                }
            }
            return call;
        }

        private Expression foldMethodCall(MethodCallExpression methodCall) {
            String s = stringValue(methodCall.object());
            if (s == null) {
                return methodCall;
            }
            List<Expression> arguments = methodCall.arguments();
            switch (methodCall.method()) {
                case "byte" -> {
                    if (arguments.isEmpty() && !s.isEmpty()) {
                        return new Literal(methodCall.loc(), LuaValue.of(s.charAt(0)), null);
                    }
                }
                case "rep" -> {
                    if (arguments.size() == 1) {
                        String repeated = repeat(s, arguments.get(0));
                        if (repeated != null) {
                            return stringLiteral(methodCall, repeated);
                        }
                    }
                }
                case "reverse" -> {
                    if (arguments.isEmpty()) {
                        return stringLiteral(methodCall, new StringBuilder(s).reverse().toString());
                    }
                }
                default -> {
                }
            }
            return methodCall;
        }

        /**
         * Parses and normalizes an inlined payload one loadstring level deeper.
         */
        Chunk normalizePayload(Chunk payload, SourceLocation at) {
            int limit = context.options().loadstringDepth();
            if (loadstringDepth + 1 > limit) {
                throw new UnsupportedConstructException("loadstring nesting deeper than " + limit + " levels", at);
            }
            return new Rewriter(context, globals, payload, loadstringDepth + 1).rewrite(payload);
        }

        GlobalUsage globals() {
            return globals;
        }

        Chunk chunk() {
            return chunk;
        }
    }

    // ========================================================================
    // Constant helpers
    // ========================================================================

    // A quoted literal spelled with escapes is re-spelled canonically by the printer
    private static Literal respell(Literal literal) {
        if (literal.isString() && literal.raw() != null && literal.raw().indexOf('\\') >= 0) {
            return new Literal(literal.loc(), literal.value(), null);
        }
        return literal;
    }

    private static Literal stringLiteral(Expression replaced, String bytes) {
        return new Literal(replaced.loc(), LuaValue.ofBytes(bytes), null);
    }

    static String stringValue(Expression expression) {
        Expression inner = expression;
        while (inner instanceof ParenExpression paren) {
            inner = paren.expression();
        }
        if (inner instanceof Literal literal && literal.value() instanceof LuaValue.Str s) {
            return s.bytes();
        }
        return null;
    }

    private static Integer byteValue(Expression expression) {
        if (expression instanceof Literal literal && literal.value() instanceof LuaValue.Num n
            && n.isIntegral() && n.value() >= 0 && n.value() <= 255) {
            return (int) n.value();
        }
        return null;
    }

    private static String charCodes(List<Expression> arguments) {
        StringBuilder sb = new StringBuilder(arguments.size());
        for (Expression argument : arguments) {
            Integer b = byteValue(argument);
            if (b == null) {
                return null;
            }
            sb.append((char) b.intValue());
        }
        return sb.toString();
    }

    // string.char(unpack({...})) and string.char(table.unpack({...}))
    private static String unpackedCharCodes(Expression argument, GlobalUsage globals) {
        if (!(argument instanceof CallExpression call) || call.arguments().size() != 1
            || !(call.arguments().get(0) instanceof TableConstructor table)) {
            return null;
        }
        if (!globals.isPristineGlobal(call.callee(), "unpack") && !globals.isLibraryFunction(call.callee(), "table", "unpack")) {
            return null;
        }
        List<Expression> values = new ArrayList<>();
        for (TableField field : table.fields()) {
            if (field.kind() != TableField.Kind.POSITIONAL) {
                return null;
            }
            values.add(field.value());
        }
        return charCodes(values);
    }

    private static String repeat(String s, Expression count) {
        if (s == null || !(count instanceof Literal literal) || !(literal.value() instanceof LuaValue.Num n)
            || !n.isIntegral()) {
            return null;
        }
        long times = Math.max(0, (long) n.value());
        if (times * s.length() > MAX_REPEAT_LENGTH) {
            return null;
        }
        return s.repeat((int) times);
    }

    private static String concat(List<Expression> arguments) {
        if (!(arguments.get(0) instanceof TableConstructor table)) {
            return null;
        }
        String separator = "";
        if (arguments.size() == 2) {
            separator = stringValue(arguments.get(1));
            if (separator == null) {
                return null;
            }
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < table.fields().size(); i++) {
            TableField field = table.fields().get(i);
            if (field.kind() != TableField.Kind.POSITIONAL || !(field.value() instanceof Literal literal)) {
                return null;
            }
            String piece;
            if (literal.value() instanceof LuaValue.Str s) {
                piece = s.bytes();
            } else if (literal.value() instanceof LuaValue.Num n) {
                piece = LuaStrings.integralToString(n.value());
            } else {
                piece = null;
            }
            if (piece == null) {
                return null;
            }
            if (i > 0) {
                sb.append(separator);
            }
            sb.append(piece);
        }
        return sb.toString();
    }
}
