package com.moonshift.pass;

import com.moonshift.ast.*;
import com.moonshift.pipeline.Warning;
import com.moonshift.value.LuaValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reports patterns that may stop working once locals are renamed and strings re-encoded.
 * The tree is returned unchanged; findings are {@link Warning.Category#LINT} warnings.
 */
public class ObfuscationLinter implements Pass {

    private static final Logger LOG = LoggerFactory.getLogger(ObfuscationLinter.class);

    public static final String NAME = "obfuscation-linter";

    private static final Set<String> LOOKUP_METHODS = Set.of("GetService", "WaitForChild", "FindFirstChild");
    private static final Set<String> ENVIRONMENT_FUNCTIONS = Set.of("getfenv", "setfenv");
    private static final int MIN_NAME_LENGTH = 3;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Chunk apply(Chunk chunk, PassContext context) {
        Set<String> localNames = new LinkedHashSet<>();
        new AstWalker() {
            @Override
            protected void declare(Identifier identifier) {
                if (identifier.name().length() >= MIN_NAME_LENGTH) {
                    localNames.add(identifier.name());
                }
            }
        }.walk(chunk);

        int before = context.warnings().size();
        new AstWalker() {
            @Override
            protected boolean enter(Node node) {
                if (node instanceof Literal literal && literal.value() instanceof LuaValue.Str str) {
                    checkString(str.bytes(), literal.loc(), localNames, context);
                } else if (node instanceof MethodCallExpression call && LOOKUP_METHODS.contains(call.method())) {
                    checkLookup(call.method(), call.arguments(), call.loc(), context);
                } else if (node instanceof CallExpression call && isInstanceNew(call.callee())) {
                    checkLookup("Instance.new", call.arguments(), call.loc(), context);
                } else if (node instanceof Identifier identifier && identifier.symbol() != null
                    && identifier.symbol().isGlobal() && ENVIRONMENT_FUNCTIONS.contains(identifier.name())) {
                    context.warn(NAME, Warning.Category.LINT,
                        identifier.name() + " exposes variables by name; renamed locals will not be found",
                        identifier.loc());
                }
                return true;
            }
        }.walk(chunk);
        LOG.debug("Lint found {} issues", context.warnings().size() - before);
        return chunk;
    }

    private static void checkString(String text, SourceLocation loc, Set<String> localNames, PassContext context) {
        for (String name : localNames) {
            if (text.contains(name) && Pattern.compile("\\b" + Pattern.quote(name) + "\\b").matcher(text).find()) {
                context.warn(NAME, Warning.Category.LINT,
                    "string mentions local '" + name + "', which will be renamed", loc);
            }
        }
    }

    private static void checkLookup(String what, List<Expression> arguments, SourceLocation loc, PassContext context) {
        if (arguments.isEmpty() || !(arguments.get(0) instanceof Literal)) {
            context.warn(NAME, Warning.Category.LINT,
                what + " called with a computed name", loc);
        }
    }

    private static boolean isInstanceNew(Expression callee) {
        return callee instanceof IndexExpression index
            && index.object() instanceof Identifier object
            && object.isGlobal("Instance")
            && "new".equals(index.fieldName());
    }
}
