package com.moonshift.pass;

import com.moonshift.ast.Chunk;
import com.moonshift.ast.Expression;
import com.moonshift.ast.Identifier;
import com.moonshift.ast.IndexExpression;

import java.util.HashSet;
import java.util.Set;

/**
 * Which globals a chunk leaves untouched. A global is pristine when the chunk never assigns
 * it and no local anywhere in the chunk carries its name; only then may a pass assume
 * {@code string.char} is the library function.
 */
public final class GlobalUsage {

    private final Set<String> writtenGlobals = new HashSet<>();
    private final Set<String> localNames = new HashSet<>();

    private GlobalUsage() {
    }

    public static GlobalUsage of(Chunk chunk) {
        GlobalUsage usage = new GlobalUsage();
        new AstWalker() {
            @Override
            protected void declare(Identifier identifier) {
                usage.localNames.add(identifier.name());
            }

            @Override
            protected void write(Identifier identifier) {
                if (identifier.symbol().isGlobal()) {
                    usage.writtenGlobals.add(identifier.name());
                }
            }
        }.walk(chunk);
        return usage;
    }

    public boolean isPristine(String name) {
        return !writtenGlobals.contains(name) && !localNames.contains(name);
    }

    /**
     * True when some local in the chunk is named {@code name}.
     */
    public boolean isLocalName(String name) {
        return localNames.contains(name);
    }

    public boolean isWritten(String name) {
        return writtenGlobals.contains(name);
    }

    /**
     * True for a read of the pristine global {@code name}.
     */
    public boolean isPristineGlobal(Expression expression, String name) {
        return expression instanceof Identifier identifier && identifier.isGlobal(name) && isPristine(name);
    }

    /**
     * True for {@code library.function} (or {@code library["function"]}) on a pristine global.
     */
    public boolean isLibraryFunction(Expression expression, String library, String function) {
        return expression instanceof IndexExpression index
            && isPristineGlobal(index.object(), library)
            && function.equals(index.fieldName());
    }
}
