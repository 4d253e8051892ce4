package com.moonshift.pass;

import com.moonshift.TokenType;
import com.moonshift.ast.*;
import com.moonshift.scope.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Renames local symbols. Every new name is unique in the whole chunk and differs from every
 * name already written in it, so a renamed variable can never capture or be captured by
 * another one. Globals and implicit {@code self} parameters keep their names.
 */
public class IdentifierRenamer implements Pass {

    private static final Logger LOG = LoggerFactory.getLogger(IdentifierRenamer.class);

    public enum Strategy {
        /** Readable names for symbols whose names look machine-generated. */
        CANONICALIZE,
        /** Random names for every local symbol. */
        OBFUSCATE
    }

    private static final Pattern CONFUSABLE = Pattern.compile("[lI1O0_]{3,}");
    private static final Pattern HEX_LIKE = Pattern.compile("_0[xX][0-9a-fA-F]+");
    private static final Pattern VOWEL = Pattern.compile("[aeiouAEIOU]");
    private static final String LETTERS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String NAME_CHARS = LETTERS + "0123456789_";

    private final Strategy strategy;

    public IdentifierRenamer(Strategy strategy) {
        this.strategy = strategy;
    }

    @Override
    public String name() {
        return strategy == Strategy.CANONICALIZE ? "identifier-canonicalizer" : "identifier-obfuscator";
    }

    @Override
    public Chunk apply(Chunk chunk, PassContext context) {
        Declarations declarations = Declarations.of(chunk);
        Set<String> taken = new HashSet<>(declarations.usedNames);
        Map<Symbol, String> names = new HashMap<>();
        int[] counters = new int[4];
        for (Symbol symbol : declarations.symbols) {
            if (symbol.kind() == Symbol.Kind.SELF || symbol.isGlobal()) {
                continue;
            }
            String newName;
            if (strategy == Strategy.OBFUSCATE) {
                newName = randomName(context.random(), context.options().obfuscatedNameLength(), taken);
            } else if (looksGenerated(symbol.name())) {
                newName = readableName(symbol, declarations.functionBound.contains(symbol), counters, taken);
            } else {
                continue;
            }
            taken.add(newName);
            names.put(symbol, newName);
        }
        LOG.debug("Renaming {} of {} local symbols", names.size(), declarations.symbols.size());
        if (names.isEmpty()) {
            return chunk;
        }
        return new Renamer(name(), context, names).rewrite(chunk);
    }

    /**
     * True for names an obfuscator would produce: confusable glyph runs ({@code lIl1lI}),
     * hex-like names ({@code _0x1f3a}), runs of underscores, and long names that are
     * mostly consonants with frequent case or digit changes.
     */
    static boolean looksGenerated(String name) {
        if (name.length() < 2) {
            return false;
        }
        if (name.chars().allMatch(c -> c == '_')) {
            return true;
        }
        if (CONFUSABLE.matcher(name).matches() || HEX_LIKE.matcher(name).matches()) {
            return true;
        }
        if (name.length() > 15 && !VOWEL.matcher(name).find()) {
            return true;
        }
        return name.length() >= 6 && classChanges(name) >= 4 && vowelCount(name) * 4 < name.length();
    }

    private static int classChanges(String name) {
        int changes = 0;
        for (int i = 1; i < name.length(); i++) {
            if (charClass(name.charAt(i)) != charClass(name.charAt(i - 1))) {
                changes++;
            }
        }
        return changes;
    }

    private static int charClass(char c) {
        if (Character.isLowerCase(c)) {
            return 0;
        }
        if (Character.isUpperCase(c)) {
            return 1;
        }
        return Character.isDigit(c) ? 2 : 3;
    }

    private static int vowelCount(String name) {
        int count = 0;
        for (int i = 0; i < name.length(); i++) {
            if ("aeiouAEIOU".indexOf(name.charAt(i)) >= 0) {
                count++;
            }
        }
        return count;
    }

    private static String readableName(Symbol symbol, boolean functionBound, int[] counters, Set<String> taken) {
        String prefix;
        int slot;
        if (symbol.kind() == Symbol.Kind.PARAMETER) {
            prefix = "arg";
            slot = 0;
        } else if (symbol.kind() == Symbol.Kind.FOR_VARIABLE) {
            prefix = "iter";
            slot = 1;
        } else if (functionBound) {
            prefix = "func";
            slot = 2;
        } else {
            prefix = "var";
            slot = 3;
        }
        String candidate;
        do {
            counters[slot]++;
            candidate = prefix + counters[slot];
        } while (taken.contains(candidate));
        return candidate;
    }

    /**
     * A random identifier of {@code length} characters that is neither a keyword nor in {@code taken}.
     */
    static String randomName(Random random, int length, Set<String> taken) {
        while (true) {
            StringBuilder sb = new StringBuilder(length);
            sb.append(LETTERS.charAt(random.nextInt(LETTERS.length())));
            for (int i = 1; i < length; i++) {
                sb.append(NAME_CHARS.charAt(random.nextInt(NAME_CHARS.length())));
            }
            String candidate = sb.toString();
            if (!taken.contains(candidate) && TokenType.keyword(candidate) == null) {
                return candidate;
            }
        }
    }

    // ========================================================================
    // Collection
    // ========================================================================

    /**
     * Every identifier name written anywhere in the chunk, locals and globals alike.
     */
    static Set<String> usedNames(Chunk chunk) {
        return Declarations.of(chunk).usedNames;
    }

    private static final class Declarations {
        final Set<Symbol> symbols = new LinkedHashSet<>();
        final Set<Symbol> functionBound = new HashSet<>();
        final Set<String> usedNames = new HashSet<>();

        static Declarations of(Chunk chunk) {
            Declarations declarations = new Declarations();
            new AstWalker() {
                @Override
                protected boolean enter(Node node) {
                    if (node instanceof Identifier identifier) {
                        declarations.usedNames.add(identifier.name());
                    } else if (node instanceof LocalDeclaration local) {
                        for (int i = 0; i < local.names().size() && i < local.values().size(); i++) {
                            if (local.values().get(i) instanceof FunctionExpression) {
                                declarations.functionBound.add(local.names().get(i).symbol());
                            }
                        }
                    } else if (node instanceof FunctionDeclaration declaration && declaration.local()) {
                        declarations.functionBound.add(declaration.name().symbol());
                    }
                    return true;
                }

                @Override
                protected void declare(Identifier identifier) {
                    declarations.usedNames.add(identifier.name());
                    declarations.symbols.add(requireSymbol(identifier));
                }

                @Override
                protected void write(Identifier identifier) {
                    declarations.usedNames.add(identifier.name());
                }
            }.walk(chunk);
            return declarations;
        }
    }

    private static Symbol requireSymbol(Identifier identifier) {
        if (identifier.symbol() == null) {
            throw new InternalInvariantException("unresolved identifier '" + identifier.name() + "'", identifier.loc());
        }
        return identifier.symbol();
    }

    // ========================================================================
    // Rewriting
    // ========================================================================

    static final class Renamer extends AstRewriter {
        private final Map<Symbol, String> names;

        Renamer(String passName, PassContext context, Map<Symbol, String> names) {
            super(passName, context);
            this.names = names;
        }

        @Override
        protected Expression transformExpression(Expression expression) {
            if (expression instanceof Identifier identifier) {
                return rename(identifier);
            }
            return expression;
        }

        @Override
        protected Identifier rewriteBinding(Identifier identifier) {
            return rename(identifier);
        }

        private Identifier rename(Identifier identifier) {
            String newName = names.get(requireSymbol(identifier));
            return newName == null ? identifier : identifier.withName(newName);
        }
    }
}
