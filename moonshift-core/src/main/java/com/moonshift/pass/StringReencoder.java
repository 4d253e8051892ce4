package com.moonshift.pass;

import com.moonshift.Parser;
import com.moonshift.ast.*;
import com.moonshift.scope.Symbol;
import com.moonshift.value.LuaStrings;
import com.moonshift.value.LuaValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Replaces string literals with constructions that rebuild the same bytes at run time.
 * Each literal independently gets one of:
 * <ul>
 *   <li>a literal spelled entirely with decimal escapes</li>
 *   <li>{@code string.char(...)} over its byte values</li>
 *   <li>{@code ("desrever"):reverse()}</li>
 *   <li>a call to a decoder local injected at the top of the chunk</li>
 * </ul>
 * Encodings that rely on the {@code string} or {@code table} library are only offered
 * when the script leaves those globals pristine.
 */
public class StringReencoder implements Pass {

    private static final Logger LOG = LoggerFactory.getLogger(StringReencoder.class);

    public static final String NAME = "string-reencoder";

    static final int MAX_CHAR_CALL_LENGTH = 200;

    private enum Encoding {
        ESCAPED,
        CHAR_CALL,
        REVERSED,
        DECODER
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Chunk apply(Chunk chunk, PassContext context) {
        GlobalUsage globals = GlobalUsage.of(chunk);
        boolean stringLibrary = globals.isPristine("string");
        boolean decoderAvailable = stringLibrary && globals.isPristine("table");

        Decoder decoder = decoderAvailable ? Decoder.create(chunk, context) : null;
        Encoder encoder = new Encoder(context, chunk, stringLibrary, decoder);
        Chunk encoded = encoder.rewrite(chunk);
        LOG.debug("Re-encoded {} string literals", encoder.count);
        if (decoder == null || !encoder.decoderUsed) {
            return encoded;
        }
        List<Statement> statements = new ArrayList<>(decoder.declaration);
        statements.addAll(encoded.body().statements());
        return encoded.withBody(encoded.body().withStatements(statements));
    }

    private static final class Encoder extends AstRewriter {
        private final Chunk chunk;
        private final boolean stringLibrary;
        private final Decoder decoder;
        private int count;
        private boolean decoderUsed;

        Encoder(PassContext context, Chunk chunk, boolean stringLibrary, Decoder decoder) {
            super(NAME, context);
            this.chunk = chunk;
            this.stringLibrary = stringLibrary;
            this.decoder = decoder;
        }

        @Override
        protected Expression transformExpression(Expression expression) {
            if (!(expression instanceof Literal literal) || !(literal.value() instanceof LuaValue.Str str)) {
                return expression;
            }
            count++;
            String bytes = str.bytes();
            return switch (choose(bytes)) {
                case ESCAPED -> new Literal(literal.loc(), str, LuaStrings.quoteAllEscaped(bytes));
                case CHAR_CALL -> charCall(literal, bytes);
                case REVERSED -> reversed(literal, bytes);
                case DECODER -> {
                    decoderUsed = true;
                    yield new CallExpression(literal.loc(), decoder.reference(), List.of(byteTable(bytes)));
                }
            };
        }

        private Encoding choose(String bytes) {
            List<Encoding> candidates = new ArrayList<>(4);
            candidates.add(Encoding.ESCAPED);
            if (stringLibrary) {
                candidates.add(Encoding.REVERSED);
                if (!bytes.isEmpty() && bytes.length() <= MAX_CHAR_CALL_LENGTH) {
                    candidates.add(Encoding.CHAR_CALL);
                }
            }
            if (decoder != null) {
                candidates.add(Encoding.DECODER);
            }
            return candidates.get(context.random().nextInt(candidates.size()));
        }

        private Expression charCall(Literal literal, String bytes) {
            Identifier string = new Identifier("string", chunk.symbols().global("string"));
            List<Expression> codes = new ArrayList<>(bytes.length());
            for (int i = 0; i < bytes.length(); i++) {
                codes.add(Literal.of(bytes.charAt(i)));
            }
            return new CallExpression(literal.loc(), IndexExpression.field(string, "char"), codes);
        }

        private static Expression reversed(Literal literal, String bytes) {
            Literal backwards = new Literal(literal.loc(), LuaValue.ofBytes(new StringBuilder(bytes).reverse().toString()), null);
            return new MethodCallExpression(literal.loc(), new ParenExpression(literal.loc(), backwards), "reverse", List.of());
        }

        private static TableConstructor byteTable(String bytes) {
            List<TableField> fields = new ArrayList<>(bytes.length());
            for (int i = 0; i < bytes.length(); i++) {
                fields.add(TableField.positional(Literal.of(bytes.charAt(i))));
            }
            return new TableConstructor(SourceLocation.SYNTHETIC, fields);
        }
    }

    /**
     * {@code local NAME = function(t) ... end} turning a table of byte values into a string.
     */
    private static final class Decoder {
        private static final String TEMPLATE =
            "local %1$s = function(%2$s) local %3$s = {} for %4$s = 1, #%2$s do %3$s[%4$s] = string.char(%2$s[%4$s]) end "
                + "return table.concat(%3$s) end";

        private final List<Statement> declaration;
        private final Identifier name;

        private Decoder(List<Statement> declaration, Identifier name) {
            this.declaration = declaration;
            this.name = name;
        }

        static Decoder create(Chunk chunk, PassContext context) {
            Set<String> taken = IdentifierRenamer.usedNames(chunk);
            int length = context.options().obfuscatedNameLength();
            String[] names = new String[4];
            for (int i = 0; i < names.length; i++) {
                names[i] = IdentifierRenamer.randomName(context.random(), length, taken);
                taken.add(names[i]);
            }
            String source = String.format(TEMPLATE, (Object[]) names);
            Chunk helper = new Parser(source, false, false, chunk.symbols()).parseChunk();
            List<Statement> statements = helper.body().statements();
            if (!(statements.get(0) instanceof LocalDeclaration local)) {
                throw new InternalInvariantException("decoder helper did not parse as a local declaration", helper.loc());
            }
            return new Decoder(statements, local.names().get(0));
        }

        Identifier reference() {
            Symbol symbol = name.symbol();
            return new Identifier(name.name(), symbol);
        }
    }
}
