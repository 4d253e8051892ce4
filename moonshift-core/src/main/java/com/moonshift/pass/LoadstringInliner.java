package com.moonshift.pass;

import com.moonshift.ParseException;
import com.moonshift.Parser;
import com.moonshift.ast.CallExpression;
import com.moonshift.ast.Chunk;
import com.moonshift.ast.FunctionExpression;
import com.moonshift.ast.Identifier;
import com.moonshift.ast.Node;
import com.moonshift.value.LuaStrings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Turns {@code loadstring("<code>")} into {@code function(...) <code> end}.
 *
 * <p>A loaded chunk runs in the global environment, so the inlined body must not pick up
 * an enclosing local: inlining is refused when a free name of the payload is also the name
 * of a local somewhere in the host chunk, or when the payload assigns a library global
 * the normalizer relies on.</p>
 */
final class LoadstringInliner {

    private static final Logger LOG = LoggerFactory.getLogger(LoadstringInliner.class);

    private static final Set<String> LIBRARY_GLOBALS = Set.of("string", "table", "unpack", "loadstring", "load");

    private LoadstringInliner() {
        // Utility class
    }

    static FunctionExpression inline(CallExpression call, String payloadBytes, StringNormalizer.Rewriter rewriter) {
        String source = LuaStrings.toText(payloadBytes);
        if (!LuaStrings.fromText(source).equals(payloadBytes)) {
            throw new UnsupportedConstructException("loadstring payload is not valid UTF-8 text", call.loc());
        }
        Chunk payload;
        try {
            payload = new Parser(source, false, false, rewriter.chunk().symbols()).parseChunk();
        } catch (ParseException e) {
            throw new UnsupportedConstructException("loadstring payload does not parse: " + e.getMessage(), call.loc());
        }

        GlobalUsage payloadUsage = GlobalUsage.of(payload);
        for (String library : LIBRARY_GLOBALS) {
            if (payloadUsage.isWritten(library)) {
                throw new UnsupportedConstructException("loadstring payload reassigns '" + library + "'", call.loc());
            }
        }
        for (String name : freeNames(payload)) {
            if (rewriter.globals().isLocalName(name)) {
                throw new UnsupportedConstructException(
                    "loadstring payload uses global '" + name + "' which a local of the same name could capture", call.loc());
            }
        }

        Chunk normalized = rewriter.normalizePayload(payload, call.loc());
        LOG.debug("Inlined loadstring payload of {} bytes at line {}", payloadBytes.length(), call.loc().line());
        return new FunctionExpression(call.loc(), new ArrayList<>(), true, normalized.body());
    }

    private static Set<String> freeNames(Chunk payload) {
        Set<String> names = new LinkedHashSet<>();
        new AstWalker() {
            @Override
            protected boolean enter(Node node) {
                if (node instanceof Identifier identifier && identifier.symbol().isGlobal()) {
                    names.add(identifier.name());
                }
                return true;
            }

            @Override
            protected void write(Identifier identifier) {
                if (identifier.symbol().isGlobal()) {
                    names.add(identifier.name());
                }
            }
        }.walk(payload);
        return names;
    }
}
