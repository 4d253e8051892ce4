package com.moonshift.pipeline;

import com.moonshift.Lexer;
import com.moonshift.ParseException;
import com.moonshift.Parser;
import com.moonshift.Token;
import com.moonshift.ast.Chunk;
import com.moonshift.pass.InternalInvariantException;
import com.moonshift.pass.Pass;
import com.moonshift.pass.PassContext;
import com.moonshift.pass.UnsupportedConstructException;
import com.moonshift.printer.LuaPrinter;
import com.moonshift.scope.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs one mode over one source text: lex, build the tree, apply the mode's passes in order,
 * print. Any failure ends the run with a {@link Diagnostic} and no output.
 *
 * <p>A pipeline holds no per-run state, so one instance may serve several threads.</p>
 */
public final class Pipeline {

    private static final Logger LOG = LoggerFactory.getLogger(Pipeline.class);

    private final Mode mode;
    private final TransformOptions options;
    private final List<PassId> passes;

    public Pipeline(Mode mode) {
        this(mode, TransformOptions.defaults());
    }

    public Pipeline(Mode mode, TransformOptions options) {
        this.mode = mode;
        this.options = options;
        this.passes = List.copyOf(mode.passes());
    }

    public static TransformResult run(String source, Mode mode) {
        return new Pipeline(mode).execute(source);
    }

    public static TransformResult run(String source, Mode mode, TransformOptions options) {
        return new Pipeline(mode, options).execute(source);
    }

    /**
     * @throws TransformException when the run fails
     */
    public static String transform(String source, Mode mode) {
        return run(source, mode).orElseThrow();
    }

    public static String transform(String source, Mode mode, TransformOptions options) {
        return run(source, mode, options).orElseThrow();
    }

    public Mode mode() {
        return mode;
    }

    public TransformResult execute(String source) {
        PassContext context = new PassContext(options);
        try {
            String output = transform(source, context);
            return new TransformResult.Success(output, context.warnings());
        } catch (ParseException | UnsupportedConstructException | InternalInvariantException e) {
            return fail(Diagnostic.of(e), context);
        } catch (StackOverflowError e) {
            // The parser bounds nesting, so running out of stack here is an engine bug
            return fail(Diagnostic.from(new InternalInvariantException("tree nests too deeply to transform", e)), context);
        }
    }

    private String transform(String source, PassContext context) {
        List<Token> tokens = Lexer.tokenize(source);
        LOG.debug("[{}] Lexed {} tokens", mode, tokens.size());

        boolean unwrap = mode.unwrapWrappers() && options.unwrapImmediateWrappers();
        Parser parser = new Parser(tokens, mode.repairMode(), unwrap, new SymbolTable());
        Chunk chunk = parser.parseChunk();
        context.addAll(parser.warnings());
        LOG.debug("[{}] Built AST with {} top-level statements", mode, chunk.body().statements().size());

        for (PassId id : passes) {
            Pass pass = id.create();
            chunk = pass.apply(chunk, context);
            LOG.debug("[{}] Pass {} done", mode, pass.name());
        }

        String output = new LuaPrinter(mode.layout(), options.indent()).print(chunk);
        LOG.debug("[{}] Printed {} characters", mode, output.length());
        if (options.verifyOutput()) {
            verify(output);
        }
        return output;
    }

    // The printed text must parse again; anything else is an engine bug
    private void verify(String output) {
        try {
            new Parser(output).parseChunk();
        } catch (ParseException e) {
            throw new InternalInvariantException("printed output does not parse: " + e.getMessage(), e);
        }
    }

    private TransformResult fail(Diagnostic diagnostic, PassContext context) {
        LOG.debug("[{}] Failed: {}", mode, diagnostic);
        return new TransformResult.Failure(diagnostic, context.warnings());
    }

    /**
     * The passes this pipeline runs, in order.
     */
    public List<String> passNames() {
        List<String> names = new ArrayList<>(passes.size());
        for (PassId id : passes) {
            names.add(id.create().name());
        }
        return Collections.unmodifiableList(names);
    }
}
