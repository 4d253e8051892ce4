package com.moonshift.pipeline;

import com.moonshift.pass.ConstantFolder;
import com.moonshift.pass.ExpressionSimplifier;
import com.moonshift.pass.IdentifierRenamer;
import com.moonshift.pass.ObfuscationLinter;
import com.moonshift.pass.Pass;
import com.moonshift.pass.StringNormalizer;
import com.moonshift.pass.StringReencoder;
import com.moonshift.pass.StructuralFixer;

import java.util.function.Supplier;

/**
 * Names of the rewrite passes a {@link Mode} can list.
 */
public enum PassId {
    STRING_NORMALIZER(StringNormalizer::new),
    CONSTANT_FOLDER(ConstantFolder::new),
    EXPRESSION_SIMPLIFIER(ExpressionSimplifier::new),
    CANONICALIZE_IDENTIFIERS(() -> new IdentifierRenamer(IdentifierRenamer.Strategy.CANONICALIZE)),
    OBFUSCATION_LINTER(ObfuscationLinter::new),
    OBFUSCATE_IDENTIFIERS(() -> new IdentifierRenamer(IdentifierRenamer.Strategy.OBFUSCATE)),
    STRING_REENCODER(StringReencoder::new),
    STRUCTURAL_FIXER(StructuralFixer::new);

    private final Supplier<Pass> factory;

    PassId(Supplier<Pass> factory) {
        this.factory = factory;
    }

    public Pass create() {
        return factory.get();
    }
}
