package com.moonshift.ast;

import com.moonshift.scope.SymbolTable;

/**
 * Root of a parsed script.
 */
public record Chunk(
    SourceLocation loc,
    Block body,
    SymbolTable symbols
) implements Node {
    public Chunk withBody(Block newBody) {
        return new Chunk(loc, newBody, symbols);
    }

    @Override
    public String type() {
        return "Chunk";
    }
}
