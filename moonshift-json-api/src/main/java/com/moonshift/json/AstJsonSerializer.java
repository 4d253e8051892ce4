package com.moonshift.json;

import com.moonshift.ast.Node;

/**
 * Writes syntax trees as JSON. Every node object carries a {@code "type"} member naming its
 * record, symbols are written as their numeric id and Lua values as plain JSON values.
 */
public interface AstJsonSerializer {

    String serialize(Node node) throws AstJsonException;

    String serializePretty(Node node) throws AstJsonException;

    /**
     * The shape of a tree only: source locations, literal spellings, symbol ids and comments
     * are left out, so two trees that differ only in formatting give the same string.
     */
    String serializeStructure(Node node) throws AstJsonException;
}
