package com.moonshift.json;

import com.moonshift.ast.Node;

/**
 * A tree could not be written as JSON.
 */
public class AstJsonException extends RuntimeException {

    private final String nodeType;

    public AstJsonException(String message, Node node, Throwable cause) {
        super(message + " (" + node.type() + " at line " + node.loc().line() + ")", cause);
        this.nodeType = node.type();
    }

    /**
     * {@code type()} of the node passed to the serializer.
     */
    public String getNodeType() {
        return nodeType;
    }
}
