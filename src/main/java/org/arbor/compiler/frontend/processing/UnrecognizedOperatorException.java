package org.arbor.compiler.frontend.processing;

import org.arbor.compiler.frontend.parsetree.ParseTreeNode;

/**
 * Thrown by a strict {@link ParseTreeProcessor} when it dispatches a node whose operator
 * has no registered handler.
 * <p>
 * The engine never catches this exception; it surfaces unchanged to the caller of
 * {@code process} or {@code dispatch}.
 */
public class UnrecognizedOperatorException extends RuntimeException {

    private final transient ParseTreeNode node;

    /**
     * Creates the exception for the given node.
     *
     * @param node The node whose operator was not recognized.
     */
    public UnrecognizedOperatorException(ParseTreeNode node) {
        super(String.valueOf(node));
        this.node = node;
    }

    /**
     * @return The node whose operator was not recognized.
     */
    public ParseTreeNode getNode() {
        return node;
    }

    /**
     * @return The unrecognized operator tag.
     */
    public String getOperator() {
        return node.getOperator();
    }
}
