package org.arbor.compiler.frontend.processing;

import org.arbor.compiler.frontend.parsetree.ParseTreeNode;

/**
 * Handler for the nodes of one or more operator tags.
 */
@FunctionalInterface
public interface INodeHandler {
    /**
     * Transforms a node whose operands have already been processed.
     * @param node The node to handle.
     * @return The replacement for the node: the node itself, a new node or a primitive.
     */
    Object handle(ParseTreeNode node);
}
