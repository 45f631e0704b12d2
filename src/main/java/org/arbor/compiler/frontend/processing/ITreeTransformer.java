package org.arbor.compiler.frontend.processing;

import org.arbor.compiler.frontend.parsetree.ParseTreeNode;

/**
 * Common contract of everything that transforms a parse tree.
 */
public interface ITreeTransformer {

    /**
     * Transforms a whole tree, or a primitive value.
     *
     * @param nodeOrPrimitive A {@link ParseTreeNode}, a {@link org.arbor.compiler.frontend.parsetree.RawNode}
     *                        or any primitive leaf value.
     * @return The transformed tree or value.
     */
    Object process(Object nodeOrPrimitive);

    /**
     * Applies the operator-level transformation to a single node whose operands
     * have already been processed.
     *
     * @param node The node to dispatch.
     * @return The replacement for the node.
     */
    Object dispatch(ParseTreeNode node);
}
