package org.arbor.compiler.frontend.parsetree;

import java.util.List;
import java.util.Objects;

/**
 * The raw ordered representation of a parse tree node as produced by a grammar front-end:
 * an operator tag followed by one or two operand representations.
 *
 * <p>Operands may be primitives, nested {@code RawNode}s, or already materialized
 * {@link ParseTreeNode}s. A raw node becomes a {@link ParseTreeNode} the first time it is
 * read through a node's operand accessor.</p>
 *
 * @param operator The operator tag, never null.
 * @param operandA The first operand.
 * @param operandB The second operand, or null for a unary node.
 */
public record RawNode(String operator, Object operandA, Object operandB) {

    public RawNode {
        Objects.requireNonNull(operator, "operator");
    }

    public static RawNode of(String operator, Object operandA) {
        return new RawNode(operator, operandA, null);
    }

    public static RawNode of(String operator, Object operandA, Object operandB) {
        return new RawNode(operator, operandA, operandB);
    }

    /**
     * Converts a nested list form such as {@code ["add", 1, ["neg", 2]]} into raw nodes.
     * Every list must hold the operator tag followed by one or two operands. Nested lists are
     * converted recursively; any other element is kept as-is.
     *
     * @param form The list form.
     * @return The equivalent raw node.
     * @throws IllegalArgumentException if a list has the wrong size or a non-string operator.
     */
    public static RawNode fromList(List<?> form) {
        if (form.size() < 2 || form.size() > 3) {
            throw new IllegalArgumentException(
                    "Expected operator plus one or two operands, got " + form.size() + " elements: " + form);
        }
        if (!(form.get(0) instanceof String operator)) {
            throw new IllegalArgumentException("Operator tag must be a string: " + form.get(0));
        }
        Object a = convertElement(form.get(1));
        Object b = form.size() == 3 ? convertElement(form.get(2)) : null;
        return new RawNode(operator, a, b);
    }

    private static Object convertElement(Object element) {
        if (element instanceof List<?> nested) {
            return fromList(nested);
        }
        return element;
    }

    /**
     * @return True if the node carries a second operand.
     */
    public boolean isBinary() {
        return operandB != null;
    }
}
