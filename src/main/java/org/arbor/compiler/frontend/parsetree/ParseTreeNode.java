package org.arbor.compiler.frontend.parsetree;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node of a binary/unary operator parse tree.
 *
 * <p>A node carries an operator tag, a first operand, an optional second operand and a
 * {@link NodeAnnotations} store. An absent second operand ({@code null}) marks a unary node.
 * Operands are either nodes or primitive leaf values. An operand may also be stored as a
 * {@link RawNode}; it is then materialized into a {@code ParseTreeNode} on first access and the
 * materialized node replaces the raw form, so repeated reads return the same instance.</p>
 *
 * <p>A node owns its operands exclusively. Sharing a node between two parents is not supported.</p>
 */
public class ParseTreeNode {

    private String operator;
    private final OperandCell operandA;
    private final OperandCell operandB;
    private final NodeAnnotations annotations;

    public ParseTreeNode(String operator, Object operandA) {
        this(operator, operandA, null);
    }

    public ParseTreeNode(String operator, Object operandA, Object operandB) {
        this(operator, operandA, operandB, Map.of());
    }

    /**
     * Creates a node whose annotation store is pre-seeded with the given entries.
     *
     * @param operator    The operator tag.
     * @param operandA    The first operand (node, raw node or primitive).
     * @param operandB    The second operand, or null for a unary node.
     * @param annotations Initial annotation entries.
     */
    public ParseTreeNode(String operator, Object operandA, Object operandB, Map<String, ?> annotations) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operandA = new OperandCell(operandA);
        this.operandB = new OperandCell(operandB);
        this.annotations = new NodeAnnotations(annotations);
    }

    /**
     * Materializes a raw representation. Nested raw operands stay raw until they are read.
     *
     * @param raw The raw node.
     * @return A new node.
     */
    public static ParseTreeNode from(RawNode raw) {
        return new ParseTreeNode(raw.operator(), raw.operandA(), raw.operandB());
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = Objects.requireNonNull(operator, "operator");
    }

    public Object getOperandA() {
        return operandA.get();
    }

    public void setOperandA(Object value) {
        operandA.set(value);
    }

    public Object getOperandB() {
        return operandB.get();
    }

    public void setOperandB(Object value) {
        operandB.set(value);
    }

    public boolean hasOperandB() {
        return operandB.isPresent();
    }

    public NodeAnnotations getAnnotations() {
        return annotations;
    }

    /**
     * Returns the operands in order: {@code [a]} for a unary node, {@code [a, b]} otherwise.
     * The first operand may be null.
     *
     * @return An unmodifiable list of one or two operands.
     */
    public List<Object> operands() {
        if (!hasOperandB()) {
            return Collections.singletonList(getOperandA());
        }
        return Collections.unmodifiableList(Arrays.asList(getOperandA(), getOperandB()));
    }

    /**
     * Merges {@code marks} into the annotations of each operand that is a node.
     * Primitive operands are left alone.
     *
     * @param marks Entries to merge; they overwrite existing keys.
     */
    public void markOperands(Map<String, ?> marks) {
        for (Object operand : operands()) {
            if (operand instanceof ParseTreeNode node) {
                node.annotations.putAll(marks);
            }
        }
    }

    /**
     * Renders this subtree back into its raw ordered representation.
     * Annotations are not part of the canonical form.
     *
     * @return The canonical raw form.
     */
    public RawNode toCanonicalForm() {
        Object a = canonical(getOperandA());
        Object b = hasOperandB() ? canonical(getOperandB()) : null;
        return new RawNode(operator, a, b);
    }

    private static Object canonical(Object operand) {
        if (operand instanceof ParseTreeNode node) {
            return node.toCanonicalForm();
        }
        return operand;
    }

    @Override
    public String toString() {
        return "<" + getClass().getSimpleName()
                + " op=" + operator
                + ", a=" + operandA
                + ", b=" + operandB
                + ", x=" + annotations + ">";
    }
}
