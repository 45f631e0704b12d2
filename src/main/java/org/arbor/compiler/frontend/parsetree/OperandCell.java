package org.arbor.compiler.frontend.parsetree;

/**
 * Storage for one operand of a {@link ParseTreeNode}. Holds either a raw representation
 * awaiting conversion or a materialized value (a node or a primitive), never both.
 * The raw form is converted on the first read and the result replaces it.
 */
final class OperandCell {

    private RawNode raw;
    private Object value;

    OperandCell(Object initial) {
        set(initial);
    }

    Object get() {
        if (raw != null) {
            value = ParseTreeNode.from(raw);
            raw = null;
        }
        return value;
    }

    void set(Object newValue) {
        if (newValue instanceof RawNode rawNode) {
            raw = rawNode;
            value = null;
        } else {
            raw = null;
            value = newValue;
        }
    }

    boolean isPresent() {
        return raw != null || value != null;
    }

    boolean isRaw() {
        return raw != null;
    }

    @Override
    public String toString() {
        return String.valueOf(raw != null ? raw : value);
    }
}
