package org.arbor.compiler.frontend.processing;

import org.arbor.compiler.frontend.parsetree.ParseTreeNode;
import org.arbor.compiler.frontend.parsetree.RawNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs several {@link ParseTreeProcessor}s over one tree in an ordered sequence of slots.
 *
 * <p>Each slot is one stage. Within a slot, the root's operands are run through the full
 * {@code process} of every member processor in turn, each consuming the previous member's output
 * tree. The root itself is then run through every member's {@code dispatch} in turn. The result
 * becomes the input of the next slot, so later slots see the rewritten tree together with the
 * annotations earlier slots left on it.</p>
 *
 * <p>Before the first slot the root is annotated {@code isRoot = true} and its direct operands
 * {@code isRoot = false}. Deeper descendants are not marked. A tree can be processed only once:
 * processing a root that already carries an {@code isRoot} annotation is rejected.</p>
 *
 * <p>Slots accept single-pass processors only, so multi-processors cannot be nested.</p>
 */
public final class MultiProcessor implements ITreeTransformer {

    /** Annotation key marking the root of a processed tree. */
    public static final String IS_ROOT = "isRoot";

    private static final Logger LOG = LoggerFactory.getLogger(MultiProcessor.class);

    private final List<ProcessorSlot> slots;

    public MultiProcessor(ProcessorSlot... slots) {
        this(List.of(slots));
    }

    public MultiProcessor(List<ProcessorSlot> slots) {
        this.slots = List.copyOf(slots);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ProcessorSlot> getSlots() {
        return slots;
    }

    /**
     * Processes a fresh tree through all slots. Call it exactly once per tree.
     *
     * @param root A {@link ParseTreeNode} or a {@link RawNode}.
     * @return The transformed tree.
     * @throws IllegalArgumentException if the root is not a node.
     * @throws IllegalStateException if the root has already been processed.
     */
    @Override
    public Object process(Object root) {
        Object current = root;
        if (current instanceof RawNode raw) {
            current = ParseTreeNode.from(raw);
        }
        if (!(current instanceof ParseTreeNode node)) {
            throw new IllegalArgumentException("Root of a multi-pass run must be a node, got: " + root);
        }
        if (node.getAnnotations().get(IS_ROOT) != null) {
            throw new IllegalStateException("Tree has already been processed: " + node);
        }
        node.getAnnotations().set(IS_ROOT, Boolean.TRUE);
        node.markOperands(Map.of(IS_ROOT, Boolean.FALSE));

        for (int i = 0; i < slots.size(); i++) {
            ProcessorSlot slot = slots.get(i);
            LOG.debug("Running slot {}/{} with {} processor(s)", i + 1, slots.size(), slot.processors().size());
            if (current instanceof ParseTreeNode currentNode) {
                currentNode.setOperandA(slot.process(currentNode.getOperandA()));
                if (currentNode.hasOperandB()) {
                    currentNode.setOperandB(slot.process(currentNode.getOperandB()));
                }
                current = dispatchInSlot(slot, currentNode);
            } else {
                // An earlier dispatch reduced the root to a non-node value.
                current = slot.process(current);
            }
        }
        return current;
    }

    private static Object dispatchInSlot(ProcessorSlot slot, ParseTreeNode node) {
        Object current = node;
        for (ParseTreeProcessor processor : slot.processors()) {
            if (current instanceof ParseTreeNode currentNode) {
                current = processor.dispatch(currentNode);
            } else {
                current = processor.process(current);
            }
        }
        return current;
    }

    /**
     * Not supported: a multi-processor only runs whole trees through {@link #process(Object)}.
     *
     * @throws UnsupportedOperationException always.
     */
    @Override
    public Object dispatch(ParseTreeNode node) {
        throw new UnsupportedOperationException("MultiProcessor does not dispatch single nodes; call process(root)");
    }

    /**
     * Collects slots for a {@link MultiProcessor}.
     */
    public static final class Builder {

        private final List<ProcessorSlot> slots = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a slot whose processors run back-to-back within one traversal.
         */
        public Builder slot(ParseTreeProcessor first, ParseTreeProcessor... more) {
            List<ParseTreeProcessor> members = new ArrayList<>();
            members.add(first);
            members.addAll(List.of(more));
            slots.add(new ProcessorSlot(members));
            return this;
        }

        public Builder slot(ProcessorSlot slot) {
            slots.add(slot);
            return this;
        }

        public MultiProcessor build() {
            return new MultiProcessor(slots);
        }
    }
}
