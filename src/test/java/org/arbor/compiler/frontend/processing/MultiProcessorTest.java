package org.arbor.compiler.frontend.processing;

import org.arbor.compiler.frontend.parsetree.ParseTreeNode;
import org.arbor.compiler.frontend.parsetree.RawNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MultiProcessor}: root marking, slot ordering, chaining of processors
 * inside a slot and the single-use rule for processed trees.
 */
@Tag("unit")
class MultiProcessorTest {

    /** Marks every node it visits with {@code seen1 = true}. */
    private static class FirstPass extends ParseTreeProcessor {
        @Override
        protected Object processUnrecognised(ParseTreeNode node) {
            node.getAnnotations().set("seen1", true);
            return node;
        }
    }

    /** Appends its name to {@code seenOrder} and records whether {@code seen1} was visible. */
    private static class OrderRecorder extends ParseTreeProcessor {
        private final String name;
        private final List<Boolean> sawFirstPass = new ArrayList<>();

        OrderRecorder(String name) {
            this.name = name;
        }

        @Override
        protected Object processUnrecognised(ParseTreeNode node) {
            sawFirstPass.add(node.getAnnotations().isTrue("seen1"));
            List<String> order = node.getAnnotations().computeIfUnset("seenOrder", ArrayList::new);
            order.add(name);
            return node;
        }
    }

    @Test
    void rootAndDirectOperandsAreMarked() {
        MultiProcessor engine = new MultiProcessor(ProcessorSlot.of(new FirstPass()));

        ParseTreeNode root = (ParseTreeNode) engine.process(
                RawNode.of("x", RawNode.of("y", 1), RawNode.of("z", 2)));

        assertThat(root.getAnnotations().get(MultiProcessor.IS_ROOT)).isEqualTo(true);
        assertThat(((ParseTreeNode) root.getOperandA()).getAnnotations().get(MultiProcessor.IS_ROOT)).isEqualTo(false);
        assertThat(((ParseTreeNode) root.getOperandB()).getAnnotations().get(MultiProcessor.IS_ROOT)).isEqualTo(false);
    }

    @Test
    void deeperDescendantsAreNotMarked() {
        MultiProcessor engine = new MultiProcessor(ProcessorSlot.of(new FirstPass()));

        ParseTreeNode root = (ParseTreeNode) engine.process(
                RawNode.of("x", RawNode.of("y", RawNode.of("w", 1)), 2));

        ParseTreeNode y = (ParseTreeNode) root.getOperandA();
        ParseTreeNode w = (ParseTreeNode) y.getOperandA();
        assertThat(y.getAnnotations().get(MultiProcessor.IS_ROOT)).isEqualTo(false);
        assertThat(w.getAnnotations().get(MultiProcessor.IS_ROOT)).isNull();
        assertThat(w.getAnnotations().isTrue("seen1")).isTrue();
    }

    @Test
    void processingTheSameTreeTwiceIsRejected() {
        MultiProcessor engine = new MultiProcessor(ProcessorSlot.of(new FirstPass()));
        ParseTreeNode root = (ParseTreeNode) engine.process(
                RawNode.of("x", RawNode.of("y", 1), RawNode.of("z", 2)));

        assertThatThrownBy(() -> engine.process(root))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already been processed");
    }

    @Test
    void engineCanBeReusedOnFreshTrees() {
        MultiProcessor engine = new MultiProcessor(ProcessorSlot.of(new SampleProcessors.ConstantFolder()));

        Object first = engine.process(RawNode.of("add", RawNode.of("mul", 2, 3), RawNode.of("var", "x")));
        Object second = engine.process(RawNode.of("sub", RawNode.of("var", "y"), RawNode.of("mul", 1, 4)));

        assertThat(((ParseTreeNode) first).toCanonicalForm()).isEqualTo(RawNode.of("add", 6, RawNode.of("var", "x")));
        assertThat(((ParseTreeNode) second).toCanonicalForm()).isEqualTo(RawNode.of("sub", RawNode.of("var", "y"), 4));
    }

    @Test
    void laterSlotSeesAnnotationsAndProcessorsRunInSlotOrder() {
        OrderRecorder p2 = new OrderRecorder("P2");
        OrderRecorder p3 = new OrderRecorder("P3");
        MultiProcessor engine = MultiProcessor.builder()
                .slot(new FirstPass())
                .slot(p2, p3)
                .build();

        ParseTreeNode root = (ParseTreeNode) engine.process(RawNode.of("op", 1, 2));

        assertThat(root.getAnnotations().get("seenOrder")).isEqualTo(List.of("P2", "P3"));
        assertThat(root.getAnnotations().isTrue("seen1")).isTrue();
        assertThat(p2.sawFirstPass).containsExactly(true);
        assertThat(p3.sawFirstPass).containsExactly(true);
    }

    @Test
    void everyNodeSeesSlotMembersInOrder() {
        OrderRecorder p2 = new OrderRecorder("P2");
        OrderRecorder p3 = new OrderRecorder("P3");
        MultiProcessor engine = new MultiProcessor(ProcessorSlot.of(new FirstPass()), ProcessorSlot.of(p2, p3));

        ParseTreeNode root = (ParseTreeNode) engine.process(
                RawNode.of("op", RawNode.of("inner", RawNode.of("leaf", 1)), 2));

        ParseTreeNode inner = (ParseTreeNode) root.getOperandA();
        ParseTreeNode leaf = (ParseTreeNode) inner.getOperandA();
        for (ParseTreeNode node : List.of(root, inner, leaf)) {
            assertThat(node.getAnnotations().get("seenOrder")).isEqualTo(List.of("P2", "P3"));
        }
        assertThat(p2.sawFirstPass).containsOnly(true).hasSize(3);
        assertThat(p3.sawFirstPass).containsOnly(true).hasSize(3);
    }

    @Test
    void membersOfOneSlotChainTheirOutputs() {
        // The desugarer turns neg into sub, which the folder then evaluates in the same traversal.
        MultiProcessor engine = new MultiProcessor(ProcessorSlot.of(
                new SampleProcessors.NegationDesugarer(), new SampleProcessors.ConstantFolder()));

        ParseTreeNode root = (ParseTreeNode) engine.process(
                RawNode.of("add", RawNode.of("neg", 5), RawNode.of("var", "x")));

        assertThat(root.toCanonicalForm()).isEqualTo(RawNode.of("add", -5, RawNode.of("var", "x")));
    }

    @Test
    void rootIsDispatchedThroughEverySlotMember() {
        MultiProcessor engine = new MultiProcessor(
                ProcessorSlot.of(new SampleProcessors.NegationDesugarer()),
                ProcessorSlot.of(new SampleProcessors.ConstantFolder()));

        Object result = engine.process(RawNode.of("neg", 7));

        assertThat(result).isEqualTo(-7);
    }

    @Test
    void laterSlotsReceiveRootReducedToPrimitive() {
        List<Object> primitives = new ArrayList<>();
        ParseTreeProcessor recorder = new ParseTreeProcessor() {
            @Override
            protected Object processPrimitive(Object primitive) {
                primitives.add(primitive);
                return primitive;
            }
        };
        MultiProcessor engine = new MultiProcessor(
                ProcessorSlot.of(new SampleProcessors.ConstantFolder()),
                ProcessorSlot.of(recorder));

        Object result = engine.process(RawNode.of("mul", 6, 7));

        assertThat(result).isEqualTo(42);
        assertThat(primitives).containsExactly(42);
    }

    @Test
    void operandBIsSkippedForUnaryRoot() {
        OrderRecorder recorder = new OrderRecorder("P");
        MultiProcessor engine = new MultiProcessor(ProcessorSlot.of(recorder));

        ParseTreeNode root = (ParseTreeNode) engine.process(RawNode.of("neg", RawNode.of("lit", 1)));

        assertThat(root.hasOperandB()).isFalse();
        assertThat(recorder.sawFirstPass).hasSize(2);
    }

    @Test
    void strictFailureSurfacesUnchanged() {
        ParseTreeProcessor strict = new ParseTreeProcessor(true) {
        };
        MultiProcessor engine = new MultiProcessor(ProcessorSlot.of(strict));

        assertThatThrownBy(() -> engine.process(RawNode.of("foo", 1, 2)))
                .isInstanceOfSatisfying(UnrecognizedOperatorException.class,
                        e -> assertThat(e.getNode().getOperator()).isEqualTo("foo"));
    }

    @Test
    void nonNodeRootIsRejected() {
        MultiProcessor engine = new MultiProcessor(ProcessorSlot.of(new FirstPass()));

        assertThatThrownBy(() -> engine.process(5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void dispatchIsNotSupported() {
        MultiProcessor engine = new MultiProcessor(ProcessorSlot.of(new FirstPass()));

        assertThatThrownBy(() -> engine.dispatch(new ParseTreeNode("x", 1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void emptySlotIsRejected() {
        assertThatThrownBy(() -> new ProcessorSlot(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void engineWithoutSlotsOnlyMarksTheRoot() {
        MultiProcessor engine = new MultiProcessor();

        ParseTreeNode root = (ParseTreeNode) engine.process(RawNode.of("x", RawNode.of("y", 1)));

        assertThat(root.getAnnotations().isTrue(MultiProcessor.IS_ROOT)).isTrue();
        assertThat(root.toCanonicalForm()).isEqualTo(RawNode.of("x", RawNode.of("y", 1)));
    }
}
