package org.arbor.compiler.frontend.processing;

import java.util.List;

/**
 * One stage of a {@link MultiProcessor}: processors applied back-to-back within a single
 * traversal of the tree. Only single-pass processors are accepted.
 *
 * @param processors The processors of the stage, in application order. Never empty.
 */
public record ProcessorSlot(List<ParseTreeProcessor> processors) {

    public ProcessorSlot {
        if (processors.isEmpty()) {
            throw new IllegalArgumentException("A processor slot needs at least one processor");
        }
        processors = List.copyOf(processors);
    }

    public static ProcessorSlot of(ParseTreeProcessor... processors) {
        return new ProcessorSlot(List.of(processors));
    }

    /**
     * Runs a value through the full {@code process} of every processor in order,
     * each consuming the previous one's output.
     */
    Object process(Object value) {
        Object current = value;
        for (ParseTreeProcessor processor : processors) {
            current = processor.process(current);
        }
        return current;
    }
}
