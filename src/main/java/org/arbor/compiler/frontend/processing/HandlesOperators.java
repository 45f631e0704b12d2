package org.arbor.compiler.frontend.processing;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method of a {@link ParseTreeProcessor} subclass as the handler for the listed
 * operator tags. One method may serve several operators:
 *
 * <pre>{@code
 * @HandlesOperators({"add", "sub"})
 * Object arithmetic(ParseTreeNode node) { ... }
 * }</pre>
 *
 * <p>The method must take a single {@link org.arbor.compiler.frontend.parsetree.ParseTreeNode}
 * and return a value. It is bound under every listed tag when the processor is constructed.</p>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface HandlesOperators {
    String[] value();
}
