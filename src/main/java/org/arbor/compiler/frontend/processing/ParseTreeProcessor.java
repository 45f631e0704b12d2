package org.arbor.compiler.frontend.processing;

import com.typesafe.config.Config;
import org.arbor.compiler.frontend.parsetree.ParseTreeNode;
import org.arbor.compiler.frontend.parsetree.RawNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Base class for single-pass parse tree processors.
 *
 * <p>A processor walks a tree bottom-up: it processes the operands of a node first, stores the
 * results back into the node, and then dispatches the node itself to the handler registered
 * for its operator tag. Subclasses register handlers in their constructor with
 * {@link #on(String, INodeHandler)} and {@link #delegate(INodeHandler, String...)}, or annotate
 * methods with {@link HandlesOperators}. Primitive leaves go to {@link #processPrimitive(Object)}
 * and nodes without a handler go to {@link #processUnrecognised(ParseTreeNode)}.</p>
 *
 * <p>Each processor should do one thing. Several processors are combined with a
 * {@link MultiProcessor}.</p>
 */
public abstract class ParseTreeProcessor implements ITreeTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(ParseTreeProcessor.class);

    private final HandlerRegistry registry = new HandlerRegistry();
    private boolean strict;

    /**
     * Creates a non-strict processor: unrecognized operators pass through unchanged.
     */
    protected ParseTreeProcessor() {
        this(false);
    }

    /**
     * @param strict If true, nodes with no registered handler raise
     *               {@link UnrecognizedOperatorException}.
     */
    protected ParseTreeProcessor(boolean strict) {
        this.strict = strict;
        registerAnnotatedHandlers();
    }

    /**
     * Applies configuration options. Called by {@link PipelineFactory} after construction.
     * Subclasses reading their own options should call {@code super.initialize(options)}.
     *
     * @param options The processor's options block.
     */
    public void initialize(Config options) {
        if (options.hasPath("strict")) {
            this.strict = options.getBoolean("strict");
        }
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * @return The handler registry of this processor.
     */
    public HandlerRegistry getRegistry() {
        return registry;
    }

    /**
     * Registers the handler for one operator tag.
     */
    protected final void on(String operator, INodeHandler handler) {
        registry.register(operator, handler);
    }

    /**
     * Registers one handler for several operator tags.
     */
    protected final void delegate(INodeHandler handler, String... operators) {
        registry.registerAll(handler, operators);
    }

    @Override
    public Object process(Object nodeOrPrimitive) {
        Object current = nodeOrPrimitive;
        if (current instanceof RawNode raw) {
            current = ParseTreeNode.from(raw);
        }
        if (current instanceof ParseTreeNode node) {
            node.setOperandA(process(node.getOperandA()));
            if (node.hasOperandB()) {
                node.setOperandB(process(node.getOperandB()));
            }
            return dispatch(node);
        }
        return processPrimitive(current);
    }

    @Override
    public Object dispatch(ParseTreeNode node) {
        Optional<INodeHandler> handler = registry.resolve(node.getOperator());
        if (handler.isPresent()) {
            LOG.trace("{} handling '{}'", getClass().getSimpleName(), node.getOperator());
            return handler.get().handle(node);
        }
        return processUnrecognised(node);
    }

    /**
     * Handles a value that is not a node. Returns it unchanged by default.
     *
     * @param primitive The leaf value, possibly null.
     * @return The replacement value.
     */
    protected Object processPrimitive(Object primitive) {
        return primitive;
    }

    /**
     * Handles a node whose operator has no registered handler.
     *
     * @param node The node.
     * @return The node itself when not strict.
     * @throws UnrecognizedOperatorException when strict.
     */
    protected Object processUnrecognised(ParseTreeNode node) {
        if (strict) {
            throw new UnrecognizedOperatorException(node);
        }
        return node;
    }

    private void registerAnnotatedHandlers() {
        // Superclasses first so that subclass bindings win.
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = getClass(); c != null && c != ParseTreeProcessor.class; c = c.getSuperclass()) {
            hierarchy.push(c);
        }
        for (Class<?> c : hierarchy) {
            Map<String, Method> boundInClass = new HashMap<>();
            for (Method method : c.getDeclaredMethods()) {
                HandlesOperators annotation = method.getAnnotation(HandlesOperators.class);
                if (annotation != null) {
                    validateHandlerMethod(method, annotation);
                    for (String operator : annotation.value()) {
                        Method previous = boundInClass.put(operator, method);
                        if (previous != null && !previous.equals(method)) {
                            throw new IllegalStateException("Operator '" + operator + "' is bound by both "
                                    + previous.getName() + " and " + method.getName() + " in " + c.getName());
                        }
                    }
                    method.setAccessible(true);
                    registry.registerAll(node -> invokeHandler(method, node), annotation.value());
                    LOG.debug("{}: bound {} to operators {}", getClass().getSimpleName(), method.getName(),
                            String.join(", ", annotation.value()));
                }
            }
        }
    }

    private static void validateHandlerMethod(Method method, HandlesOperators annotation) {
        Class<?>[] params = method.getParameterTypes();
        if (Modifier.isStatic(method.getModifiers())
                || params.length != 1
                || !params[0].isAssignableFrom(ParseTreeNode.class)
                || method.getReturnType() == void.class) {
            throw new IllegalStateException("Handler method " + method.getDeclaringClass().getName() + "."
                    + method.getName() + " must be an instance method taking a ParseTreeNode and returning a value");
        }
        if (annotation.value().length == 0) {
            throw new IllegalStateException("Handler method " + method.getDeclaringClass().getName() + "."
                    + method.getName() + " lists no operators");
        }
    }

    private Object invokeHandler(Method method, ParseTreeNode node) {
        try {
            return method.invoke(this, node);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Handler " + method.getName() + " failed", cause);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Handler " + method.getName() + " is not accessible", e);
        }
    }
}
