package org.arbor.compiler.frontend.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Registry mapping operator tags to node handlers.
 * Each {@link ParseTreeProcessor} owns one registry, populated while the processor is constructed.
 * A handler registered for several tags is stored under each of them, so lookup stays a
 * plain tag-to-handler access.
 */
public final class HandlerRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, INodeHandler> handlers = new HashMap<>();

    /**
     * Registers a handler for an operator tag. A later registration for the same tag
     * replaces the earlier one.
     *
     * @param operator The operator tag.
     * @param handler  The handler instance.
     */
    public void register(String operator, INodeHandler handler) {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(handler, "handler");
        INodeHandler previous = handlers.put(operator, handler);
        if (previous != null && previous != handler) {
            LOG.debug("Replaced handler for operator '{}'", operator);
        }
    }

    /**
     * Registers one handler for several operator tags.
     *
     * @param handler   The shared handler.
     * @param operators The operator tags it serves.
     */
    public void registerAll(INodeHandler handler, String... operators) {
        for (String operator : operators) {
            register(operator, handler);
        }
    }

    /**
     * Resolves the handler for an operator tag.
     *
     * @param operator The operator tag to look up.
     * @return Optional handler if registered.
     */
    public Optional<INodeHandler> resolve(String operator) {
        return Optional.ofNullable(handlers.get(operator));
    }

    /**
     * @return The registered operator tags.
     */
    public Set<String> operators() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }
}
