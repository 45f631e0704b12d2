package org.arbor.compiler.frontend.parsetree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Open key/value store attached to exactly one {@link ParseTreeNode}.
 * Processors use it to stash metadata they discover about a node so that later passes
 * can read it without the node's schema changing.
 *
 * <p>Every key is implicitly present: reading a key that was never written inserts it
 * with the "unset" value {@code null} and returns {@code null}. Flags set by an earlier pass
 * can therefore be read without existence checks.</p>
 */
public final class NodeAnnotations {

    private final Map<String, Object> values = new LinkedHashMap<>();

    public NodeAnnotations() {
    }

    public NodeAnnotations(Map<String, ?> initial) {
        values.putAll(initial);
    }

    /**
     * Returns the value stored under the key, auto-creating the key as unset if it is missing.
     *
     * @param key The annotation key.
     * @return The stored value, or null if the key is unset.
     */
    public Object get(String key) {
        if (!values.containsKey(key)) {
            values.put(key, null);
        }
        return values.get(key);
    }

    /**
     * Typed variant of {@link #get(String)}.
     *
     * @param key  The annotation key.
     * @param type The expected value type.
     * @param <T>  Value type.
     * @return The stored value cast to {@code type}, or null if unset.
     * @throws ClassCastException if the stored value is not an instance of {@code type}.
     */
    public <T> T get(String key, Class<T> type) {
        return type.cast(get(key));
    }

    /**
     * Returns the stored value, or {@code defaultValue} while the key is unset.
     * The key is auto-created like in {@link #get(String)}; the default is not stored.
     */
    public Object getOrDefault(String key, Object defaultValue) {
        Object value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * @return True only if the key holds {@link Boolean#TRUE}.
     */
    public boolean isTrue(String key) {
        return Boolean.TRUE.equals(get(key));
    }

    /**
     * @return True if the key holds an explicit (non-null) value.
     */
    public boolean isSet(String key) {
        return values.get(key) != null;
    }

    public void set(String key, Object value) {
        values.put(key, value);
    }

    /**
     * Merges the given entries into this store. Existing keys are overwritten.
     */
    public void putAll(Map<String, ?> entries) {
        values.putAll(entries);
    }

    /**
     * Returns the value under the key, storing the supplier's result first if the key is unset.
     *
     * @param key      The annotation key.
     * @param supplier Produces the initial value.
     * @param <T>      Value type.
     * @return The existing or newly stored value.
     */
    @SuppressWarnings("unchecked")
    public <T> T computeIfUnset(String key, Supplier<? extends T> supplier) {
        Object value = get(key);
        if (value == null) {
            value = supplier.get();
            values.put(key, value);
        }
        return (T) value;
    }

    /**
     * Checks whether the key has been touched, either written or read.
     * Does not auto-create the key.
     */
    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /**
     * @return An unmodifiable copy of the current entries, in insertion order.
     */
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
