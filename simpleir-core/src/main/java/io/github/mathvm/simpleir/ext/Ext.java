package io.github.mathvm.simpleir.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key for metadata that passes attach to IR nodes through an {@link ExtContainer}.
 * <p>
 * Exts are compared by identity; the ordering used by {@link ExtHolder} follows
 * the order in which they were {@link #create(Class, String) created}.
 *
 * @param <T> The type of the value stored under this ext.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<?> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Creates a new ext.
     * <p>
     * The class only serves debugging; generic value types such as {@code Set<Block>}
     * are created from their raw class.
     *
     * @param type The most specific class of the values.
     * @param name The name of the ext.
     * @param <T>  The class type.
     * @param <R>  The value type of the ext.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    /**
     * Get the name this ext was created with.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    /**
     * Look this ext up in a container.
     *
     * @param ec The container.
     * @return The value, if present.
     * @see ExtContainer#getExt(Ext)
     */
    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getName();
    }
}
