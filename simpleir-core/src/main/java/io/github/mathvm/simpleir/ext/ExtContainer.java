package io.github.mathvm.simpleir.ext;

import io.github.mathvm.simpleir.passes.IRPass;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something that {@link Ext}s can be attached to.
 * <p>
 * Every IR node, block, function and program is an ext container, so that
 * analyses can cache their results on the IR without the IR knowing about them.
 */
public interface ExtContainer {
    /**
     * Associate {@code ext} with {@code value} in this container.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The value type.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value of {@code ext} from this container, if any.
     *
     * @param ext The ext.
     * @param <T> The value type.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value of {@code ext} in this container.
     *
     * @param ext The ext.
     * @param <T> The value type.
     * @return The value, or null if none is attached.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value of {@code ext} in this container, if any.
     *
     * @param ext The ext.
     * @param <T> The value type.
     * @return The value.
     */
    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value of {@code ext} in this container, throwing if it is absent.
     *
     * @param ext The ext.
     * @param <T> The value type.
     * @return The value.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T nullable = getNullable(ext);
        if (nullable != null) return nullable;
        throw new RuntimeException("Ext not present");
    }

    /**
     * Get the value of {@code ext} in this container, running {@code pass} on {@code o}
     * first if it is absent.
     *
     * @param ext  The ext.
     * @param o    The IR the pass computes the ext for.
     * @param pass The pass.
     * @param <T>  The value type.
     * @param <O>  The type the pass operates on.
     * @return The value.
     */
    default <T, O> T getExtOrRun(Ext<T> ext, O o, IRPass<O, ?> pass) {
        T extV = getNullable(ext);
        if (extV != null) return extV;
        pass.run(o);
        return getExtOrThrow(ext);
    }
}
