package io.github.mathvm.simpleir.passes;

import io.github.mathvm.simpleir.passes.misc.ChainedPass;

/**
 * A step that takes some IR and produces some (possibly the same) IR.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input.
     * @return The output.
     */
    B run(A a);

    /**
     * Whether this pass modifies its input and returns it, rather than building new IR.
     *
     * @return The above.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Run {@code next} on the output of this pass.
     *
     * @param next The pass to run afterwards.
     * @param <C>  The output type of {@code next}.
     * @return The combined pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
