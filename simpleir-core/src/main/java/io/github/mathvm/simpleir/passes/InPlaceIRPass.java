package io.github.mathvm.simpleir.passes;

/**
 * A pass that edits a {@link io.github.mathvm.simpleir.ir.Block block},
 * {@link io.github.mathvm.simpleir.ir.Function function} or whole
 * {@link io.github.mathvm.simpleir.ir.SimpleIr program} where it stands, or only
 * attaches exts to it, and hands back the same object.
 * <p>
 * Block and function passes are run over larger units with
 * {@link io.github.mathvm.simpleir.passes.misc.ForPass}.
 *
 * @param <T> The unit of IR the pass edits.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    /**
     * Edit {@code ir}.
     *
     * @param ir The IR.
     */
    void runInPlace(T ir);

    @Override
    default T run(T ir) {
        runInPlace(ir);
        return ir;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }

    /**
     * Sequence {@code next} after this pass, on the same unit.
     * Unlike {@link #then(IRPass)}, the result is still an in-place pass,
     * so it can be lifted with {@link io.github.mathvm.simpleir.passes.misc.ForPass}.
     *
     * @param next The pass to run afterwards.
     * @return The combined pass.
     */
    default InPlaceIRPass<T> thenInPlace(InPlaceIRPass<T> next) {
        InPlaceIRPass<T> first = this;
        return new InPlaceIRPass<T>() {
            @Override
            public void runInPlace(T ir) {
                first.runInPlace(ir);
                next.runInPlace(ir);
            }

            @Override
            public String toString() {
                return first + " then " + next;
            }
        };
    }
}
