package io.github.mathvm.simpleir.passes.misc;

import io.github.mathvm.simpleir.passes.IRPass;

/**
 * A pass that runs one pass, then another on its result.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> firstPass;
    private final IRPass<B, C> nextPass;

    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
    }

    @Override
    public boolean isInPlace() {
        return firstPass.isInPlace() && nextPass.isInPlace();
    }

    @Override
    public C run(A a) {
        B b = firstPass.run(a);
        try {
            return nextPass.run(b);
        } catch (RuntimeException e) {
            e.addSuppressed(new RuntimeException("running " + nextPass + " after " + firstPass));
            throw e;
        }
    }

    @Override
    public String toString() {
        return firstPass + " then " + nextPass;
    }
}
