package io.github.mathvm.simpleir.ir;

/**
 * A node with a side effect, which appears in a {@link Block}: either in its contents,
 * or, for {@link Jump}s, as its transition.
 */
public abstract class Statement extends IrElement {
    Statement() {
    }

    @Override
    public final boolean isStatement() {
        return true;
    }

    @Override
    public final Statement asStatement() {
        return this;
    }
}
