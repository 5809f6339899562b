package io.github.mathvm.simpleir.ir;

/**
 * A node that produces a value.
 */
public abstract class Expression extends IrElement {
    Expression() {
    }

    @Override
    public final boolean isExpression() {
        return true;
    }

    @Override
    public final Expression asExpression() {
        return this;
    }
}
