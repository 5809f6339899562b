package io.github.mathvm.simpleir.ir;

/**
 * A 64-bit integer constant.
 */
public final class IntConst extends Atom {
    public final long value;

    public IntConst(long value) {
        this.value = value;
    }

    @Override
    public boolean isLiteral() {
        return true;
    }

    @Override
    public IrType getType() {
        return IrType.INT;
    }

    @Override
    public <T> T accept(IrVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void accept(IrVoidVisitor visitor) {
        visitor.visit(this);
    }
}
