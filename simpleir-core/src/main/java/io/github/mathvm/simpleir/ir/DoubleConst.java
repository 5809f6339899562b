package io.github.mathvm.simpleir.ir;

public final class DoubleConst extends Atom {
    public final double value;

    public DoubleConst(double value) {
        this.value = value;
    }

    @Override
    public boolean isLiteral() {
        return true;
    }

    @Override
    public IrType getType() {
        return IrType.DOUBLE;
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
