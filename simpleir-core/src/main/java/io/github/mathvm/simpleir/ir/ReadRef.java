package io.github.mathvm.simpleir.ir;

/**
 * Reads the value a reference variable points to.
 */
public final class ReadRef extends Atom {
    /**
     * The id of the reference variable.
     */
    public final long refId;

    public ReadRef(long refId) {
        this.refId = refId;
    }

    @Override
    public IrType getType() {
        return IrType.READ_REF;
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
