package io.github.mathvm.simpleir.ir;

/**
 * A pointer constant.
 * <p>
 * If {@link #isPooledString} is set, {@link #value} is an index into the
 * {@link SimpleIr#getPool() string pool} rather than an address.
 */
public final class PtrConst extends Atom {
    /**
     * The address or pool index, read as unsigned.
     */
    public final long value;
    public final boolean isPooledString;

    public PtrConst(long value, boolean isPooledString) {
        this.value = value;
        this.isPooledString = isPooledString;
    }

    /**
     * Create a reference to the pooled string at {@code index}.
     *
     * @param index The index in the string pool.
     * @return The pointer.
     */
    public static PtrConst pooled(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("negative pool index: " + index);
        }
        return new PtrConst(index, true);
    }

    @Override
    public boolean isLiteral() {
        return true;
    }

    @Override
    public IrType getType() {
        return IrType.PTR;
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
