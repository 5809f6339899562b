package io.github.mathvm.simpleir.ir;

/**
 * An occurrence of the variable with a given id.
 * <p>
 * Each occurrence is a separate node; two {@code Variable}s with the same id
 * name the same storage slot.
 */
public final class Variable extends Atom {
    public final long id;

    public Variable(long id) {
        this.id = id;
    }

    @Override
    public IrType getType() {
        return IrType.VARIABLE;
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
