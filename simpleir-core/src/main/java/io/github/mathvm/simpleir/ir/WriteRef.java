package io.github.mathvm.simpleir.ir;

import java.util.Objects;

/**
 * Stores a value through the reference variable {@link #refId}.
 */
public final class WriteRef extends Statement {
    public final Atom atom;
    public final long refId;

    public WriteRef(Atom atom, long refId) {
        this.refId = refId;
        this.atom = adopt(this, Objects.requireNonNull(atom, "atom"));
    }

    @Override
    public IrType getType() {
        return IrType.WRITE_REF;
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
