package io.github.mathvm.simpleir.ir;

import java.util.Objects;

public final class Print extends Statement {
    public final Atom atom;

    public Print(Atom atom) {
        this.atom = adopt(this, Objects.requireNonNull(atom, "atom"));
    }

    @Override
    public IrType getType() {
        return IrType.PRINT;
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
