package io.github.mathvm.simpleir.ir;

import org.jetbrains.annotations.Nullable;

public final class Return extends Statement {
    /**
     * The returned value, null in a function returning nothing.
     */
    public final @Nullable Atom atom;

    public Return(@Nullable Atom atom) {
        this.atom = adopt(this, atom);
    }

    @Override
    public IrType getType() {
        return IrType.RETURN;
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
