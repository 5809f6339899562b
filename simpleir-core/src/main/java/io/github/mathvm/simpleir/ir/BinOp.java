package io.github.mathvm.simpleir.ir;

import io.github.mathvm.simpleir.ops.BinaryOp;

import java.util.Objects;

/**
 * A binary operation on two atoms.
 */
public final class BinOp extends Expression {
    public final Atom left;
    public final Atom right;
    public final BinaryOp op;

    public BinOp(Atom left, Atom right, BinaryOp op) {
        this.op = Objects.requireNonNull(op, "op");
        adoptAll(this, Objects.requireNonNull(left, "left"), Objects.requireNonNull(right, "right"));
        this.left = left;
        this.right = right;
    }

    @Override
    public IrType getType() {
        return IrType.BIN_OP;
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
