package io.github.mathvm.simpleir.ir;

import io.github.mathvm.simpleir.ops.UnaryOp;

import java.util.Objects;

public final class UnOp extends Expression {
    public final Atom operand;
    public final UnaryOp op;

    public UnOp(Atom operand, UnaryOp op) {
        this.op = Objects.requireNonNull(op, "op");
        this.operand = adopt(this, Objects.requireNonNull(operand, "operand"));
    }

    @Override
    public IrType getType() {
        return IrType.UN_OP;
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
