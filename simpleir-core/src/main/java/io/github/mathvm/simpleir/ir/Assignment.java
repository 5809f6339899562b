package io.github.mathvm.simpleir.ir;

import java.util.Objects;

/**
 * Binds the value of an expression to a variable.
 */
public final class Assignment extends Statement {
    public final Variable var;
    public final Expression value;

    public Assignment(Variable var, Expression value) {
        adoptAll(this, Objects.requireNonNull(var, "var"), Objects.requireNonNull(value, "value"));
        this.var = var;
        this.value = value;
    }

    public Assignment(long id, Expression value) {
        this(new Variable(id), value);
    }

    @Override
    public IrType getType() {
        return IrType.ASSIGNMENT;
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
