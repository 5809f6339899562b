package io.github.mathvm.simpleir.ir;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * An SSA merge: {@link #var} takes the value of whichever of {@link #getVars() vars}
 * is live on the edge control arrived from.
 * <p>
 * Operands are kept in insertion order.
 */
public final class Phi extends Statement {
    public final Variable var;
    private final Set<Variable> vars = new LinkedHashSet<>();

    public Phi(Variable var) {
        this.var = adopt(this, Objects.requireNonNull(var, "var"));
    }

    public Phi(long id) {
        this(new Variable(id));
    }

    /**
     * Get the merged variables.
     *
     * @return An unmodifiable view of the operands.
     */
    public Set<Variable> getVars() {
        return Collections.unmodifiableSet(vars);
    }

    /**
     * Add an operand, taking ownership of it.
     *
     * @param operand The operand.
     * @return Whether it was added.
     */
    public boolean addVar(Variable operand) {
        if (vars.contains(operand)) return false;
        vars.add(adopt(this, Objects.requireNonNull(operand, "operand")));
        return true;
    }

    /**
     * Add a fresh occurrence of variable {@code id} as an operand.
     *
     * @param id The variable id.
     * @return This phi.
     */
    public Phi addVar(long id) {
        addVar(new Variable(id));
        return this;
    }

    public boolean removeVar(Variable operand) {
        if (!vars.remove(operand)) return false;
        disown(this, operand);
        return true;
    }

    @Override
    public IrType getType() {
        return IrType.PHI;
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
