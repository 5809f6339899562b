package io.github.mathvm.simpleir.ir;

import io.github.mathvm.simpleir.ext.TrackedList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A call of the function with id {@link #funId}.
 * <p>
 * {@link #params} are passed by value and owned by the call; {@link #refParams}
 * are ids of variables whose address is passed, and come after the value parameters
 * in the callee's {@link Function#argument(int) argument order}.
 */
public final class Call extends Expression {
    /**
     * The callee, resolved with {@link SimpleIr#getFunction(int)}.
     */
    public final int funId;
    public final List<Atom> params = new TrackedList<Atom>(new ArrayList<>()) {
        @Override
        protected void onAdded(Atom elt) {
            adopt(Call.this, Objects.requireNonNull(elt, "param"));
        }

        @Override
        protected void onRemoved(Atom elt) {
            disown(Call.this, elt);
        }
    };
    public final List<Long> refParams;

    public Call(int funId, List<? extends Atom> params, List<Long> refParams) {
        this.funId = Function.checkId(funId);
        this.refParams = new ArrayList<>(refParams);
        this.params.addAll(params);
    }

    @Override
    public IrType getType() {
        return IrType.CALL;
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
