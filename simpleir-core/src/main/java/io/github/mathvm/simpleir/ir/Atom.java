package io.github.mathvm.simpleir.ir;

/**
 * An expression that can be used as an operand directly, without evaluating anything first.
 * <p>
 * Operands of {@link BinOp}, {@link UnOp}, {@link Call} and all statements are atoms,
 * so expressions never nest more than one level deep.
 */
public abstract class Atom extends Expression {
    Atom() {
    }

    @Override
    public final boolean isAtom() {
        return true;
    }

    @Override
    public final Atom asAtom() {
        return this;
    }
}
