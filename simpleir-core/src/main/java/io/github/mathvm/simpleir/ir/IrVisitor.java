package io.github.mathvm.simpleir.ir;

/**
 * A visitor over every IR node kind, producing a result.
 * <p>
 * Transformations are {@code IrVisitor<IrElement>}s; see {@link IrCopier}.
 * Adding a node kind adds a method here, which every implementation must handle.
 *
 * @param <T> The result type.
 * @see IrVoidVisitor
 */
public interface IrVisitor<T> {
    T visit(BinOp binOp);

    T visit(UnOp unOp);

    T visit(Variable variable);

    T visit(Return ret);

    T visit(Phi phi);

    T visit(IntConst intConst);

    T visit(DoubleConst doubleConst);

    T visit(PtrConst ptrConst);

    T visit(Block block);

    T visit(Assignment assignment);

    T visit(Call call);

    T visit(Print print);

    T visit(Function function);

    T visit(JumpAlways jumpAlways);

    T visit(JumpCond jumpCond);

    T visit(WriteRef writeRef);

    T visit(ReadRef readRef);
}
