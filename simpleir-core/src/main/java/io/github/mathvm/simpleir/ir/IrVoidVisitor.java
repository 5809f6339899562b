package io.github.mathvm.simpleir.ir;

/**
 * A visitor over every IR node kind, for side effects only.
 *
 * @see IrVisitor
 * @see IrScanner
 */
public interface IrVoidVisitor {
    void visit(BinOp binOp);

    void visit(UnOp unOp);

    void visit(Variable variable);

    void visit(Return ret);

    void visit(Phi phi);

    void visit(IntConst intConst);

    void visit(DoubleConst doubleConst);

    void visit(PtrConst ptrConst);

    void visit(Block block);

    void visit(Assignment assignment);

    void visit(Call call);

    void visit(Print print);

    void visit(Function function);

    void visit(JumpAlways jumpAlways);

    void visit(JumpCond jumpCond);

    void visit(WriteRef writeRef);

    void visit(ReadRef readRef);
}
