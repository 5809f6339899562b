package io.github.mathvm.simpleir.ir;

/**
 * The kind tag of an {@link IrElement}. The set is closed: every node is exactly one of these.
 */
public enum IrType {
    BIN_OP(BinOp.class),
    UN_OP(UnOp.class),
    VARIABLE(Variable.class),
    RETURN(Return.class),
    PHI(Phi.class),
    INT(IntConst.class),
    DOUBLE(DoubleConst.class),
    PTR(PtrConst.class),
    BLOCK(Block.class),
    ASSIGNMENT(Assignment.class),
    CALL(Call.class),
    PRINT(Print.class),
    FUNCTION(Function.class),
    JUMP_ALWAYS(JumpAlways.class),
    JUMP_COND(JumpCond.class),
    WRITE_REF(WriteRef.class),
    READ_REF(ReadRef.class),
    ;

    /**
     * The node class of this kind.
     */
    public final Class<? extends IrElement> nodeClass;

    IrType(Class<? extends IrElement> nodeClass) {
        this.nodeClass = nodeClass;
    }
}
