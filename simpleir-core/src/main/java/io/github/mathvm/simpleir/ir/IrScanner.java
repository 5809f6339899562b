package io.github.mathvm.simpleir.ir;

/**
 * A {@link IrVoidVisitor} that walks the owned tree below each node, visiting every
 * operand once, in field order.
 * <p>
 * A block is scanned as its statements followed by its transition; a function as
 * its {@link Function#reachableBlocks() reachable blocks}. Jumps do not lead into
 * their targets, so scanning a block never reaches another block.
 * <p>
 * Subclasses override the kinds they care about, and call {@code super.visit}
 * to keep descending.
 */
public class IrScanner implements IrVoidVisitor {
    protected void scan(IrElement element) {
        if (element != null) {
            element.accept(this);
        }
    }

    @Override
    public void visit(BinOp binOp) {
        scan(binOp.left);
        scan(binOp.right);
    }

    @Override
    public void visit(UnOp unOp) {
        scan(unOp.operand);
    }

    @Override
    public void visit(Variable variable) {
    }

    @Override
    public void visit(Return ret) {
        scan(ret.atom);
    }

    @Override
    public void visit(Phi phi) {
        scan(phi.var);
        for (Variable operand : phi.getVars()) {
            scan(operand);
        }
    }

    @Override
    public void visit(IntConst intConst) {
    }

    @Override
    public void visit(DoubleConst doubleConst) {
    }

    @Override
    public void visit(PtrConst ptrConst) {
    }

    @Override
    public void visit(Block block) {
        for (Statement statement : block.getContents()) {
            scan(statement);
        }
        scan(block.getTransition());
    }

    @Override
    public void visit(Assignment assignment) {
        scan(assignment.var);
        scan(assignment.value);
    }

    @Override
    public void visit(Call call) {
        for (Atom param : call.params) {
            scan(param);
        }
    }

    @Override
    public void visit(Print print) {
        scan(print.atom);
    }

    @Override
    public void visit(Function function) {
        for (Block block : function.reachableBlocks()) {
            scan(block);
        }
    }

    @Override
    public void visit(JumpAlways jumpAlways) {
    }

    @Override
    public void visit(JumpCond jumpCond) {
        scan(jumpCond.condition);
    }

    @Override
    public void visit(WriteRef writeRef) {
        scan(writeRef.atom);
    }

    @Override
    public void visit(ReadRef readRef) {
    }
}
