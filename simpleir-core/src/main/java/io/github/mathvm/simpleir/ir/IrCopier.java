package io.github.mathvm.simpleir.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * A transformation that rebuilds the owned tree below a node, leaving the original untouched.
 * <p>
 * Blocks and functions are graph nodes rather than owned operands, so they are
 * returned as they are; a copied jump targets the same blocks as the original.
 * Subclasses rewrite nodes by overriding the kinds they change; operands go
 * through this visitor too, so a rewrite of {@link Variable} applies everywhere.
 */
public class IrCopier implements IrVisitor<IrElement> {
    /**
     * A copier that changes nothing.
     */
    public static final IrCopier INSTANCE = new IrCopier();

    /**
     * Deep-copy {@code element} with {@link #INSTANCE}.
     *
     * @param element The node.
     * @param <E>     The node class.
     * @return The copy, unowned.
     */
    @SuppressWarnings("unchecked")
    public static <E extends IrElement> E copy(E element) {
        return (E) element.accept(INSTANCE);
    }

    protected Atom atom(Atom atom) {
        return (Atom) atom.accept(this);
    }

    protected Variable variable(Variable variable) {
        return (Variable) variable.accept(this);
    }

    @Override
    public IrElement visit(BinOp binOp) {
        return new BinOp(atom(binOp.left), atom(binOp.right), binOp.op);
    }

    @Override
    public IrElement visit(UnOp unOp) {
        return new UnOp(atom(unOp.operand), unOp.op);
    }

    @Override
    public IrElement visit(Variable variable) {
        return new Variable(variable.id);
    }

    @Override
    public IrElement visit(Return ret) {
        return new Return(ret.atom == null ? null : atom(ret.atom));
    }

    @Override
    public IrElement visit(Phi phi) {
        Phi copy = new Phi(variable(phi.var));
        for (Variable operand : phi.getVars()) {
            copy.addVar(variable(operand));
        }
        return copy;
    }

    @Override
    public IrElement visit(IntConst intConst) {
        return new IntConst(intConst.value);
    }

    @Override
    public IrElement visit(DoubleConst doubleConst) {
        return new DoubleConst(doubleConst.value);
    }

    @Override
    public IrElement visit(PtrConst ptrConst) {
        return new PtrConst(ptrConst.value, ptrConst.isPooledString);
    }

    @Override
    public IrElement visit(Block block) {
        return block;
    }

    @Override
    public IrElement visit(Assignment assignment) {
        return new Assignment(variable(assignment.var), (Expression) assignment.value.accept(this));
    }

    @Override
    public IrElement visit(Call call) {
        List<Atom> params = new ArrayList<>(call.params.size());
        for (Atom param : call.params) {
            params.add(atom(param));
        }
        return new Call(call.funId, params, call.refParams);
    }

    @Override
    public IrElement visit(Print print) {
        return new Print(atom(print.atom));
    }

    @Override
    public IrElement visit(Function function) {
        return function;
    }

    @Override
    public IrElement visit(JumpAlways jumpAlways) {
        return new JumpAlways(jumpAlways.destination);
    }

    @Override
    public IrElement visit(JumpCond jumpCond) {
        return new JumpCond(jumpCond.yes, jumpCond.no, atom(jumpCond.condition));
    }

    @Override
    public IrElement visit(WriteRef writeRef) {
        return new WriteRef(atom(writeRef.atom), writeRef.refId);
    }

    @Override
    public IrElement visit(ReadRef readRef) {
        return new ReadRef(readRef.refId);
    }
}
