package io.github.mathvm.simpleir.ir;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A two-way branch on {@link #condition}: to {@link #yes} if it is non-zero, else to {@link #no}.
 */
public final class JumpCond extends Jump {
    public final Block yes;
    public final Block no;
    public final Atom condition;

    public JumpCond(Block yes, Block no, Atom condition) {
        this.yes = Objects.requireNonNull(yes, "yes");
        this.no = Objects.requireNonNull(no, "no");
        this.condition = adopt(this, Objects.requireNonNull(condition, "condition"));
    }

    /**
     * Create a copy of this jump with the yes branch going to {@code repl}.
     * <p>
     * This jump, its condition and the edges of the block it is installed in are
     * left alone; the copy has its own copy of the condition, and registers no
     * edges until it is {@link Block#link(JumpCond) linked}.
     *
     * @param repl The new yes target.
     * @return The new jump.
     * @see Block#relink(Block, Block)
     */
    public JumpCond replaceYes(Block repl) {
        return new JumpCond(repl, no, IrCopier.copy(condition));
    }

    /**
     * Create a copy of this jump with the no branch going to {@code repl}.
     *
     * @param repl The new no target.
     * @return The new jump.
     * @see #replaceYes(Block)
     */
    public JumpCond replaceNo(Block repl) {
        return new JumpCond(yes, repl, IrCopier.copy(condition));
    }

    @Override
    public List<Block> getTargets() {
        return Arrays.asList(yes, no);
    }

    @Override
    @Nullable Jump retarget(Block oldChild, Block newChild) {
        if (yes != oldChild && no != oldChild) return null;
        // this jump is about to be dropped, the condition moves
        disown(this, condition);
        return new JumpCond(
                yes == oldChild ? newChild : yes,
                no == oldChild ? newChild : no,
                condition);
    }

    @Override
    public IrType getType() {
        return IrType.JUMP_COND;
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
