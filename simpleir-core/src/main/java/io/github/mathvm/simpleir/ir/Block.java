package io.github.mathvm.simpleir.ir;

import io.github.mathvm.simpleir.ext.CommonExts;
import io.github.mathvm.simpleir.ext.Ext;
import io.github.mathvm.simpleir.ext.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A basic block: an ordered list of {@link Statement statements}, followed by
 * at most one {@link Jump transition}. A block without a transition is an exit
 * of its function.
 * <p>
 * Every block keeps the set of blocks whose transition targets it. The set is
 * updated by every operation that installs, replaces or drops a transition, so it
 * is accurate after each call. It is not rebuilt from scratch, so a graph edited
 * through anything other than these operations will not be reflected.
 * <p>
 * The block owns its statements and its transition. Malformed graphs (dangling
 * targets, missing transitions on blocks that should have one) are not detected here.
 */
public final class Block extends IrElement {
    /**
     * The name of the block, for display.
     */
    public final String name;

    private final TrackedList<Statement> contents = new TrackedList<Statement>(new ArrayList<>()) {
        @Override
        protected void onAdded(Statement elt) {
            if (Objects.requireNonNull(elt, "statement").isJump()) {
                throw new IllegalArgumentException("jumps are installed with setTransition, not added: " + elt);
            }
            adopt(Block.this, elt);
        }

        @Override
        protected void onRemoved(Statement elt) {
            disown(Block.this, elt);
        }
    };
    private @Nullable Jump transition = null;
    private final Set<Block> predecessors = new LinkedHashSet<>();

    public Block(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Get the statements of this block. Statements added to the list are owned by
     * this block, and released when removed. Jumps cannot be added; they go
     * through {@link #setTransition(Jump)}.
     *
     * @return The mutable list of statements.
     */
    public List<Statement> getContents() {
        return contents;
    }

    /**
     * Append a statement to the end of this block.
     *
     * @param statement The statement.
     */
    public void addStatement(Statement statement) {
        contents.add(statement);
    }

    public @Nullable Jump getTransition() {
        return transition;
    }

    /**
     * Install {@code jump} as the transition of this block.
     * <p>
     * The previous transition, if any, is released first: this block stops being a
     * predecessor of its targets. Then this block becomes a predecessor of every
     * target of {@code jump}. Passing null makes this block an exit.
     *
     * @param jump The new transition, or null.
     */
    public void setTransition(@Nullable Jump jump) {
        if (jump == transition) return;
        adopt(this, jump);
        Jump old = transition;
        if (old != null) {
            for (Block target : old.getTargets()) {
                target.removePredecessor(this);
            }
            disown(this, old);
        }
        transition = jump;
        if (jump != null) {
            for (Block target : jump.getTargets()) {
                target.addPredecessor(this);
            }
        }
    }

    /**
     * Replace the transition of this block with an unconditional jump to {@code next}.
     *
     * @param next The next block.
     */
    public void link(Block next) {
        setTransition(new JumpAlways(next));
    }

    /**
     * Replace the transition of this block with {@code cond}.
     *
     * @param cond The conditional jump.
     */
    public void link(JumpCond cond) {
        setTransition(Objects.requireNonNull(cond, "cond"));
    }

    /**
     * Redirect every edge from this block to {@code oldChild} so that it goes to {@code newChild}.
     * <p>
     * The transition is replaced in place by an equivalent jump with the new target;
     * the condition of a conditional jump moves over to it. {@code oldChild} loses
     * this block as a predecessor and {@code newChild} gains it.
     *
     * @param oldChild The current target.
     * @param newChild The new target.
     * @return Whether this block's transition targeted {@code oldChild} at all.
     * @see JumpCond#replaceYes(Block)
     */
    public boolean relink(Block oldChild, Block newChild) {
        if (transition == null) return false;
        Jump retargeted = transition.retarget(oldChild, newChild);
        if (retargeted == null) return false;
        setTransition(retargeted);
        return true;
    }

    /**
     * Get the blocks whose transitions target this block.
     *
     * @return An unmodifiable view, in the order the edges were added.
     */
    public Set<Block> getPredecessors() {
        return Collections.unmodifiableSet(predecessors);
    }

    /**
     * Get the targets of this block's transition.
     *
     * @return The successors, empty for an exit block.
     */
    public List<Block> getSuccessors() {
        return transition == null ? Collections.emptyList() : transition.getTargets();
    }

    void addPredecessor(Block block) {
        predecessors.add(block);
    }

    void removePredecessor(Block block) {
        predecessors.remove(block);
    }

    /**
     * Whether this block only passes control on: it has no statements and
     * jumps unconditionally.
     *
     * @return The above.
     */
    public boolean isEmpty() {
        return contents.isEmpty() && transition instanceof JumpAlways;
    }

    /**
     * Whether no block jumps to this one.
     * <p>
     * This holds for a function's entry, but also for any block nothing jumps to
     * (yet). Use {@link Function#isEntry(Block)} to ask about the real entry.
     *
     * @return The above.
     */
    public boolean isEntry() {
        return predecessors.isEmpty();
    }

    /**
     * Whether this block has no transition, and so leaves its function.
     *
     * @return The above.
     */
    public boolean isLastBlock() {
        return transition == null;
    }

    /**
     * Drop every statement and the transition of this block.
     * <p>
     * Each is released once: statements become ownerless and may be added elsewhere,
     * and this block is removed from its successors' predecessors. Releasing an
     * already released block does nothing.
     */
    public void release() {
        contents.clear();
        setTransition(null);
    }

    @Override
    public IrType getType() {
        return IrType.BLOCK;
    }

    @Override
    public <T> T accept(IrVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void accept(IrVoidVisitor visitor) {
        visitor.visit(this);
    }

    // exts
    private @Nullable Function function = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) function;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            function = (Function) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            function = null;
            return;
        }
        super.removeExt(ext);
    }
}
