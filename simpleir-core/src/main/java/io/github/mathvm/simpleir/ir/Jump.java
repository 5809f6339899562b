package io.github.mathvm.simpleir.ir;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A block transition. Jumps reference their target blocks but do not own them.
 * <p>
 * Jumps are immutable; {@link Block#relink(Block, Block)} installs a new one.
 */
public abstract class Jump extends Statement {
    Jump() {
    }

    /**
     * Get the blocks this jump may transfer control to.
     *
     * @return The targets, in order.
     */
    public abstract List<Block> getTargets();

    /**
     * Build the jump that replaces this one when every edge to {@code oldChild}
     * is redirected to {@code newChild}. Operands move to the new jump.
     *
     * @return The new jump, or null if this jump does not target {@code oldChild}.
     */
    abstract @Nullable Jump retarget(Block oldChild, Block newChild);

    @Override
    public final boolean isJump() {
        return true;
    }

    @Override
    public final Jump asJump() {
        return this;
    }
}
