package io.github.mathvm.simpleir.ir;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An unconditional jump.
 */
public final class JumpAlways extends Jump {
    public final Block destination;

    public JumpAlways(Block destination) {
        this.destination = Objects.requireNonNull(destination, "destination");
    }

    @Override
    public List<Block> getTargets() {
        return Collections.singletonList(destination);
    }

    @Override
    @Nullable Jump retarget(Block oldChild, Block newChild) {
        return destination == oldChild ? new JumpAlways(newChild) : null;
    }

    @Override
    public IrType getType() {
        return IrType.JUMP_ALWAYS;
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
