package io.github.mathvm.simpleir.ir;

import io.github.mathvm.simpleir.ext.CommonExts;
import io.github.mathvm.simpleir.ext.Ext;
import io.github.mathvm.simpleir.ext.ExtHolder;
import io.github.mathvm.simpleir.ir.display.IrPrinter;
import org.jetbrains.annotations.Nullable;

/**
 * The root of the closed IR node hierarchy.
 * <p>
 * Nodes below the block level form a tree: each expression or statement is owned by
 * exactly one parent, recorded as its {@link CommonExts#OWNER} ext. Handing an owned node
 * to a second parent throws {@link IllegalStateException}; a parent that lets go of a
 * child (a block dropping a statement, a block replacing its transition) clears it.
 * Blocks are not owned by jumps, only referenced.
 */
public abstract class IrElement extends ExtHolder {
    /**
     * Whether nodes remember where they were constructed, to debug ownership errors.
     */
    public static boolean TRACK_CREATIONS = System.getenv("SIMPLEIR_TRACK_CREATIONS") != null;

    /**
     * Where this node was constructed, if {@link #TRACK_CREATIONS} was set at the time.
     */
    public final @Nullable Throwable created = TRACK_CREATIONS ? new Throwable("constructed") : null;

    private @Nullable IrElement owner = null;

    IrElement() {
    }

    /**
     * Get the kind of this node.
     *
     * @return The kind.
     */
    public abstract IrType getType();

    /**
     * Dispatch to the {@code visit} overload of {@code visitor} for this kind.
     *
     * @param visitor The visitor.
     * @param <T>     The result type.
     * @return The visitor's result.
     */
    public abstract <T> T accept(IrVisitor<T> visitor);

    /**
     * Dispatch to the {@code visit} overload of {@code visitor} for this kind.
     *
     * @param visitor The visitor.
     */
    public abstract void accept(IrVoidVisitor visitor);

    public boolean is(IrType type) {
        return getType() == type;
    }

    /**
     * Downcast this node to a given node class.
     *
     * @param kind The class.
     * @param <T>  The class type.
     * @return This node, or null if it is not an instance of {@code kind}.
     */
    public <T extends IrElement> @Nullable T as(Class<T> kind) {
        return kind.isInstance(this) ? kind.cast(this) : null;
    }

    public boolean isExpression() {
        return false;
    }

    public @Nullable Expression asExpression() {
        return null;
    }

    public boolean isAtom() {
        return false;
    }

    public @Nullable Atom asAtom() {
        return null;
    }

    /**
     * Whether this node is an integer, double or pointer constant.
     *
     * @return The above.
     */
    public boolean isLiteral() {
        return false;
    }

    public boolean isStatement() {
        return false;
    }

    public @Nullable Statement asStatement() {
        return null;
    }

    public boolean isJump() {
        return false;
    }

    public @Nullable Jump asJump() {
        return null;
    }

    /**
     * Get the node that owns this one.
     *
     * @return The owner, or null if this node is detached.
     */
    public @Nullable IrElement getOwner() {
        return owner;
    }

    static <E extends IrElement> E adopt(IrElement parent, E child) {
        if (child == null) return null;
        IrElement node = child;
        checkUnowned(parent, node);
        node.owner = parent;
        return child;
    }

    /**
     * Adopt every one of {@code children}, or none of them if any is already owned
     * or appears twice. Null children are skipped.
     */
    static void adoptAll(IrElement parent, IrElement... children) {
        for (int i = 0; i < children.length; i++) {
            IrElement child = children[i];
            if (child == null) continue;
            checkUnowned(parent, child);
            for (int j = 0; j < i; j++) {
                if (children[j] == child) {
                    throw new IllegalStateException(String.format(
                            "node given twice to the same owner\n  node: %s\n  owner: %s",
                            child,
                            parent.getType()),
                            child.created);
                }
            }
        }
        for (IrElement child : children) {
            if (child != null) child.owner = parent;
        }
    }

    private static void checkUnowned(IrElement parent, IrElement child) {
        IrElement current = child.owner;
        if (current == null) return;
        if (current == parent) {
            throw new IllegalStateException(String.format(
                    "node is already an operand of this owner\n  node: %s\n  owner: %s",
                    child,
                    parent.getType()),
                    child.created);
        }
        throw new IllegalStateException(String.format(
                "node already has an owner\n  node: %s\n  owner: %s\n  new owner: %s",
                child,
                current.getType(),
                parent.getType()),
                child.created);
    }

    static void disown(IrElement parent, @Nullable IrElement child) {
        if (child != null && child.owner == parent) {
            child.owner = null;
        }
    }

    @Override
    public String toString() {
        return IrPrinter.print(this);
    }

    // exts

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNER) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNER) {
            owner = (IrElement) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNER) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
