package io.github.mathvm.simpleir.ir;

import io.github.mathvm.simpleir.ext.CommonExts;
import io.github.mathvm.simpleir.ext.Ext;
import io.github.mathvm.simpleir.ext.TrackedList;
import io.github.mathvm.simpleir.util.GraphWalker;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A function: its signature, and the arena of {@link Block blocks} that make up its body.
 * <p>
 * The function is the sole owner of the blocks in {@link #blocks}. The entry is kept
 * apart from the arena: it is registered first, but stays the entry even after it is
 * removed from the arena or {@link #release() released}. A native function is a stub for a routine implemented outside the
 * program: it has a native address, and a placeholder entry with no body.
 */
public final class Function extends IrElement {
    /**
     * The largest function id; ids are unsigned 16-bit values.
     */
    public static final int MAX_ID = (1 << 16) - 1;
    /**
     * The name of the placeholder entry block of native functions.
     */
    public static final String NATIVE_STUB = "NATIVE_STUB";

    public final int id;
    public final String name;
    private VarType returnType;
    private final long nativeAddress;
    private Block entry;

    /**
     * The ids of the parameters passed by value, in order.
     */
    public final List<Long> parametersIds = new ArrayList<>();
    /**
     * The ids of the parameters passed by reference, in order. They follow
     * the value parameters in the {@link #argument(int) argument order}.
     */
    public final List<Long> refParameterIds = new ArrayList<>();
    /**
     * The ids of local variables whose address may be taken.
     * <p>
     * Writing to such an id writes the memory cell, reading it reads the cell, and
     * passing it as a reference parameter passes the cell's address. Other locals
     * cannot be referenced by address.
     */
    public final List<Long> memoryCells = new ArrayList<>();

    /**
     * The block arena of this function.
     */
    public final List<Block> blocks = new TrackedList<Block>(new ArrayList<>()) {
        @Override
        protected void onAdded(Block elt) {
            Function current = elt.getNullable(CommonExts.OWNING_FUNCTION);
            if (current != null) {
                throw new IllegalStateException(String.format(
                        "block %s already belongs to function %s",
                        elt.name,
                        current.name));
            }
            elt.attachExt(CommonExts.OWNING_FUNCTION, Function.this);
        }

        @Override
        protected void onRemoved(Block elt) {
            if (elt.getNullable(CommonExts.OWNING_FUNCTION) == Function.this) {
                elt.removeExt(CommonExts.OWNING_FUNCTION);
            }
        }
    };

    private Function(int id, VarType returnType, Block entry, String name, long nativeAddress) {
        this.id = checkId(id);
        this.returnType = Objects.requireNonNull(returnType, "returnType");
        this.name = Objects.requireNonNull(name, "name");
        this.nativeAddress = nativeAddress;
        blocks.add(Objects.requireNonNull(entry, "entry"));
        this.entry = entry;
    }

    /**
     * Create a function with a fresh entry block, named after the id.
     *
     * @param id         The function id.
     * @param returnType The return type.
     * @param name       The function name.
     */
    public Function(int id, VarType returnType, String name) {
        this(id, returnType, new Block(Integer.toString(id)), name, 0);
    }

    /**
     * Create a function with a given entry block.
     *
     * @param id         The function id.
     * @param returnType The return type.
     * @param entry      The entry block.
     * @param name       The function name.
     */
    public Function(int id, VarType returnType, Block entry, String name) {
        this(id, returnType, entry, name, 0);
    }

    /**
     * Create a native function stub.
     *
     * @param id            The function id.
     * @param nativeAddress The address of the native routine, not 0.
     * @param returnType    The return type.
     * @param name          The function name.
     * @return The function.
     */
    public static Function nativeStub(int id, long nativeAddress, VarType returnType, String name) {
        if (nativeAddress == 0) {
            throw new IllegalArgumentException("native function " + name + " needs an address");
        }
        return new Function(id, returnType, new Block(NATIVE_STUB), name, nativeAddress);
    }

    static int checkId(int id) {
        if (id < 0 || id > MAX_ID) {
            throw new IllegalArgumentException("function id out of range: " + id);
        }
        return id;
    }

    public Block getEntry() {
        return entry;
    }

    /**
     * Make {@code entry} the entry block, moving it to the front of the arena
     * and adding it there if needed.
     *
     * @param entry The new entry.
     */
    public void setEntry(Block entry) {
        Objects.requireNonNull(entry, "entry");
        int idx = blocks.indexOf(entry);
        if (idx != 0) {
            if (idx > 0) blocks.remove(idx);
            blocks.add(0, entry);
        }
        this.entry = entry;
    }

    /**
     * Whether {@code block} is the entry of this function.
     * <p>
     * Unlike {@link Block#isEntry()}, this is not fooled by unreachable blocks.
     *
     * @param block The block.
     * @return The above.
     */
    public boolean isEntry(Block block) {
        return getEntry() == block;
    }

    /**
     * Create a new block in this function's arena.
     *
     * @param name The block name.
     * @return The new block.
     */
    public Block newBlock(String name) {
        Block block = new Block(name);
        blocks.add(block);
        return block;
    }

    /**
     * Add a block created elsewhere to this function's arena.
     *
     * @param block The block.
     * @return The block.
     */
    public Block addBlock(Block block) {
        if (!blocks.contains(block)) {
            blocks.add(block);
        }
        return block;
    }

    /**
     * Get the blocks reachable from the entry, in depth-first pre-order.
     *
     * @return The blocks.
     */
    public List<Block> reachableBlocks() {
        return GraphWalker.blockWalker(this).preOrder().toList();
    }

    public VarType getReturnType() {
        return returnType;
    }

    public void setReturnType(VarType returnType) {
        this.returnType = Objects.requireNonNull(returnType, "returnType");
    }

    public boolean isNative() {
        return nativeAddress != 0;
    }

    /**
     * Get the address of the native routine.
     *
     * @return The address, or 0 if this function is not native.
     */
    public long getNativeAddress() {
        return nativeAddress;
    }

    /**
     * Get the id of the {@code idx}th argument, counting value parameters
     * first and reference parameters after them.
     *
     * @param idx The argument index.
     * @return The variable id.
     * @throws IndexOutOfBoundsException If {@code idx} is not below {@link #arguments()}.
     */
    public long argument(int idx) {
        if (idx >= 0) {
            if (idx < parametersIds.size()) return parametersIds.get(idx);
            int refIdx = idx - parametersIds.size();
            if (refIdx < refParameterIds.size()) return refParameterIds.get(refIdx);
        }
        throw new IndexOutOfBoundsException(String.format(
                "Argument index is out of range: total args: %d, index: %d",
                arguments(),
                idx));
    }

    /**
     * Get the total number of arguments, value and reference.
     *
     * @return The count.
     */
    public int arguments() {
        return parametersIds.size() + refParameterIds.size();
    }

    /**
     * Release every block of this function and empty the arena.
     * <p>
     * The entry is released with the others but stays the entry, so the function
     * can still be walked and printed: it is a single empty exit block.
     */
    public void release() {
        for (Block block : blocks) {
            block.release();
        }
        entry.release();
        blocks.clear();
    }

    @Override
    public IrType getType() {
        return IrType.FUNCTION;
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
    private @Nullable SimpleIr program = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_PROGRAM) {
            return (T) program;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_PROGRAM) {
            program = (SimpleIr) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_PROGRAM) {
            program = null;
            return;
        }
        super.removeExt(ext);
    }
}
