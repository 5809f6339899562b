package io.github.mathvm.simpleir.ir;

import io.github.mathvm.simpleir.ext.CommonExts;
import io.github.mathvm.simpleir.ext.ExtHolder;
import io.github.mathvm.simpleir.ext.TrackedList;
import io.github.mathvm.simpleir.ir.display.IrPrinter;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The IR of a whole program: its functions, the metadata of every variable id,
 * and the pool of string constants.
 * <p>
 * The builder fills this in; variable ids must be unique within one program.
 * Nothing here is synchronized: a program has one writer at a time, and may be
 * read by several threads once nobody writes to it.
 */
public final class SimpleIr extends ExtHolder {
    private final List<String> pool = new ArrayList<>();
    private final Map<String, Integer> poolIndex = new HashMap<>();

    private final Map<Integer, Function> functionsById = new HashMap<>();
    /**
     * The functions of the program, in the order they were added.
     */
    public final List<Function> functions = new TrackedList<Function>(new ArrayList<>()) {
        @Override
        protected void onAdded(Function elt) {
            Function existing = functionsById.get(elt.id);
            if (existing != null) {
                throw new IllegalArgumentException(String.format(
                        "duplicate function id %d: %s and %s",
                        elt.id,
                        existing.name,
                        elt.name));
            }
            functionsById.put(elt.id, elt);
            elt.attachExt(CommonExts.OWNING_PROGRAM, SimpleIr.this);
        }

        @Override
        protected void onRemoved(Function elt) {
            functionsById.remove(elt.id, elt);
            elt.removeExt(CommonExts.OWNING_PROGRAM);
        }
    };

    private final List<VarMeta> varMeta = new ArrayList<>();
    private final Map<Long, VarMeta> varMetaById = new HashMap<>();

    /**
     * Get the string pool.
     *
     * @return An unmodifiable view of the pool.
     */
    public List<String> getPool() {
        return Collections.unmodifiableList(pool);
    }

    /**
     * Append a string to the pool, even if an equal one is already there.
     *
     * @param string The string.
     * @return Its index.
     */
    public int addString(String string) {
        int idx = pool.size();
        pool.add(Objects.requireNonNull(string, "string"));
        poolIndex.putIfAbsent(string, idx);
        return idx;
    }

    /**
     * Get the index of a pooled string equal to {@code string}, adding it if there is none.
     *
     * @param string The string.
     * @return Its index.
     */
    public int intern(String string) {
        Integer idx = poolIndex.get(string);
        return idx != null ? idx : addString(string);
    }

    /**
     * Resolve a pooled string constant.
     *
     * @param ptr The constant.
     * @return The string it names.
     * @throws IllegalArgumentException  If {@code ptr} is not a pooled string.
     * @throws IndexOutOfBoundsException If {@code ptr} points past the pool.
     */
    public String pooledString(PtrConst ptr) {
        if (!ptr.isPooledString) {
            throw new IllegalArgumentException("not a pooled string: " + ptr);
        }
        if (ptr.value < 0 || ptr.value >= pool.size()) {
            throw new IndexOutOfBoundsException(String.format(
                    "pooled string index out of range: pool size: %d, index: %s",
                    pool.size(),
                    Long.toUnsignedString(ptr.value)));
        }
        return pool.get((int) ptr.value);
    }

    /**
     * Add a function to this program.
     *
     * @param function The function.
     * @return The function.
     */
    public Function addFunction(Function function) {
        functions.add(function);
        return function;
    }

    /**
     * Look up a function by id, as a {@link Call} does.
     *
     * @param funId The id.
     * @return The function, or null if there is none with that id.
     */
    public @Nullable Function getFunction(int funId) {
        return functionsById.get(funId);
    }

    /**
     * Get the metadata of every variable.
     *
     * @return An unmodifiable view, in the order it was added.
     */
    public List<VarMeta> getVarMeta() {
        return Collections.unmodifiableList(varMeta);
    }

    /**
     * Record the metadata of a variable.
     *
     * @param meta The metadata.
     * @return The metadata.
     * @throws IllegalArgumentException If metadata for the same id already exists.
     */
    public VarMeta addVarMeta(VarMeta meta) {
        if (varMetaById.putIfAbsent(meta.id, meta) != null) {
            throw new IllegalArgumentException("duplicate variable id: " + meta.id);
        }
        varMeta.add(meta);
        return meta;
    }

    /**
     * Get the metadata of a variable.
     *
     * @param id The variable id.
     * @return The metadata, or null if none was recorded.
     */
    public @Nullable VarMeta getVarMeta(long id) {
        return varMetaById.get(id);
    }

    /**
     * Release every function of this program, and forget them.
     */
    public void release() {
        for (Function function : functions) {
            function.release();
        }
        functions.clear();
    }

    @Override
    public String toString() {
        return IrPrinter.print(this);
    }
}
