package io.github.mathvm.simpleir.ir;

import io.github.mathvm.simpleir.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * What the program knows about one variable id.
 * <p>
 * A variable is exactly one {@link Kind kind}: a source variable, a compiler
 * temporary, or a reference. Only the type may change after construction.
 */
public final class VarMeta extends ExtHolder {
    /**
     * The largest offset; offsets are unsigned 32-bit values.
     */
    public static final long MAX_OFFSET = (1L << 32) - 1;

    public enum Kind {
        /**
         * A variable of the source program.
         */
        SOURCE,
        /**
         * A variable introduced by the compiler.
         */
        TEMPORARY,
        /**
         * A variable holding the address of a slot, possibly in another function's frame.
         */
        REFERENCE,
    }

    public final long id;
    public final boolean isSourceVar;
    public final boolean isReference;
    /**
     * For source variables, the id of the variable this one was derived from.
     */
    public final long originId;
    /**
     * For references to a statically known slot, the function whose frame holds it.
     */
    public final @Nullable Function pointsTo;
    /**
     * For references to a statically known slot, its byte offset in the frame.
     */
    public final long offset;
    private VarType type;

    private VarMeta(long id,
                    boolean isSourceVar,
                    boolean isReference,
                    long originId,
                    @Nullable Function pointsTo,
                    long offset,
                    VarType type) {
        if (offset < 0 || offset > MAX_OFFSET) {
            throw new IllegalArgumentException("offset out of range: " + offset);
        }
        this.id = id;
        this.isSourceVar = isSourceVar;
        this.isReference = isReference;
        this.originId = originId;
        this.pointsTo = pointsTo;
        this.offset = offset;
        this.type = Objects.requireNonNull(type, "type");
    }

    /**
     * Describe a source variable derived from {@code originId}.
     *
     * @param id       The variable id.
     * @param originId The id it came from.
     * @param type     The type.
     * @return The metadata.
     */
    public static VarMeta sourceVar(long id, long originId, VarType type) {
        return new VarMeta(id, true, false, originId, null, 0, type);
    }

    public static VarMeta sourceVar(long id, VarType type) {
        return sourceVar(id, 0, type);
    }

    /**
     * Describe a compiler temporary of yet unknown type.
     *
     * @param id The variable id.
     * @return The metadata.
     */
    public static VarMeta temporary(long id) {
        return new VarMeta(id, false, false, 0, null, 0, VarType.UNDEFINED);
    }

    /**
     * Describe a reference variable.
     *
     * @param id       The variable id.
     * @param type     The type of the referenced value.
     * @param pointsTo The function whose frame holds the slot, or null if not statically known.
     * @param offset   The byte offset of the slot in that frame.
     * @return The metadata.
     */
    public static VarMeta reference(long id, VarType type, @Nullable Function pointsTo, long offset) {
        return new VarMeta(id, false, true, 0, pointsTo, offset, type);
    }

    public Kind getKind() {
        if (isReference) return Kind.REFERENCE;
        return isSourceVar ? Kind.SOURCE : Kind.TEMPORARY;
    }

    public VarType getType() {
        return type;
    }

    public void setType(VarType type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('$').append(id).append(": ").append(type).append(' ').append(getKind());
        switch (getKind()) {
            case SOURCE:
                if (originId != 0) sb.append(" from $").append(originId);
                break;
            case REFERENCE:
                if (pointsTo != null) sb.append(" -> ").append(pointsTo.name).append('+').append(offset);
                break;
            default:
                break;
        }
        return sb.toString();
    }
}
