package io.github.mathvm.simpleir.ops;

/**
 * The operators of a {@link io.github.mathvm.simpleir.ir.BinOp}.
 * <p>
 * Integer and floating-point arithmetic are distinct operators, since they
 * lower to different machine instructions. Equality is not split.
 * {@link #LOR} and {@link #LAND} operate on already evaluated operands;
 * there is no short-circuiting at this level.
 */
public enum BinaryOp {
    ADD("+", Category.ARITHMETIC, false),
    FADD(".+.", Category.ARITHMETIC, true),
    SUB("-", Category.ARITHMETIC, false),
    FSUB(".-.", Category.ARITHMETIC, true),
    MUL("*", Category.ARITHMETIC, false),
    FMUL(".*.", Category.ARITHMETIC, true),
    DIV("/", Category.ARITHMETIC, false),
    FDIV("./.", Category.ARITHMETIC, true),
    MOD("%", Category.ARITHMETIC, false),
    LT("<", Category.COMPARISON, false),
    FLT(".<.", Category.COMPARISON, true),
    LE("<=", Category.COMPARISON, false),
    FLE(".<=.", Category.COMPARISON, true),
    EQ("==", Category.COMPARISON, false),
    NEQ("!=", Category.COMPARISON, false),
    OR("|", Category.BITWISE, false),
    AND("&", Category.BITWISE, false),
    XOR("^", Category.BITWISE, false),
    LOR("||", Category.LOGICAL, false),
    LAND("&&", Category.LOGICAL, false),
    ;

    /**
     * The broad class of an operator.
     */
    public enum Category {
        ARITHMETIC,
        COMPARISON,
        BITWISE,
        LOGICAL,
    }

    /**
     * The symbol used when printing.
     */
    public final String mnemonic;
    private final Category category;
    private final boolean floating;

    BinaryOp(String mnemonic, Category category, boolean floating) {
        this.mnemonic = mnemonic;
        this.category = category;
        this.floating = floating;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * Whether this operator takes floating-point operands.
     *
     * @return The above.
     */
    public boolean isFloating() {
        return floating;
    }

    public boolean isComparison() {
        return category == Category.COMPARISON;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
