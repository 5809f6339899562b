package io.github.mathvm.simpleir.ops;

/**
 * The operators of a {@link io.github.mathvm.simpleir.ir.UnOp}.
 */
public enum UnaryOp {
    CAST_I2D("<i2d>"),
    CAST_D2I("<d2i>"),
    NEG("-"),
    FNEG(".-."),
    NOT("!"),
    ;

    public final String mnemonic;

    UnaryOp(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    /**
     * Whether this operator converts between integer and floating-point values.
     *
     * @return The above.
     */
    public boolean isCast() {
        return this == CAST_I2D || this == CAST_D2I;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
