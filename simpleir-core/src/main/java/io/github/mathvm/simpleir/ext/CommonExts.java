package io.github.mathvm.simpleir.ext;

import io.github.mathvm.simpleir.ir.Function;
import io.github.mathvm.simpleir.ir.IrElement;
import io.github.mathvm.simpleir.ir.SimpleIr;

/**
 * Exts shared by the whole IR.
 */
public class CommonExts {
    /**
     * The node that owns this one: the statement or expression an operand belongs to,
     * the block a statement or transition belongs to.
     */
    public static final Ext<IrElement> OWNER = Ext.create(IrElement.class, "OWNER");
    /**
     * The function whose block arena holds this block.
     */
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    /**
     * The program this function was added to.
     */
    public static final Ext<SimpleIr> OWNING_PROGRAM = Ext.create(SimpleIr.class, "OWNING_PROGRAM");

    /**
     * The position of a statement or transition in its function's linear order.
     *
     * @see io.github.mathvm.simpleir.passes.meta.NumberStatements
     */
    public static final Ext<Integer> STATEMENT_NUM = Ext.create(Integer.class, "STATEMENT_NUM");
    /**
     * The number of statements and transitions numbered in a function.
     */
    public static final Ext<Integer> STATEMENT_COUNT = Ext.create(Integer.class, "STATEMENT_COUNT");
}
