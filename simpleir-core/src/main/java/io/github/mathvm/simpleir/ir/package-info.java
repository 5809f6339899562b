/**
 * The intermediate representation of a compiled program.
 * <p>
 * Nodes form a closed set of kinds, listed by {@link io.github.mathvm.simpleir.ir.IrType}:
 * {@link io.github.mathvm.simpleir.ir.Expression expressions}, of which
 * {@link io.github.mathvm.simpleir.ir.Atom atoms} can be used directly as operands;
 * {@link io.github.mathvm.simpleir.ir.Statement statements}, including the
 * {@link io.github.mathvm.simpleir.ir.Jump jumps} that end blocks; and the
 * {@link io.github.mathvm.simpleir.ir.Block blocks} and
 * {@link io.github.mathvm.simpleir.ir.Function functions} of the control-flow graph.
 * Code that consumes the IR implements {@link io.github.mathvm.simpleir.ir.IrVisitor}
 * or {@link io.github.mathvm.simpleir.ir.IrVoidVisitor}, handling every kind.
 * <p>
 * Below the block level the IR is a tree: every expression and statement has one owner.
 * Blocks reference each other through jumps, and each keeps its predecessor set in step
 * with the jumps that target it.
 * <p>
 * A whole program is a {@link io.github.mathvm.simpleir.ir.SimpleIr}. The IR may be in
 * SSA form, with {@link io.github.mathvm.simpleir.ir.Phi} nodes at merges, but nothing
 * here checks that it is.
 */
package io.github.mathvm.simpleir.ir;
