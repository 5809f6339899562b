/**
 * The fixed operator sets of {@link io.github.mathvm.simpleir.ir.BinOp}
 * and {@link io.github.mathvm.simpleir.ir.UnOp} nodes.
 */
package io.github.mathvm.simpleir.ops;
