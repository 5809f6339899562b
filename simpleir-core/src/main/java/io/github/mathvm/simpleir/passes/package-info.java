/**
 * {@link io.github.mathvm.simpleir.passes.IRPass IR passes}: composable steps over the IR.
 * <p>
 * Passes in {@link io.github.mathvm.simpleir.passes.meta} compute metadata and attach it
 * as {@link io.github.mathvm.simpleir.ext.Ext exts}, leaving the IR itself unchanged.
 */
package io.github.mathvm.simpleir.passes;
