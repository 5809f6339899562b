/**
 * Exts: typed metadata attached to IR objects.
 * <p>
 * An {@link io.github.mathvm.simpleir.ext.Ext} is a key, and an
 * {@link io.github.mathvm.simpleir.ext.ExtContainer} maps keys to values. Passes use
 * exts to cache what they compute on the IR itself, so that the node classes
 * do not grow a field for every analysis.
 */
package io.github.mathvm.simpleir.ext;
