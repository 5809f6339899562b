package io.github.mathvm.simpleir.util;

/**
 * A unary function.
 * <p>
 * Equivalent to {@link java.util.function.Function}, under a name that does not
 * collide with {@link io.github.mathvm.simpleir.ir.Function}.
 *
 * @param <A> The argument type.
 * @param <B> The result type.
 */
@FunctionalInterface
public interface F<A, B> {
    B apply(A a);
}
