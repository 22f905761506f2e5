package io.github.kirc.core.passes;

import io.github.kirc.core.passes.misc.ChainedPass;

/**
 * A pass over some IR, producing a result.
 *
 * @param <A> The type of IR the pass runs on.
 * @param <B> The result of the pass.
 */
public interface IRPass<A, B> {
    /**
     * Run this pass.
     *
     * @param a The input.
     * @return The result.
     */
    B run(A a);

    /**
     * Whether this pass mutates its input and returns it.
     *
     * @return Whether this pass runs in place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another, feeding this result to the next.
     *
     * @param next The next pass.
     * @param <C>  The result of the next pass.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
