package io.github.eutro.tirpass.core.passes;

import io.github.eutro.tirpass.core.passes.misc.ChainedPass;

/**
 * A pass over the IR, taking an {@code A} and producing a {@code B}.
 * <p>
 * Passes never modify their input, and keep no state between runs, so one instance
 * can be run any number of times.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Compose this pass with another, giving the result of this pass to the next.
     *
     * @param next The pass to run after this one.
     * @param <C>  The output type of the next pass.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<A, C>(this, next);
    }
}
