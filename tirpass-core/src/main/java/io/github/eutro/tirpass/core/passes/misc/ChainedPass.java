package io.github.eutro.tirpass.core.passes.misc;

import io.github.eutro.tirpass.core.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs a sequence of passes, giving the result of each to the next.
 * <p>
 * Chains of chains are flattened on construction.
 *
 * @param <A> The input type of the first pass.
 * @param <C> The output type of the last pass.
 */
public class ChainedPass<A, C> implements IRPass<A, C> {
    private final List<IRPass<?, ?>> passes;

    public <B> ChainedPass(IRPass<A, B> first, IRPass<B, C> next) {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        addFlattened(passes, first);
        addFlattened(passes, next);
        this.passes = Collections.unmodifiableList(passes);
    }

    private static void addFlattened(List<IRPass<?, ?>> passes, IRPass<?, ?> pass) {
        if (pass instanceof ChainedPass) {
            passes.addAll(((ChainedPass<?, ?>) pass).passes);
        } else {
            passes.add(pass);
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            IRPass<Object, Object> pass = (IRPass<Object, Object>) passes.get(i);
            try {
                acc = pass.run(acc);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("in pass " + i + " ("
                        + pass.getClass().getSimpleName() + ") of " + passes.size()));
                throw e;
            }
        }
        return (C) acc;
    }
}
