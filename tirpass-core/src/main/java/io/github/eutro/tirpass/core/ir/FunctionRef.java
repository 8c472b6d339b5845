package io.github.eutro.tirpass.core.ir;

import io.github.eutro.tirpass.core.ext.ExtHolder;

/**
 * A reference to a function of the program that {@link Call}s can target.
 * <p>
 * Compared by identity. See {@link io.github.eutro.tirpass.core.ext.CommonExts#IS_PURE}
 * for marking calls to it as free of side effects.
 */
public final class FunctionRef extends ExtHolder {
    public final String name;
    public final int numOutputs;

    public FunctionRef(String name, int numOutputs) {
        this.name = name;
        this.numOutputs = numOutputs;
    }

    @Override
    public String toString() {
        return name + "/" + numOutputs;
    }
}
