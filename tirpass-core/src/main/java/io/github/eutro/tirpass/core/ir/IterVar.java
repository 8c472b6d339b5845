package io.github.eutro.tirpass.core.ir;

/**
 * Binds a {@link Var} to a hardware thread axis, such as {@code threadIdx.x} or {@code blockIdx.y}.
 * <p>
 * Compared by identity, like variables.
 */
public final class IterVar {
    public final Var var;
    public final String threadTag;

    public IterVar(Var var, String threadTag) {
        this.var = var;
        this.threadTag = threadTag;
    }

    @Override
    public String toString() {
        return "iter_var(" + var.displayName() + ", " + threadTag + ")";
    }
}
