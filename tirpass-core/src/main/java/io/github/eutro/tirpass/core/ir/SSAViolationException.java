package io.github.eutro.tirpass.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a statement expected to be in single-definition form is not.
 */
public class SSAViolationException extends IRInvariantException {
    @Nullable
    public final Var var;

    public SSAViolationException(@Nullable Var var, String message) {
        super(message);
        this.var = var;
    }
}
