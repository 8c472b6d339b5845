package io.github.eutro.tirpass.core.ir;

/**
 * Thrown when a pass finds that its input breaks an invariant the IR is meant to uphold.
 * <p>
 * This is a bug in whatever produced the input, not something a pass can recover from.
 */
public class IRInvariantException extends RuntimeException {
    public IRInvariantException(String message) {
        super(message);
    }
}
