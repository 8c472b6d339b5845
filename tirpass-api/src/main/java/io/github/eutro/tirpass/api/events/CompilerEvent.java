package io.github.eutro.tirpass.api.events;

/**
 * An event fired on a {@link io.github.eutro.tirpass.api.LoweringCompiler}.
 */
public interface CompilerEvent {
}
