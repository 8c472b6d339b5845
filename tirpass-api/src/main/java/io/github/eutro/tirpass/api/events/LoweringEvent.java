package io.github.eutro.tirpass.api.events;

/**
 * An event fired during the lowering of a single function.
 *
 * @see io.github.eutro.tirpass.api.FunctionLowering
 */
public interface LoweringEvent {
}
