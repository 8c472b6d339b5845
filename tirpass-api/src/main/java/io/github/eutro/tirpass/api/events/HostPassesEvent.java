package io.github.eutro.tirpass.api.events;

import io.github.eutro.tirpass.core.ir.LoweredFunc;
import org.jetbrains.annotations.NotNull;

/**
 * Fired after inlining, before the function is split. The body is in SSA form.
 * <p>
 * Listeners may run their own passes, and replace {@link #func} with the result.
 * It must still be a {@link LoweredFunc.Kind#MIXED mixed} function.
 */
public class HostPassesEvent implements LoweringEvent {
    @NotNull
    public LoweredFunc func;

    public HostPassesEvent(@NotNull LoweredFunc func) {
        this.func = func;
    }
}
