package io.github.eutro.tirpass.api.events;

import io.github.eutro.tirpass.core.ir.LoweredFunc;
import org.jetbrains.annotations.NotNull;

/**
 * Fired once for each function a lowering outputs.
 */
public class EmitFunctionEvent implements LoweringEvent, CancellableEvent {
    @NotNull
    public final LoweredFunc func;
    private boolean cancelled = false;

    public EmitFunctionEvent(@NotNull LoweredFunc func) {
        this.func = func;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void cancel() {
        cancelled = true;
    }
}
