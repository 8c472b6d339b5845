package io.github.eutro.tirpass.api.events;

import io.github.eutro.tirpass.core.ir.LoweredFunc;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Fired after the function has been split into host and device functions.
 */
public class SplitEvent implements LoweringEvent {
    /**
     * The host function, followed by the device functions in the order they were extracted.
     */
    @NotNull
    public List<LoweredFunc> funcs;

    public SplitEvent(@NotNull List<LoweredFunc> funcs) {
        this.funcs = funcs;
    }
}
