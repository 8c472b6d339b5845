package io.github.eutro.tirpass.api.events;

import io.github.eutro.tirpass.api.FunctionLowering;
import org.jetbrains.annotations.NotNull;

/**
 * Fired on the compiler when a function lowering is started, before any of its passes run.
 */
public class RunLoweringEvent implements CompilerEvent {
    @NotNull
    public final FunctionLowering lowering;

    public RunLoweringEvent(@NotNull FunctionLowering lowering) {
        this.lowering = lowering;
    }
}
