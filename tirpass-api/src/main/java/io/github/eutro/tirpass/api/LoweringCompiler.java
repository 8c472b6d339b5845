package io.github.eutro.tirpass.api;

import io.github.eutro.tirpass.api.events.*;
import io.github.eutro.tirpass.core.ir.LoweredFunc;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * The entry point for lowering functions. Functions are {@link #submit(LoweredFunc) submitted} to get a
 * {@link FunctionLowering}, which is configured and then {@link FunctionLowering#run() run}.
 * <p>
 * Listeners registered on the compiler apply to every lowering; see {@link #lift()}.
 */
public class LoweringCompiler extends EventSupplier<CompilerEvent> {
    /**
     * Whether lowerings check that functions are in SSA form before splitting them, unless
     * {@link FunctionLowering#setVerifySSA(boolean) set otherwise}.
     */
    public static boolean VERIFY_SSA = System.getenv("TIRPASS_VERIFY_SSA") != null;

    @Contract(pure = true)
    @NotNull
    public FunctionLowering submit(LoweredFunc func) {
        if (func.kind != LoweredFunc.Kind.MIXED) {
            throw new IllegalArgumentException("can only lower mixed functions, " + func.name + " is " + func.kind);
        }
        return new FunctionLowering(this, func);
    }

    /**
     * Get a dispatcher which registers listeners on every lowering this compiler runs.
     *
     * @return The dispatcher.
     */
    public EventDispatcher<LoweringEvent> lift() {
        return new EventDispatcher<LoweringEvent>() {
            @Override
            public <T extends LoweringEvent> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
                LoweringCompiler.this.listen(RunLoweringEvent.class, evt ->
                        evt.lowering.listen(eventClass, listener));
            }
        };
    }

    /**
     * Collect every function emitted by lowerings of this compiler, from now on, into a queue.
     *
     * @return The queue.
     */
    public BlockingQueue<LoweredFunc> outputsAsQueue() {
        BlockingQueue<LoweredFunc> queue = new LinkedBlockingQueue<>();
        lift().listen(EmitFunctionEvent.class, evt -> queue.add(evt.func));
        return queue;
    }
}
