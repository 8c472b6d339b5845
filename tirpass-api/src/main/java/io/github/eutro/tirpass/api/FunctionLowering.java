package io.github.eutro.tirpass.api;

import io.github.eutro.tirpass.api.events.*;
import io.github.eutro.tirpass.core.ir.Callee;
import io.github.eutro.tirpass.core.ir.Expr;
import io.github.eutro.tirpass.core.ir.FunctionRef;
import io.github.eutro.tirpass.core.ir.LoweredFunc;
import io.github.eutro.tirpass.core.ir.Var;
import io.github.eutro.tirpass.core.passes.convert.SplitHostDevice;
import io.github.eutro.tirpass.core.passes.form.Inline;
import io.github.eutro.tirpass.core.passes.meta.VerifySSA;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * The lowering of a single {@link LoweredFunc.Kind#MIXED mixed} function.
 * <p>
 * Lowering, performed when {@link #run()} is called, takes place as follows:
 * <ol>
 *     <li>{@link RunLoweringEvent} is fired on the {@link LoweringCompiler compiler}.</li>
 *     <li>Each requested function is {@link Inline inlined}, in the order of the requests.</li>
 *     <li>{@link HostPassesEvent} is fired.</li>
 *     <li>If enabled, the body is {@link VerifySSA checked} to be in SSA form.</li>
 *     <li>The function is {@link SplitHostDevice split} into host and device functions.</li>
 *     <li>{@link SplitEvent} is fired.</li>
 *     <li>{@link EmitFunctionEvent} is fired for each resulting function.</li>
 * </ol>
 * If a stage fails, its exception propagates out of {@link #run()}, with a suppressed exception
 * naming the stage and function.
 */
public class FunctionLowering extends EventSupplier<LoweringEvent> {
    private static final Logger logger = LoggerFactory.getLogger(FunctionLowering.class);

    private final LoweringCompiler cc;
    private final List<Inline> inlines = new ArrayList<>();
    private boolean verifySSA = LoweringCompiler.VERIFY_SSA;

    /**
     * The function being lowered.
     */
    @NotNull
    public LoweredFunc func;

    FunctionLowering(LoweringCompiler cc, @NotNull LoweredFunc func) {
        this.cc = cc;
        this.func = func;
    }

    /**
     * Request that calls to a function be inlined before the function is split.
     *
     * @param callee The function.
     * @return This, for convenience.
     */
    public FunctionLowering inline(Callee callee) {
        inlines.add(new Inline(callee));
        return this;
    }

    public FunctionLowering inline(FunctionRef ref, List<Var> params, Expr body) {
        inlines.add(new Inline(ref, params, body));
        return this;
    }

    public FunctionLowering setVerifySSA(boolean verifySSA) {
        this.verifySSA = verifySSA;
        return this;
    }

    /**
     * Run the lowering.
     * <p>
     * See the documentation of this class for details.
     *
     * @return The functions that were emitted, the host function first.
     */
    public List<LoweredFunc> run() {
        cc.dispatch(RunLoweringEvent.class, new RunLoweringEvent(this));

        for (Inline inline : inlines) {
            func = stage("inline", () -> func.withBody(inline.run(func.body)));
        }
        func = dispatch(HostPassesEvent.class, new HostPassesEvent(func)).func;

        if (verifySSA) {
            stage("verify", () -> {
                VerifySSA.check(func.body);
                return null;
            });
        }

        List<LoweredFunc> funcs = stage("split", () -> SplitHostDevice.INSTANCE.run(func));
        funcs = dispatch(SplitEvent.class, new SplitEvent(funcs)).funcs;

        List<LoweredFunc> emitted = new ArrayList<>();
        for (LoweredFunc out : funcs) {
            if (!dispatch(EmitFunctionEvent.class, new EmitFunctionEvent(out)).isCancelled()) {
                emitted.add(out);
            }
        }
        logger.debug("lowered {} into {} function(s), emitted {}", func.name, funcs.size(), emitted.size());
        return emitted;
    }

    private <T> T stage(String name, Supplier<T> body) {
        logger.debug("running stage {} of {}", name, func.name);
        try {
            return body.get();
        } catch (RuntimeException e) {
            e.addSuppressed(new RuntimeException("in stage " + name + " of " + func.name));
            throw e;
        }
    }
}
