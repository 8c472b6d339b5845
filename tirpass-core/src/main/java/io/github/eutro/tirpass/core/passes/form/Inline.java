package io.github.eutro.tirpass.core.passes.form;

import io.github.eutro.tirpass.core.ir.*;
import io.github.eutro.tirpass.core.passes.IRPass;
import io.github.eutro.tirpass.core.passes.meta.SideEffects;
import io.github.eutro.tirpass.core.passes.misc.Substitute;
import io.github.eutro.tirpass.core.util.StmtExprMutator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Replaces calls to a function with its body.
 * <p>
 * If every argument of a call is free of side effects, the arguments are substituted for
 * the parameters directly. Otherwise, the body is wrapped in lets binding each parameter to its
 * argument, in order, so that each argument is evaluated exactly once.
 * <p>
 * Inlining the same body at several sites reuses its variables, so if any call was inlined
 * the result is put back into SSA form with {@link ConvertSSA}.
 */
public class Inline implements IRPass<Stmt, Stmt> {
    private static final Logger logger = LoggerFactory.getLogger(Inline.class);

    private final FunctionRef func;
    private final List<Var> params;
    private final Expr body;

    public Inline(FunctionRef func, List<Var> params, Expr body) {
        if (func.numOutputs != 1) {
            throw new IllegalArgumentException("can only inline functions with one output, "
                    + func.name + " has " + func.numOutputs);
        }
        this.func = func;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.body = body;
    }

    public Inline(Callee callee) {
        this(callee.ref, callee.params, callee.body);
    }

    public static Stmt inline(Stmt stmt, FunctionRef func, List<Var> params, Expr body) {
        return new Inline(func, params, body).run(stmt);
    }

    @Override
    public Stmt run(Stmt stmt) {
        Inliner inliner = new Inliner();
        Stmt ret = inliner.visitStmt(stmt);
        if (ret == stmt) return stmt;
        logger.debug("inlined {} call(s) to {}", inliner.inlined, func.name);
        return ConvertSSA.INSTANCE.run(ret);
    }

    private Expr inlineCall(Call call) {
        if (call.args.size() != params.size()) {
            throw new IllegalArgumentException("call to " + func.name + " with " + call.args.size()
                    + " argument(s), expected " + params.size() + ": " + call);
        }
        boolean hasSideEffect = false;
        for (Expr arg : call.args) {
            if (SideEffects.hasSideEffect(arg)) {
                hasSideEffect = true;
                break;
            }
        }
        if (hasSideEffect) {
            Expr ret = body;
            for (int i = params.size() - 1; i >= 0; i--) {
                ret = new Let(params.get(i), call.args.get(i), ret);
            }
            return ret;
        }
        Map<Var, Expr> vmap = new IdentityHashMap<>();
        for (int i = 0; i < params.size(); i++) {
            vmap.put(params.get(i), call.args.get(i));
        }
        return Substitute.substitute(body, vmap);
    }

    private class Inliner extends StmtExprMutator {
        int inlined = 0;

        @Override
        public Expr visitCall(Call e) {
            Expr ret = super.visitCall(e);
            if (e.func != func || e.valueIndex != 0) return ret;
            inlined++;
            return inlineCall((Call) ret);
        }
    }
}
