package io.github.eutro.tirpass.core.passes.meta;

import io.github.eutro.tirpass.core.ext.CommonExts;
import io.github.eutro.tirpass.core.ir.Call;
import io.github.eutro.tirpass.core.ir.Expr;
import io.github.eutro.tirpass.core.passes.IRPass;
import io.github.eutro.tirpass.core.util.StmtExprVisitor;

/**
 * Decides whether evaluating an expression may have an observable side effect.
 * <p>
 * This is conservative: it may say an expression has side effects when it doesn't,
 * but never the other way around. The only source of effects is a {@link Call}, which is
 * pure if its {@link io.github.eutro.tirpass.core.ir.CallType call type} is, or if it calls
 * a function marked {@link CommonExts#IS_PURE pure}.
 */
public class SideEffects implements IRPass<Expr, Boolean> {
    public static final SideEffects INSTANCE = new SideEffects();

    public static boolean hasSideEffect(Expr expr) {
        return INSTANCE.run(expr);
    }

    public static boolean isPureCall(Call call) {
        if (call.callType.pure) return true;
        return call.func != null && call.func.getExt(CommonExts.IS_PURE).orElse(false);
    }

    @Override
    public Boolean run(Expr expr) {
        Finder finder = new Finder();
        finder.visitExpr(expr);
        return finder.found;
    }

    private static class Finder extends StmtExprVisitor {
        boolean found = false;

        @Override
        public void visitExpr(Expr expr) {
            if (found) return;
            super.visitExpr(expr);
        }

        @Override
        public Void visitCall(Call e) {
            if (!isPureCall(e)) {
                found = true;
                return null;
            }
            return super.visitCall(e);
        }
    }
}
