package io.github.eutro.tirpass.core.passes.meta;

import io.github.eutro.tirpass.core.ir.*;
import io.github.eutro.tirpass.core.passes.IRPass;
import io.github.eutro.tirpass.core.util.StmtExprVisitor;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Checks that every variable of a statement is defined at most once.
 */
public class VerifySSA implements IRPass<Stmt, Boolean> {
    public static final VerifySSA INSTANCE = new VerifySSA();

    @Override
    public Boolean run(Stmt stmt) {
        return findRedefinition(stmt) == null;
    }

    /**
     * Check that a statement is in SSA form.
     *
     * @param stmt The statement.
     * @throws SSAViolationException If a variable is defined twice.
     */
    public static void check(Stmt stmt) {
        Var var = findRedefinition(stmt);
        if (var != null) {
            throw new SSAViolationException(var, "variable " + var.displayName()
                    + " is defined more than once, the statement is not in SSA form");
        }
    }

    @Nullable
    private static Var findRedefinition(Stmt stmt) {
        Verifier verifier = new Verifier();
        verifier.visitStmt(stmt);
        return verifier.redefined;
    }

    private static class Verifier extends StmtExprVisitor {
        final Set<Var> defined = Collections.newSetFromMap(new IdentityHashMap<>());
        @Nullable Var redefined;

        void define(Var var) {
            if (!defined.add(var) && redefined == null) {
                redefined = var;
            }
        }

        @Override
        public void visitStmt(Stmt stmt) {
            if (redefined == null) super.visitStmt(stmt);
        }

        @Override
        public void visitExpr(Expr expr) {
            if (redefined == null) super.visitExpr(expr);
        }

        @Override
        public Void visitLet(Let e) {
            define(e.var);
            return super.visitLet(e);
        }

        @Override
        public Void visitLetStmt(LetStmt s) {
            define(s.var);
            return super.visitLetStmt(s);
        }

        @Override
        public Void visitFor(For s) {
            define(s.loopVar);
            return super.visitFor(s);
        }

        @Override
        public Void visitAllocate(Allocate s) {
            define(s.bufferVar);
            return super.visitAllocate(s);
        }
    }
}
