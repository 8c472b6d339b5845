package io.github.eutro.tirpass.core.passes.misc;

import io.github.eutro.tirpass.core.ir.*;
import io.github.eutro.tirpass.core.passes.IRPass;
import io.github.eutro.tirpass.core.util.StmtExprMutator;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces variables with expressions.
 * <p>
 * Every occurrence of a mapped variable is replaced, except inside the scope of a binding
 * that rebinds the same variable. Buffer variables of loads and stores are replaced only
 * if they are mapped to another variable. Subtrees without a replaced variable are kept as-is.
 */
public class Substitute implements IRPass<Stmt, Stmt> {
    private final Map<Var, Expr> vmap;

    public Substitute(Map<Var, ? extends Expr> vmap) {
        this.vmap = new HashMap<>(vmap);
    }

    public static Stmt substitute(Stmt stmt, Map<Var, ? extends Expr> vmap) {
        if (vmap.isEmpty()) return stmt;
        return new Substitute(vmap).run(stmt);
    }

    public static Expr substitute(Expr expr, Map<Var, ? extends Expr> vmap) {
        if (vmap.isEmpty()) return expr;
        return new Substitute(vmap).runExpr(expr);
    }

    @Override
    public Stmt run(Stmt stmt) {
        return new Substituter(vmap).visitStmt(stmt);
    }

    public Expr runExpr(Expr expr) {
        return new Substituter(vmap).visitExpr(expr);
    }

    private static class Substituter extends StmtExprMutator {
        private final Map<Var, Expr> vmap;
        private final Map<Var, Integer> shadowed = new HashMap<>();

        Substituter(Map<Var, Expr> vmap) {
            this.vmap = vmap;
        }

        private Expr lookup(Var var) {
            if (shadowed.containsKey(var)) return null;
            return vmap.get(var);
        }

        private void shadow(Var var) {
            if (vmap.containsKey(var)) shadowed.merge(var, 1, Integer::sum);
        }

        private void unshadow(Var var) {
            if (vmap.containsKey(var)) {
                shadowed.computeIfPresent(var, ($, n) -> n == 1 ? null : n - 1);
            }
        }

        private Var bufferVar(Var var) {
            Expr mapped = lookup(var);
            if (mapped == null) return var;
            if (!(mapped instanceof Var)) {
                throw new IllegalArgumentException("buffer variable " + var.displayName()
                        + " substituted with non-variable " + mapped);
            }
            return (Var) mapped;
        }

        @Override
        public Expr visitVar(Var e) {
            Expr mapped = lookup(e);
            return mapped == null ? e : mapped;
        }

        @Override
        public Expr visitLoad(Load e) {
            Var buffer = bufferVar(e.bufferVar);
            Expr index = visitExpr(e.index);
            if (buffer == e.bufferVar && index == e.index) return e;
            return new Load(e.type, buffer, index);
        }

        @Override
        public Stmt visitStore(Store s) {
            Var buffer = bufferVar(s.bufferVar);
            Expr value = visitExpr(s.value);
            Expr index = visitExpr(s.index);
            if (buffer == s.bufferVar && value == s.value && index == s.index) return s;
            return new Store(buffer, value, index);
        }

        @Override
        public Expr visitLet(Let e) {
            Expr value = visitExpr(e.value);
            shadow(e.var);
            Expr body = visitExpr(e.body);
            unshadow(e.var);
            if (value == e.value && body == e.body) return e;
            return new Let(e.var, value, body);
        }

        @Override
        public Stmt visitLetStmt(LetStmt s) {
            Expr value = visitExpr(s.value);
            shadow(s.var);
            Stmt body = visitStmt(s.body);
            unshadow(s.var);
            if (value == s.value && body == s.body) return s;
            return new LetStmt(s.var, value, body);
        }

        @Override
        public Stmt visitFor(For s) {
            Expr min = visitExpr(s.min);
            Expr extent = visitExpr(s.extent);
            shadow(s.loopVar);
            Stmt body = visitStmt(s.body);
            unshadow(s.loopVar);
            if (min == s.min && extent == s.extent && body == s.body) return s;
            return new For(s.loopVar, min, extent, s.kind, body);
        }

        @Override
        public Stmt visitAllocate(Allocate s) {
            List<Expr> extents = visitExprs(s.extents);
            Expr condition = visitExpr(s.condition);
            shadow(s.bufferVar);
            Stmt body = visitStmt(s.body);
            unshadow(s.bufferVar);
            if (extents == s.extents && condition == s.condition && body == s.body) return s;
            return new Allocate(s.bufferVar, s.elemType, extents, condition, body);
        }

        @Override
        public Stmt visitAttrStmt(AttrStmt s) {
            Object node = s.node;
            if (node instanceof Var) {
                Expr mapped = lookup((Var) node);
                if (mapped != null) node = mapped;
            }
            Expr value = visitExpr(s.value);
            Stmt body = visitStmt(s.body);
            if (node == s.node && value == s.value && body == s.body) return s;
            return new AttrStmt(node, s.key, value, body);
        }
    }
}
