package io.github.eutro.tirpass.core.util;

import io.github.eutro.tirpass.core.ir.*;

import java.util.ArrayList;
import java.util.List;

/**
 * A copy-on-write rewriter over statements and expressions.
 * <p>
 * Each {@code visit} method rewrites the children of a node, and returns the node itself if
 * none of them changed (by identity), or a new node over the new children otherwise.
 * Subclasses override the methods for the nodes they care about, typically calling {@code super}
 * to get the rewritten children.
 * <p>
 * Buffer variables of {@link Load}s and {@link Store}s, and the {@link AttrStmt#node} of attributes,
 * are not visited, since they are not values in the expression sense.
 */
public abstract class StmtExprMutator implements ExprVisitor<Expr>, StmtVisitor<Stmt> {
    public Expr visitExpr(Expr expr) {
        return expr.accept(this);
    }

    public Stmt visitStmt(Stmt stmt) {
        return stmt.accept(this);
    }

    /**
     * Visit each expression in a list.
     *
     * @param exprs The expressions.
     * @return The same list if no expression changed, otherwise a new list.
     */
    protected List<Expr> visitExprs(List<Expr> exprs) {
        List<Expr> ret = null;
        for (int i = 0; i < exprs.size(); i++) {
            Expr expr = exprs.get(i);
            Expr newExpr = visitExpr(expr);
            if (ret == null && newExpr != expr) {
                ret = new ArrayList<>(exprs.subList(0, i));
            }
            if (ret != null) ret.add(newExpr);
        }
        return ret == null ? exprs : ret;
    }

    @Override
    public Expr visitIntImm(IntImm e) {
        return e;
    }

    @Override
    public Expr visitFloatImm(FloatImm e) {
        return e;
    }

    @Override
    public Expr visitStringImm(StringImm e) {
        return e;
    }

    @Override
    public Expr visitVar(Var e) {
        return e;
    }

    @Override
    public Expr visitBinary(Binary e) {
        Expr a = visitExpr(e.a);
        Expr b = visitExpr(e.b);
        if (a == e.a && b == e.b) return e;
        return new Binary(e.op, a, b);
    }

    @Override
    public Expr visitCast(Cast e) {
        Expr value = visitExpr(e.value);
        if (value == e.value) return e;
        return new Cast(e.type, value);
    }

    @Override
    public Expr visitSelect(Select e) {
        Expr cond = visitExpr(e.cond);
        Expr t = visitExpr(e.trueValue);
        Expr f = visitExpr(e.falseValue);
        if (cond == e.cond && t == e.trueValue && f == e.falseValue) return e;
        return new Select(cond, t, f);
    }

    @Override
    public Expr visitLoad(Load e) {
        Expr index = visitExpr(e.index);
        if (index == e.index) return e;
        return new Load(e.type, e.bufferVar, index);
    }

    @Override
    public Expr visitLet(Let e) {
        Expr value = visitExpr(e.value);
        Expr body = visitExpr(e.body);
        if (value == e.value && body == e.body) return e;
        return new Let(e.var, value, body);
    }

    @Override
    public Expr visitCall(Call e) {
        List<Expr> args = visitExprs(e.args);
        if (args == e.args) return e;
        return e.withArgs(args);
    }

    @Override
    public Stmt visitLetStmt(LetStmt s) {
        Expr value = visitExpr(s.value);
        Stmt body = visitStmt(s.body);
        if (value == s.value && body == s.body) return s;
        return new LetStmt(s.var, value, body);
    }

    @Override
    public Stmt visitAttrStmt(AttrStmt s) {
        Expr value = visitExpr(s.value);
        Stmt body = visitStmt(s.body);
        if (value == s.value && body == s.body) return s;
        return new AttrStmt(s.node, s.key, value, body);
    }

    @Override
    public Stmt visitFor(For s) {
        Expr min = visitExpr(s.min);
        Expr extent = visitExpr(s.extent);
        Stmt body = visitStmt(s.body);
        if (min == s.min && extent == s.extent && body == s.body) return s;
        return new For(s.loopVar, min, extent, s.kind, body);
    }

    @Override
    public Stmt visitAllocate(Allocate s) {
        List<Expr> extents = visitExprs(s.extents);
        Expr condition = visitExpr(s.condition);
        Stmt body = visitStmt(s.body);
        if (extents == s.extents && condition == s.condition && body == s.body) return s;
        return new Allocate(s.bufferVar, s.elemType, extents, condition, body);
    }

    @Override
    public Stmt visitStore(Store s) {
        Expr value = visitExpr(s.value);
        Expr index = visitExpr(s.index);
        if (value == s.value && index == s.index) return s;
        return new Store(s.bufferVar, value, index);
    }

    @Override
    public Stmt visitEvaluate(Evaluate s) {
        Expr value = visitExpr(s.value);
        if (value == s.value) return s;
        return new Evaluate(value);
    }

    @Override
    public Stmt visitSeqStmt(SeqStmt s) {
        List<Stmt> ret = null;
        for (int i = 0; i < s.seq.size(); i++) {
            Stmt stmt = s.seq.get(i);
            Stmt newStmt = visitStmt(stmt);
            if (ret == null && newStmt != stmt) {
                ret = new ArrayList<>(s.seq.subList(0, i));
            }
            if (ret != null) ret.add(newStmt);
        }
        if (ret == null) return s;
        return SeqStmt.flatten(ret);
    }

    @Override
    public Stmt visitIfThenElse(IfThenElse s) {
        Expr cond = visitExpr(s.cond);
        Stmt thenCase = visitStmt(s.thenCase);
        Stmt elseCase = s.elseCase == null ? null : visitStmt(s.elseCase);
        if (cond == s.cond && thenCase == s.thenCase && elseCase == s.elseCase) return s;
        return new IfThenElse(cond, thenCase, elseCase);
    }
}
