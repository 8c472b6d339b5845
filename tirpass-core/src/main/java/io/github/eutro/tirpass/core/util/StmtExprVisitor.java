package io.github.eutro.tirpass.core.util;

import io.github.eutro.tirpass.core.ir.*;

/**
 * A read-only traversal over statements and expressions, visiting every child of every node.
 * <p>
 * Like {@link StmtExprMutator}, it does not visit buffer variables or attribute nodes.
 */
public abstract class StmtExprVisitor implements ExprVisitor<Void>, StmtVisitor<Void> {
    public void visitExpr(Expr expr) {
        expr.accept(this);
    }

    public void visitStmt(Stmt stmt) {
        stmt.accept(this);
    }

    @Override
    public Void visitIntImm(IntImm e) {
        return null;
    }

    @Override
    public Void visitFloatImm(FloatImm e) {
        return null;
    }

    @Override
    public Void visitStringImm(StringImm e) {
        return null;
    }

    @Override
    public Void visitVar(Var e) {
        return null;
    }

    @Override
    public Void visitBinary(Binary e) {
        visitExpr(e.a);
        visitExpr(e.b);
        return null;
    }

    @Override
    public Void visitCast(Cast e) {
        visitExpr(e.value);
        return null;
    }

    @Override
    public Void visitSelect(Select e) {
        visitExpr(e.cond);
        visitExpr(e.trueValue);
        visitExpr(e.falseValue);
        return null;
    }

    @Override
    public Void visitLoad(Load e) {
        visitExpr(e.index);
        return null;
    }

    @Override
    public Void visitLet(Let e) {
        visitExpr(e.value);
        visitExpr(e.body);
        return null;
    }

    @Override
    public Void visitCall(Call e) {
        for (Expr arg : e.args) {
            visitExpr(arg);
        }
        return null;
    }

    @Override
    public Void visitLetStmt(LetStmt s) {
        visitExpr(s.value);
        visitStmt(s.body);
        return null;
    }

    @Override
    public Void visitAttrStmt(AttrStmt s) {
        visitExpr(s.value);
        visitStmt(s.body);
        return null;
    }

    @Override
    public Void visitFor(For s) {
        visitExpr(s.min);
        visitExpr(s.extent);
        visitStmt(s.body);
        return null;
    }

    @Override
    public Void visitAllocate(Allocate s) {
        for (Expr extent : s.extents) {
            visitExpr(extent);
        }
        visitExpr(s.condition);
        visitStmt(s.body);
        return null;
    }

    @Override
    public Void visitStore(Store s) {
        visitExpr(s.value);
        visitExpr(s.index);
        return null;
    }

    @Override
    public Void visitEvaluate(Evaluate s) {
        visitExpr(s.value);
        return null;
    }

    @Override
    public Void visitSeqStmt(SeqStmt s) {
        for (Stmt stmt : s.seq) {
            visitStmt(stmt);
        }
        return null;
    }

    @Override
    public Void visitIfThenElse(IfThenElse s) {
        visitExpr(s.cond);
        visitStmt(s.thenCase);
        if (s.elseCase != null) visitStmt(s.elseCase);
        return null;
    }
}
