package io.github.eutro.tirpass.core.ir;

/**
 * {@code let var = value; body}.
 */
public final class LetStmt extends Stmt {
    public final Var var;
    public final Expr value;
    public final Stmt body;

    public LetStmt(Var var, Expr value, Stmt body) {
        this.var = var;
        this.value = value;
        this.body = body;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitLetStmt(this);
    }
}
