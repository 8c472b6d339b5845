package io.github.eutro.tirpass.core.ir;

/**
 * {@code let var = value in body}, as an expression.
 */
public final class Let extends Expr {
    public final Var var;
    public final Expr value;
    public final Expr body;

    public Let(Var var, Expr value, Expr body) {
        super(body.type);
        this.var = var;
        this.value = value;
        this.body = body;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitLet(this);
    }
}
