package io.github.eutro.tirpass.core.ir;

/**
 * {@code cond ? trueValue : falseValue}, where both branches are evaluated.
 */
public final class Select extends Expr {
    public final Expr cond;
    public final Expr trueValue;
    public final Expr falseValue;

    public Select(Expr cond, Expr trueValue, Expr falseValue) {
        super(trueValue.type);
        this.cond = cond;
        this.trueValue = trueValue;
        this.falseValue = falseValue;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitSelect(this);
    }
}
