package io.github.eutro.tirpass.core.ir;

public final class Cast extends Expr {
    public final Expr value;

    public Cast(DataType type, Expr value) {
        super(type);
        this.value = value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCast(this);
    }
}
