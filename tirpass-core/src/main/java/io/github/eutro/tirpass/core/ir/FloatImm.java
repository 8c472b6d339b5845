package io.github.eutro.tirpass.core.ir;

public final class FloatImm extends Expr {
    public final double value;

    public FloatImm(DataType type, double value) {
        super(type);
        if (!type.isFloat()) throw new IllegalArgumentException("float immediate of type " + type);
        this.value = value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitFloatImm(this);
    }
}
