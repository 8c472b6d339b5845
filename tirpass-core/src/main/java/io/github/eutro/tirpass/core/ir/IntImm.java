package io.github.eutro.tirpass.core.ir;

public final class IntImm extends Expr {
    public final long value;

    public IntImm(DataType type, long value) {
        super(type);
        this.value = value;
    }

    public static IntImm int32(int value) {
        return new IntImm(DataType.INT32, value);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitIntImm(this);
    }
}
