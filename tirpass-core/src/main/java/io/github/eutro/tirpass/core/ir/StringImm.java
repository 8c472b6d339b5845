package io.github.eutro.tirpass.core.ir;

/**
 * A string constant, typed as a handle.
 */
public final class StringImm extends Expr {
    public final String value;

    public StringImm(String value) {
        super(DataType.HANDLE);
        this.value = value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitStringImm(this);
    }
}
