package io.github.eutro.tirpass.core.ir;

/**
 * Read element {@code index} of the buffer {@code bufferVar} points to.
 */
public final class Load extends Expr {
    public final Var bufferVar;
    public final Expr index;

    public Load(DataType type, Var bufferVar, Expr index) {
        super(type);
        this.bufferVar = bufferVar;
        this.index = index;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitLoad(this);
    }
}
