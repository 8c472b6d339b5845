package io.github.eutro.tirpass.core.ir;

/**
 * {@code bufferVar[index] = value}.
 */
public final class Store extends Stmt {
    public final Var bufferVar;
    public final Expr value;
    public final Expr index;

    public Store(Var bufferVar, Expr value, Expr index) {
        this.bufferVar = bufferVar;
        this.value = value;
        this.index = index;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitStore(this);
    }
}
