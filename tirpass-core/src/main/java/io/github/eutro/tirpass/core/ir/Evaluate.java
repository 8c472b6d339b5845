package io.github.eutro.tirpass.core.ir;

/**
 * Evaluate an expression for its effects, discarding the result.
 */
public final class Evaluate extends Stmt {
    public final Expr value;

    public Evaluate(Expr value) {
        this.value = value;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitEvaluate(this);
    }
}
