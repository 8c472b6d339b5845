package io.github.eutro.tirpass.core.ir;

/**
 * {@code for (loopVar = min; loopVar < min + extent; ++loopVar) body}.
 */
public final class For extends Stmt {
    public enum Kind {
        SERIAL,
        PARALLEL,
        VECTORIZED,
        UNROLLED
    }

    public final Var loopVar;
    public final Expr min;
    public final Expr extent;
    public final Kind kind;
    public final Stmt body;

    public For(Var loopVar, Expr min, Expr extent, Kind kind, Stmt body) {
        this.loopVar = loopVar;
        this.min = min;
        this.extent = extent;
        this.kind = kind;
        this.body = body;
    }

    public For(Var loopVar, Expr min, Expr extent, Stmt body) {
        this(loopVar, min, extent, Kind.SERIAL, body);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitFor(this);
    }
}
