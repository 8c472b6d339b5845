package io.github.eutro.tirpass.core.ir;

import org.jetbrains.annotations.Nullable;

public final class IfThenElse extends Stmt {
    public final Expr cond;
    public final Stmt thenCase;
    @Nullable
    public final Stmt elseCase;

    public IfThenElse(Expr cond, Stmt thenCase, @Nullable Stmt elseCase) {
        this.cond = cond;
        this.thenCase = thenCase;
        this.elseCase = elseCase;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitIfThenElse(this);
    }
}
