package io.github.eutro.tirpass.core.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Allocate a buffer of {@code elemType} elements with the given extents,
 * binding a handle to it to {@code bufferVar} in {@code body}.
 */
public final class Allocate extends Stmt {
    public final Var bufferVar;
    public final DataType elemType;
    public final List<Expr> extents;
    public final Expr condition;
    public final Stmt body;

    public Allocate(Var bufferVar, DataType elemType, List<? extends Expr> extents, Expr condition, Stmt body) {
        if (!bufferVar.type.isHandle()) {
            throw new IllegalArgumentException("buffer variable " + bufferVar.displayName() + " is not a handle");
        }
        this.bufferVar = bufferVar;
        this.elemType = elemType;
        this.extents = Collections.unmodifiableList(new ArrayList<>(extents));
        this.condition = condition;
        this.body = body;
    }

    public Allocate(Var bufferVar, DataType elemType, List<? extends Expr> extents, Stmt body) {
        this(bufferVar, elemType, extents, new IntImm(DataType.BOOL, 1), body);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitAllocate(this);
    }
}
