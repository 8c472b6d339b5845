package io.github.eutro.tirpass.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * Annotates {@code body} with an attribute.
 * <p>
 * What {@link #node} is depends on the {@link AttrKeys key}: for {@link AttrKeys#THREAD_EXTENT}
 * it is the {@link IterVar} being bound, and {@link #value} is its extent.
 */
public final class AttrStmt extends Stmt {
    @Nullable
    public final Object node;
    public final String key;
    public final Expr value;
    public final Stmt body;

    public AttrStmt(@Nullable Object node, String key, Expr value, Stmt body) {
        this.node = node;
        this.key = key;
        this.value = value;
        this.body = body;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitAttrStmt(this);
    }
}
