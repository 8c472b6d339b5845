package io.github.eutro.tirpass.core.ir;

/**
 * An expression, producing a value of a {@link DataType}.
 * <p>
 * The set of expression kinds is closed: every subclass lives in this package,
 * and is handled by {@link ExprVisitor}.
 */
public abstract class Expr extends Node {
    public final DataType type;

    Expr(DataType type) {
        if (type == null) throw new IllegalArgumentException("expression type is null");
        this.type = type;
    }

    public abstract <R> R accept(ExprVisitor<R> visitor);
}
