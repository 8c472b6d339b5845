package io.github.eutro.tirpass.core.ir;

/**
 * A variable.
 * <p>
 * Variables are compared by identity: two variables with the same name are
 * different variables unless they are the same object. The name and index
 * are only used for printing.
 */
public final class Var extends Expr {
    public final String name;
    public final int index;

    public Var(String name, DataType type) {
        this(name, 0, type);
    }

    public Var(String name, int index, DataType type) {
        super(type);
        this.name = name;
        this.index = index;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitVar(this);
    }

    public String displayName() {
        return index == 0 ? name : name + "." + index;
    }
}
