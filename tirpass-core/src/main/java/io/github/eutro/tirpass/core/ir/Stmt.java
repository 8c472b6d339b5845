package io.github.eutro.tirpass.core.ir;

/**
 * A statement. The set of statement kinds is closed, see {@link StmtVisitor}.
 */
public abstract class Stmt extends Node {
    Stmt() {
    }

    public abstract <R> R accept(StmtVisitor<R> visitor);
}
