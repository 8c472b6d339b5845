package io.github.eutro.tirpass.core.ir;

import io.github.eutro.tirpass.core.util.IRPrinter;

/**
 * A node of the IR tree, either an {@link Expr} or a {@link Stmt}.
 * <p>
 * Nodes are immutable, and passes share unchanged subtrees between their input and output,
 * so two nodes being the same reference is meaningful.
 */
public abstract class Node {
    public static boolean TRACK_NODE_CREATIONS = System.getenv("TIRPASS_TRACK_NODE_CREATIONS") != null;

    public final Throwable created = TRACK_NODE_CREATIONS ? new Throwable("constructed") : null;

    Node() {
    }

    @Override
    public String toString() {
        return IRPrinter.print(this);
    }
}
