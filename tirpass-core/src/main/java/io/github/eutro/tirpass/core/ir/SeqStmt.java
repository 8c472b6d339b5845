package io.github.eutro.tirpass.core.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A sequence of statements, executed in order.
 * <p>
 * Sequences are kept flat, so a long straight-line program is one wide node rather than a deep chain.
 */
public final class SeqStmt extends Stmt {
    public final List<Stmt> seq;

    public SeqStmt(List<? extends Stmt> seq) {
        if (seq.isEmpty()) throw new IllegalArgumentException("empty sequence");
        this.seq = Collections.unmodifiableList(new ArrayList<>(seq));
    }

    /**
     * Sequence the given statements, flattening nested sequences.
     *
     * @param stmts The statements.
     * @return The single statement if there is only one, otherwise the sequence.
     */
    public static Stmt flatten(Stmt... stmts) {
        return flatten(Arrays.asList(stmts));
    }

    public static Stmt flatten(List<? extends Stmt> stmts) {
        List<Stmt> flat = new ArrayList<>();
        for (Stmt stmt : stmts) {
            if (stmt instanceof SeqStmt) {
                flat.addAll(((SeqStmt) stmt).seq);
            } else {
                flat.add(stmt);
            }
        }
        return flat.size() == 1 ? flat.get(0) : new SeqStmt(flat);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitSeqStmt(this);
    }
}
