package io.github.eutro.tirpass.core.ir;

public interface StmtVisitor<R> {
    R visitLetStmt(LetStmt s);

    R visitAttrStmt(AttrStmt s);

    R visitFor(For s);

    R visitAllocate(Allocate s);

    R visitStore(Store s);

    R visitEvaluate(Evaluate s);

    R visitSeqStmt(SeqStmt s);

    R visitIfThenElse(IfThenElse s);
}
