package io.github.eutro.tirpass.core.ir;

public interface ExprVisitor<R> {
    R visitIntImm(IntImm e);

    R visitFloatImm(FloatImm e);

    R visitStringImm(StringImm e);

    R visitVar(Var e);

    R visitBinary(Binary e);

    R visitCast(Cast e);

    R visitSelect(Select e);

    R visitLoad(Load e);

    R visitLet(Let e);

    R visitCall(Call e);
}
