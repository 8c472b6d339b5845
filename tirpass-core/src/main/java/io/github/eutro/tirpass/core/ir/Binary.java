package io.github.eutro.tirpass.core.ir;

/**
 * A binary arithmetic, comparison or logical operation.
 */
public final class Binary extends Expr {
    public enum Op {
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),
        MIN("min"),
        MAX("max"),
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        AND("&&"),
        OR("||");

        public final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        public boolean isComparison() {
            return compareTo(EQ) >= 0 && compareTo(GE) <= 0;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }

        public boolean isInfix() {
            return this != MIN && this != MAX;
        }
    }

    public final Op op;
    public final Expr a;
    public final Expr b;

    public Binary(Op op, Expr a, Expr b) {
        super(resultType(op, a));
        this.op = op;
        this.a = a;
        this.b = b;
    }

    private static DataType resultType(Op op, Expr a) {
        if (op.isComparison() || op.isLogical()) {
            return DataType.BOOL.withLanes(a.type.lanes);
        }
        return a.type;
    }

    public static Binary add(Expr a, Expr b) {
        return new Binary(Op.ADD, a, b);
    }

    public static Binary sub(Expr a, Expr b) {
        return new Binary(Op.SUB, a, b);
    }

    public static Binary mul(Expr a, Expr b) {
        return new Binary(Op.MUL, a, b);
    }

    public static Binary lt(Expr a, Expr b) {
        return new Binary(Op.LT, a, b);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
