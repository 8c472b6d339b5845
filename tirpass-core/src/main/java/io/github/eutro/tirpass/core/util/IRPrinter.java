package io.github.eutro.tirpass.core.util;

import io.github.eutro.tirpass.core.ir.*;

import java.util.Locale;

/**
 * Renders IR as readable, C-like text. Used by {@code toString} of every node.
 */
public final class IRPrinter implements ExprVisitor<Void>, StmtVisitor<Void> {
    private final StringBuilder sb = new StringBuilder();
    private int indent = 0;

    private IRPrinter() {
    }

    public static String print(Node node) {
        IRPrinter printer = new IRPrinter();
        if (node instanceof Expr) {
            ((Expr) node).accept(printer);
        } else {
            ((Stmt) node).accept(printer);
            // every statement ends its last line
            printer.sb.setLength(printer.sb.length() - 1);
        }
        return printer.sb.toString();
    }

    private void print(Expr expr) {
        expr.accept(this);
    }

    private void print(Stmt stmt) {
        stmt.accept(this);
    }

    private void printIndent() {
        for (int i = 0; i < indent; i++) {
            sb.append("  ");
        }
    }

    private void printBlock(Stmt body) {
        sb.append("{\n");
        indent++;
        print(body);
        indent--;
        printIndent();
        sb.append('}');
    }

    private static String nodeString(Object node) {
        if (node instanceof Var) return ((Var) node).displayName();
        return String.valueOf(node);
    }

    @Override
    public Void visitIntImm(IntImm e) {
        if (e.type.equals(DataType.INT32)) {
            sb.append(e.value);
        } else {
            sb.append('(').append(e.type).append(')').append(e.value);
        }
        return null;
    }

    @Override
    public Void visitFloatImm(FloatImm e) {
        if (e.type.equals(DataType.FLOAT32)) {
            sb.append(e.value).append('f');
        } else if (e.type.equals(DataType.FLOAT64)) {
            sb.append(e.value);
        } else {
            sb.append('(').append(e.type).append(')').append(e.value);
        }
        return null;
    }

    @Override
    public Void visitStringImm(StringImm e) {
        sb.append('"');
        for (char c : e.value.toCharArray()) {
            if (c == '"' || c == '\\') sb.append('\\');
            sb.append(c);
        }
        sb.append('"');
        return null;
    }

    @Override
    public Void visitVar(Var e) {
        sb.append(e.displayName());
        return null;
    }

    @Override
    public Void visitBinary(Binary e) {
        if (e.op.isInfix()) {
            sb.append('(');
            print(e.a);
            sb.append(' ').append(e.op.symbol).append(' ');
            print(e.b);
            sb.append(')');
        } else {
            sb.append(e.op.symbol).append('(');
            print(e.a);
            sb.append(", ");
            print(e.b);
            sb.append(')');
        }
        return null;
    }

    @Override
    public Void visitCast(Cast e) {
        sb.append(e.type).append('(');
        print(e.value);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitSelect(Select e) {
        sb.append("select(");
        print(e.cond);
        sb.append(", ");
        print(e.trueValue);
        sb.append(", ");
        print(e.falseValue);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitLoad(Load e) {
        sb.append(e.bufferVar.displayName()).append('[');
        print(e.index);
        sb.append(']');
        return null;
    }

    @Override
    public Void visitLet(Let e) {
        sb.append("(let ").append(e.var.displayName()).append(" = ");
        print(e.value);
        sb.append(" in ");
        print(e.body);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitCall(Call e) {
        sb.append(e.name).append('(');
        for (int i = 0; i < e.args.size(); i++) {
            if (i != 0) sb.append(", ");
            print(e.args.get(i));
        }
        sb.append(')');
        if (e.valueIndex != 0) sb.append('#').append(e.valueIndex);
        return null;
    }

    @Override
    public Void visitLetStmt(LetStmt s) {
        printIndent();
        sb.append("let ").append(s.var.displayName()).append(" = ");
        print(s.value);
        sb.append('\n');
        print(s.body);
        return null;
    }

    @Override
    public Void visitAttrStmt(AttrStmt s) {
        printIndent();
        sb.append("// attr [").append(nodeString(s.node)).append("] ").append(s.key).append(" = ");
        print(s.value);
        sb.append('\n');
        print(s.body);
        return null;
    }

    @Override
    public Void visitFor(For s) {
        printIndent();
        if (s.kind != For.Kind.SERIAL) {
            sb.append(s.kind.name().toLowerCase(Locale.ROOT)).append(' ');
        }
        sb.append("for (").append(s.loopVar.displayName()).append(", ");
        print(s.min);
        sb.append(", ");
        print(s.extent);
        sb.append(") ");
        printBlock(s.body);
        sb.append('\n');
        return null;
    }

    @Override
    public Void visitAllocate(Allocate s) {
        printIndent();
        sb.append("allocate ").append(s.bufferVar.displayName()).append('[').append(s.elemType);
        for (Expr extent : s.extents) {
            sb.append(" * ");
            print(extent);
        }
        sb.append(']');
        if (!(s.condition instanceof IntImm && ((IntImm) s.condition).value == 1)) {
            sb.append(" if ");
            print(s.condition);
        }
        sb.append('\n');
        print(s.body);
        return null;
    }

    @Override
    public Void visitStore(Store s) {
        printIndent();
        sb.append(s.bufferVar.displayName()).append('[');
        print(s.index);
        sb.append("] = ");
        print(s.value);
        sb.append('\n');
        return null;
    }

    @Override
    public Void visitEvaluate(Evaluate s) {
        printIndent();
        print(s.value);
        sb.append('\n');
        return null;
    }

    @Override
    public Void visitSeqStmt(SeqStmt s) {
        for (Stmt stmt : s.seq) {
            print(stmt);
        }
        return null;
    }

    @Override
    public Void visitIfThenElse(IfThenElse s) {
        printIndent();
        sb.append("if (");
        print(s.cond);
        sb.append(") ");
        printBlock(s.thenCase);
        if (s.elseCase != null) {
            sb.append(" else ");
            printBlock(s.elseCase);
        }
        sb.append('\n');
        return null;
    }
}
