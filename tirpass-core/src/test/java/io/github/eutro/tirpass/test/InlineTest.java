package io.github.eutro.tirpass.test;

import io.github.eutro.tirpass.core.ext.CommonExts;
import io.github.eutro.tirpass.core.ir.*;
import io.github.eutro.tirpass.core.passes.form.Inline;
import io.github.eutro.tirpass.core.passes.meta.VerifySSA;
import io.github.eutro.tirpass.core.util.StmtExprVisitor;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.tirpass.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class InlineTest {
    private static Callee add() {
        Var a = intVar("a");
        Var b = intVar("b");
        return new Callee(new FunctionRef("g", 1), Arrays.asList(a, b), Binary.add(a, b));
    }

    private static Callee square() {
        Var a = intVar("a");
        return new Callee(new FunctionRef("h", 1), Collections.singletonList(a), Binary.mul(a, a));
    }

    private static int countCalls(Stmt stmt, FunctionRef ref) {
        int[] count = {0};
        new StmtExprVisitor() {
            @Override
            public Void visitCall(Call e) {
                if (e.func == ref) count[0]++;
                return super.visitCall(e);
            }
        }.visitStmt(stmt);
        return count[0];
    }

    @Test
    void testPureArguments() {
        Callee g = add();
        Var p = intVar("p");
        Var buf = handle("buf");
        Stmt before = new Evaluate(extern("print", p));
        Stmt stmt = SeqStmt.flatten(before, new Store(buf, g.call(p, imm(3)), imm(0)));

        Stmt result = new Inline(g).run(stmt);
        assertStructurallyEqual(SeqStmt.flatten(before, new Store(buf, Binary.add(p, imm(3)), imm(0))), result);
        assertSame(before, ((SeqStmt) result).seq.get(0));
        assertEquals(0, countCalls(result, g.ref));
    }

    @Test
    void testEffectfulArgument() {
        Callee h = square();
        Var a = h.params.get(0);
        Call read = extern("effectfulRead");

        Stmt result = Inline.inline(new Evaluate(h.call(read)), h.ref, h.params, h.body);
        assertStructurallyEqual(new Evaluate(new Let(a, read, Binary.mul(a, a))), result);
        Let let = (Let) ((Evaluate) result).value;
        assertSame(a, let.var);
        assertSame(read, let.value);
    }

    @Test
    void testEffectPathBindsEveryParameterInOrder() {
        Var a = intVar("a");
        Var b = intVar("b");
        Callee second = new Callee(new FunctionRef("second", 1), Arrays.asList(a, b), b);
        Call read = extern("read");

        Stmt result = new Inline(second).run(new Evaluate(second.call(read, imm(2))));
        assertStructurallyEqual(new Evaluate(new Let(a, read, new Let(b, imm(2), b))), result);
    }

    @Test
    void testNestedCalls() {
        Callee g = add();
        Var p = intVar("p");
        Stmt result = new Inline(g).run(new Evaluate(g.call(g.call(p, imm(1)), imm(2))));
        assertStructurallyEqual(new Evaluate(Binary.add(Binary.add(p, imm(1)), imm(2))), result);
    }

    @Test
    void testRepeatedSitesRenormalized() {
        Callee h = square();
        Stmt stmt = SeqStmt.flatten(
                new Evaluate(h.call(extern("read"))),
                new Evaluate(h.call(extern("read")))
        );
        Stmt result = new Inline(h).run(stmt);
        assertTrue(VerifySSA.INSTANCE.run(result));

        Let first = (Let) ((Evaluate) ((SeqStmt) result).seq.get(0)).value;
        Let second = (Let) ((Evaluate) ((SeqStmt) result).seq.get(1)).value;
        assertNotSame(first.var, second.var);
        assertEquals("a", second.var.name);
        assertSame(second.var, ((Binary) second.body).a);
    }

    @Test
    void testPureCallArgument() {
        Callee g = add();
        FunctionRef sqrt = CommonExts.markPure(new FunctionRef("sqrt", 1));
        Var p = intVar("p");
        Call arg = new Call(DataType.INT32, sqrt, Collections.singletonList(p), 0);

        Stmt result = new Inline(g).run(new Evaluate(g.call(arg, arg)));
        assertStructurallyEqual(new Evaluate(Binary.add(arg, arg)), result);
    }

    @Test
    void testUnchanged() {
        Callee g = add();
        Stmt stmt = new Evaluate(extern("g", imm(1), imm(2)));
        assertSame(stmt, new Inline(g).run(stmt));

        Stmt otherOutput = new Evaluate(new Call(DataType.INT32, g.ref, Arrays.asList(imm(1), imm(2)), 1));
        assertSame(otherOutput, new Inline(g).run(otherOutput));
    }

    @Test
    void testArityMismatch() {
        Callee g = add();
        Stmt stmt = new Evaluate(g.call(imm(1)));
        assertThrows(IllegalArgumentException.class, () -> new Inline(g).run(stmt));
    }

    @Test
    void testMultipleOutputs() {
        Var a = intVar("a");
        FunctionRef divmod = new FunctionRef("divmod", 2);
        assertThrows(IllegalArgumentException.class, () -> new Inline(divmod, Collections.singletonList(a), a));
    }
}
