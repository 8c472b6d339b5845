package io.github.eutro.tirpass.test;

import io.github.eutro.tirpass.core.ir.*;
import io.github.eutro.tirpass.core.passes.misc.Substitute;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static io.github.eutro.tirpass.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class SubstituteTest {
    @Test
    void testSubstitute() {
        Var a = intVar("a");
        Var b = intVar("b");
        Var p = intVar("p");
        Map<Var, Expr> vmap = new HashMap<>();
        vmap.put(a, p);
        vmap.put(b, imm(3));
        assertStructurallyEqual(Binary.add(p, imm(3)), Substitute.substitute(Binary.add(a, b), vmap));
    }

    @Test
    void testUnmappedUnchanged() {
        Var a = intVar("a");
        Var c = intVar("c");
        Expr expr = Binary.mul(c, imm(2));
        assertSame(expr, Substitute.substitute(expr, Collections.singletonMap(a, imm(1))));
    }

    @Test
    void testRebindingShadows() {
        Var a = intVar("a");
        Expr inner = Binary.add(a, imm(1));
        Expr expr = Binary.mul(a, new Let(a, imm(5), inner));
        Expr result = Substitute.substitute(expr, Collections.singletonMap(a, imm(2)));

        Binary mul = (Binary) result;
        assertStructurallyEqual(imm(2), mul.a);
        assertSame(inner, ((Let) mul.b).body);
    }

    @Test
    void testBufferVar() {
        Var src = handle("src");
        Var dst = handle("dst");
        Var i = intVar("i");
        Stmt stmt = new Store(src, new Load(DataType.INT32, src, i), i);

        Stmt result = Substitute.substitute(stmt, Collections.singletonMap(src, dst));
        assertStructurallyEqual(new Store(dst, new Load(DataType.INT32, dst, i), i), result);
        assertThrows(IllegalArgumentException.class, () ->
                Substitute.substitute(stmt, Collections.singletonMap(src, new StringImm("nope"))));
    }

    @Test
    void testAllocateBindsOnlyBody() {
        Var buf = handle("buf");
        Var dst = handle("dst");
        Store store = new Store(buf, imm(0), imm(0));
        Stmt stmt = new Allocate(buf, DataType.INT32, Collections.singletonList(extern("size", buf)), store);

        Allocate result = (Allocate) Substitute.substitute(stmt, Collections.singletonMap(buf, dst));
        assertSame(buf, result.bufferVar);
        assertSame(dst, ((Call) result.extents.get(0)).args.get(0));
        assertSame(store, result.body);
    }
}
