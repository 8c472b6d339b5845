package io.github.eutro.tirpass.test;

import io.github.eutro.tirpass.core.ext.CommonExts;
import io.github.eutro.tirpass.core.ir.*;
import io.github.eutro.tirpass.core.passes.IRPass;
import io.github.eutro.tirpass.core.passes.convert.BytecodeToCallee;
import io.github.eutro.tirpass.core.passes.form.Inline;
import io.github.eutro.tirpass.core.util.ClassBytes;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;

import java.util.HashMap;
import java.util.Map;

import static io.github.eutro.tirpass.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class BytecodeToCalleeTest {
    @SuppressWarnings("unused")
    private static class Lifted {
        public static int add(int lhs, int rhs) {
            return lhs + rhs;
        }

        public static int clamp(int x) {
            return Math.max(0, Math.min(x, 255));
        }

        public static double scale(int a, double b) {
            return a * b;
        }

        public static long square(long x) {
            long sq = x * x;
            return sq;
        }

        public static int sum(int n) {
            int s = 0;
            for (int i = 0; i < n; i++) {
                s += i;
            }
            return s;
        }

        public int instance(int a) {
            return a;
        }
    }

    @Test
    void testLiftAll() {
        ClassNode cn = new ClassNode();
        ClassBytes.getClassReaderFor(Lifted.class).accept(cn, ClassReader.SKIP_DEBUG);

        Map<String, MethodNode> methodMap = new HashMap<>();
        for (MethodNode method : cn.methods) {
            methodMap.put(method.name, method);
        }
        IRPass<MethodNode, Callee> pass = BytecodeToCallee.INSTANCE;
        Callee add = pass.run(methodMap.get("add"));

        assertEquals("add", add.ref.name);
        assertEquals(2, add.params.size());
        assertEquals("param0", add.params.get(0).name);
        assertTrue(add.ref.getExt(CommonExts.IS_PURE).orElse(false));
        assertEquals("add(II)I", add.ref.getExtOrThrow(CommonExts.LIFTED_FROM));
        assertStructurallyEqual(Binary.add(add.params.get(0), add.params.get(1)), add.body);
    }

    @Test
    void testMathCalls() {
        Callee clamp = BytecodeToCallee.lift(Lifted.class, "clamp");
        Var x = clamp.params.get(0);
        assertStructurallyEqual(
                new Binary(Binary.Op.MAX, imm(0), new Binary(Binary.Op.MIN, x, imm(255))),
                clamp.body
        );
    }

    @Test
    void testConversions() {
        Callee scale = BytecodeToCallee.lift(Lifted.class, "scale");
        assertEquals(DataType.INT32, scale.params.get(0).type);
        assertEquals(DataType.FLOAT64, scale.params.get(1).type);
        assertEquals(DataType.FLOAT64, scale.body.type);
        assertStructurallyEqual(
                Binary.mul(new Cast(DataType.FLOAT64, scale.params.get(0)), scale.params.get(1)),
                scale.body
        );
    }

    @Test
    void testLocals() {
        Callee square = BytecodeToCallee.lift(Lifted.class, "square");
        Var x = square.params.get(0);
        assertEquals(DataType.INT64, x.type);
        assertStructurallyEqual(Binary.mul(x, x), square.body);
    }

    @Test
    void testRejected() {
        assertThrows(IllegalArgumentException.class, () -> BytecodeToCallee.lift(Lifted.class, "sum"));
        assertThrows(IllegalArgumentException.class, () -> BytecodeToCallee.lift(Lifted.class, "instance"));
        assertThrows(IllegalArgumentException.class, () -> BytecodeToCallee.lift(Lifted.class, "missing"));
    }

    @Test
    void testInlineLifted() {
        Callee add = BytecodeToCallee.lift(Lifted.class, "add");
        Var p = intVar("p");
        Var q = intVar("q");
        Stmt result = new Inline(add).run(new Evaluate(Binary.mul(add.call(p, q), imm(2))));
        assertStructurallyEqual(new Evaluate(Binary.mul(Binary.add(p, q), imm(2))), result);
    }
}
