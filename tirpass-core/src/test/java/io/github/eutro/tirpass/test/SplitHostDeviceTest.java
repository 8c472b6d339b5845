package io.github.eutro.tirpass.test;

import io.github.eutro.tirpass.core.ext.CommonExts;
import io.github.eutro.tirpass.core.ir.*;
import io.github.eutro.tirpass.core.passes.convert.SplitHostDevice;
import io.github.eutro.tirpass.core.passes.meta.UseDefAnalysis;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.tirpass.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class SplitHostDeviceTest {
    private static Evaluate callPacked(Expr... args) {
        return new Evaluate(new Call(DataType.INT32, Call.CALL_PACKED, Arrays.asList(args), CallType.INTRINSIC));
    }

    @Test
    void testSplitScenario() {
        Var buf = handle("buf");
        Var x = intVar("x");
        IterVar tx = threadAxis("threadIdx.x");
        AttrStmt region = threadExtent(tx, imm(8), new Store(buf, Binary.add(x, tx.var), tx.var));
        LoweredFunc f = new LoweredFunc(
                "f",
                Collections.singletonList(buf),
                new LetStmt(x, imm(5), region),
                LoweredFunc.Kind.MIXED,
                Collections.emptyList(),
                Collections.singletonMap(buf, DataType.FLOAT32)
        );

        List<LoweredFunc> funcs = SplitHostDevice.splitHostDevice(f);
        assertEquals(2, funcs.size());

        LoweredFunc host = funcs.get(0);
        assertEquals("f", host.name);
        assertEquals(LoweredFunc.Kind.HOST, host.kind);
        assertEquals(f.args, host.args);
        assertEquals(f.handleDataType, host.handleDataType);
        assertStructurallyEqual(
                new LetStmt(x, imm(5), callPacked(new StringImm("f_kernel0"), buf, x, imm(8))),
                host.body
        );

        LoweredFunc kernel = funcs.get(1);
        assertEquals("f_kernel0", kernel.name);
        assertEquals(LoweredFunc.Kind.DEVICE, kernel.kind);
        assertEquals(Arrays.asList(buf, x), kernel.args);
        assertEquals(Collections.singletonList(tx), kernel.threadAxis);
        assertEquals(DataType.FLOAT32, kernel.handleDataType.get(buf));
        assertSame(region, kernel.body);
        assertEquals("f", kernel.getExtOrThrow(CommonExts.SPLIT_FROM));
    }

    @Test
    void testNotMixed() {
        LoweredFunc f = new LoweredFunc("f", Collections.emptyList(), new Evaluate(imm(0)), LoweredFunc.Kind.HOST);
        assertThrows(IllegalArgumentException.class, () -> SplitHostDevice.INSTANCE.run(f));
    }

    @Test
    void testNoRegions() {
        Var a = intVar("a");
        Stmt body = new Evaluate(extern("print", a));
        LoweredFunc f = new LoweredFunc("f", Collections.singletonList(a), body, LoweredFunc.Kind.MIXED);
        List<LoweredFunc> funcs = SplitHostDevice.INSTANCE.run(f);
        assertEquals(1, funcs.size());
        assertSame(body, funcs.get(0).body);
        assertEquals(LoweredFunc.Kind.HOST, funcs.get(0).kind);
    }

    @Test
    void testOutermostRegionsOnly() {
        Var buf = handle("buf");
        IterVar bx = threadAxis("blockIdx.x");
        IterVar tx = threadAxis("threadIdx.x");
        Stmt body = SeqStmt.flatten(
                threadExtent(bx, imm(4), threadExtent(tx, imm(32),
                        new Store(buf, imm(0), Binary.add(Binary.mul(bx.var, imm(32)), tx.var)))),
                new AttrStmt(null, AttrKeys.DEVICE_SCOPE, imm(0), new Store(buf, imm(1), imm(0))),
                new AttrStmt(null, AttrKeys.PIPELINE_EXEC_SCOPE, imm(1), new Store(buf, imm(2), imm(1))),
                new AttrStmt(buf, AttrKeys.STORAGE_SCOPE, new StringImm("global"), new Evaluate(imm(0)))
        );
        LoweredFunc f = new LoweredFunc("f", Collections.singletonList(buf), body, LoweredFunc.Kind.MIXED);
        List<LoweredFunc> funcs = SplitHostDevice.INSTANCE.run(f);

        assertEquals(4, funcs.size());
        for (int k = 0; k < 3; k++) {
            LoweredFunc kernel = funcs.get(k + 1);
            assertEquals("f_kernel" + k, kernel.name);
            assertTrue(UseDefAnalysis.undefinedVars(kernel.body, kernel.args).isEmpty(),
                    () -> kernel + " is not closed");
        }
        assertEquals(Arrays.asList(bx, tx), funcs.get(1).threadAxis);
        assertStructurallyEqual(
                callPacked(new StringImm("f_kernel0"), buf, imm(4), imm(32)),
                ((SeqStmt) funcs.get(0).body).seq.get(0)
        );
        // non-device attributes stay in the host
        assertTrue(((SeqStmt) funcs.get(0).body).seq.get(3) instanceof AttrStmt);
    }

    @Test
    void testParameterOrder() {
        Var out = handle("out");
        Var in = handle("in");
        Var n = intVar("n");
        IterVar tx = threadAxis("threadIdx.x");
        Stmt region = threadExtent(tx, imm(16), new IfThenElse(
                Binary.lt(tx.var, n),
                new Store(out, new Load(DataType.INT32, in, tx.var), tx.var),
                null
        ));
        LoweredFunc f = new LoweredFunc(
                "f",
                Arrays.asList(out, n),
                new Allocate(in, DataType.INT32, Collections.singletonList(imm(16)), region),
                LoweredFunc.Kind.MIXED,
                Collections.emptyList(),
                Collections.singletonMap(out, DataType.FLOAT32)
        );
        List<LoweredFunc> funcs = SplitHostDevice.INSTANCE.run(f);
        LoweredFunc kernel = funcs.get(1);

        assertEquals(Arrays.asList(out, in, n), kernel.args);
        assertEquals(DataType.FLOAT32, kernel.handleDataType.get(out));
        assertEquals(DataType.INT32, kernel.handleDataType.get(in));

        Allocate hostBody = (Allocate) funcs.get(0).body;
        Call call = (Call) ((Evaluate) hostBody.body).value;
        assertTrue(call.isIntrinsic(Call.CALL_PACKED));
        assertEquals(kernel.args, call.args.subList(1, 1 + kernel.args.size()));
        assertStructurallyEqual(imm(16), call.args.get(call.args.size() - 1));
    }

    @Test
    void testExtentSuppliedByCaller() {
        Var buf = handle("buf");
        Var m = intVar("m");
        IterVar tx = threadAxis("threadIdx.x");
        Stmt body = threadExtent(tx, m, new Store(buf, imm(0), tx.var));
        LoweredFunc f = new LoweredFunc("f", Arrays.asList(buf, m), body, LoweredFunc.Kind.MIXED);
        List<LoweredFunc> funcs = SplitHostDevice.INSTANCE.run(f);

        assertEquals(Collections.singletonList(buf), funcs.get(1).args);
        assertStructurallyEqual(callPacked(new StringImm("f_kernel0"), buf, m), funcs.get(0).body);
    }

    @Test
    void testDeadLetTrimmedFromKernel() {
        Var buf = handle("buf");
        Var unused = intVar("unused");
        IterVar tx = threadAxis("threadIdx.x");
        Stmt body = threadExtent(tx, imm(8),
                new LetStmt(unused, Binary.mul(tx.var, imm(2)), new Store(buf, imm(0), tx.var)));
        LoweredFunc f = new LoweredFunc("f", Collections.singletonList(buf), body, LoweredFunc.Kind.MIXED);
        LoweredFunc kernel = SplitHostDevice.INSTANCE.run(f).get(1);

        assertStructurallyEqual(threadExtent(tx, imm(8), new Store(buf, imm(0), tx.var)), kernel.body);
    }

    @Test
    void testSSAViolationPropagates() {
        Var buf = handle("buf");
        Var x = intVar("x");
        IterVar tx = threadAxis("threadIdx.x");
        Stmt body = threadExtent(tx, imm(8), new LetStmt(x, imm(1),
                new LetStmt(x, imm(2), new Store(buf, x, tx.var))));
        LoweredFunc f = new LoweredFunc("f", Collections.singletonList(buf), body, LoweredFunc.Kind.MIXED);
        assertThrows(SSAViolationException.class, () -> SplitHostDevice.INSTANCE.run(f));
    }

    @Test
    void testExtentDefinedInsideRegion() {
        Var buf = handle("buf");
        Var n = intVar("n");
        IterVar tx = threadAxis("threadIdx.x");
        Stmt body = new AttrStmt(null, AttrKeys.DEVICE_SCOPE, imm(0),
                new LetStmt(n, imm(8), threadExtent(tx, n, new Store(buf, imm(0), tx.var))));
        LoweredFunc f = new LoweredFunc("f", Collections.singletonList(buf), body, LoweredFunc.Kind.MIXED);
        IRInvariantException e = assertThrows(IRInvariantException.class, () -> SplitHostDevice.INSTANCE.run(f));
        assertTrue(e.getMessage().contains("f_kernel0"), e::getMessage);
    }
}
