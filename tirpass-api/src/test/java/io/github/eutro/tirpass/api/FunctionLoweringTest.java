package io.github.eutro.tirpass.api;

import io.github.eutro.tirpass.api.events.*;
import io.github.eutro.tirpass.core.ir.*;
import io.github.eutro.tirpass.core.passes.meta.UseDefAnalysis;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;

import static org.junit.jupiter.api.Assertions.*;

public class FunctionLoweringTest {
    private final Var buf = new Var("buf", DataType.HANDLE);
    private final Var p = new Var("p", DataType.INT32);
    private final IterVar tx = new IterVar(new Var("threadIdx.x", DataType.INT32), "threadIdx.x");

    private Callee addThree() {
        Var a = new Var("a", DataType.INT32);
        return new Callee(new FunctionRef("add3", 1), Collections.singletonList(a), Binary.add(a, IntImm.int32(3)));
    }

    private LoweredFunc mixed(Stmt body) {
        return new LoweredFunc("f", Arrays.asList(buf, p), body, LoweredFunc.Kind.MIXED);
    }

    private Stmt region(Expr value) {
        return new AttrStmt(tx, AttrKeys.THREAD_EXTENT, IntImm.int32(8), new Store(buf, value, tx.var));
    }

    @Test
    void testEventOrder() {
        LoweringCompiler cc = new LoweringCompiler();
        List<String> events = new ArrayList<>();
        cc.listen(RunLoweringEvent.class, evt -> events.add("run"));
        cc.lift().listen(HostPassesEvent.class, evt -> events.add("host"));
        cc.lift().listen(SplitEvent.class, evt -> events.add("split " + evt.funcs.size()));
        cc.lift().listen(EmitFunctionEvent.class, evt -> events.add("emit " + evt.func.name));
        BlockingQueue<LoweredFunc> outputs = cc.outputsAsQueue();

        List<LoweredFunc> emitted = cc.submit(mixed(region(p))).run();
        assertEquals(Arrays.asList("run", "host", "split 2", "emit f", "emit f_kernel0"), events);
        assertEquals(emitted, new ArrayList<>(outputs));
    }

    @Test
    void testInlineBeforeSplit() {
        Callee add3 = addThree();
        LoweringCompiler cc = new LoweringCompiler();
        List<LoweredFunc> funcs = cc.submit(mixed(region(add3.call(p))))
                .inline(add3)
                .setVerifySSA(true)
                .run();

        LoweredFunc kernel = funcs.get(1);
        Store store = (Store) ((AttrStmt) kernel.body).body;
        assertTrue(store.value instanceof Binary, store.value::toString);
        assertEquals(Arrays.asList(buf, p), kernel.args);
        assertTrue(UseDefAnalysis.undefinedVars(kernel.body, kernel.args).isEmpty());
    }

    @Test
    void testCancelEmit() {
        LoweringCompiler cc = new LoweringCompiler();
        cc.lift().listen(EmitFunctionEvent.class, evt -> {
            if (evt.func.kind == LoweredFunc.Kind.DEVICE) evt.cancel();
        });
        BlockingQueue<LoweredFunc> outputs = cc.outputsAsQueue();

        List<LoweredFunc> emitted = cc.submit(mixed(region(p))).run();
        assertEquals(1, emitted.size());
        assertEquals(LoweredFunc.Kind.HOST, emitted.get(0).kind);
        assertEquals(1, outputs.size());
    }

    @Test
    void testHostPassesReplaceFunction() {
        LoweringCompiler cc = new LoweringCompiler();
        FunctionLowering lowering = cc.submit(mixed(region(p)));
        lowering.listen(HostPassesEvent.class, evt -> evt.func = evt.func.withBody(new Evaluate(IntImm.int32(0))));
        assertEquals(1, lowering.run().size());
    }

    @Test
    void testVerifyFailureNamesStage() {
        Var x = new Var("x", DataType.INT32);
        Stmt body = new LetStmt(x, IntImm.int32(1), new LetStmt(x, IntImm.int32(2), new Evaluate(x)));
        FunctionLowering lowering = new LoweringCompiler().submit(mixed(body)).setVerifySSA(true);

        SSAViolationException e = assertThrows(SSAViolationException.class, lowering::run);
        assertEquals("in stage verify of f", e.getSuppressed()[0].getMessage());
    }

    @Test
    void testSplitFailureNamesStage() {
        Var x = new Var("x", DataType.INT32);
        Stmt body = new AttrStmt(tx, AttrKeys.THREAD_EXTENT, IntImm.int32(8),
                new LetStmt(x, IntImm.int32(1), new LetStmt(x, IntImm.int32(2), new Store(buf, x, tx.var))));
        FunctionLowering lowering = new LoweringCompiler().submit(mixed(body)).setVerifySSA(false);

        SSAViolationException e = assertThrows(SSAViolationException.class, lowering::run);
        assertEquals("in stage split of f", e.getSuppressed()[0].getMessage());
    }

    @Test
    void testSubmitNonMixed() {
        LoweredFunc host = new LoweredFunc("f", Collections.emptyList(), new Evaluate(IntImm.int32(0)), LoweredFunc.Kind.HOST);
        assertThrows(IllegalArgumentException.class, () -> new LoweringCompiler().submit(host));
    }
}
