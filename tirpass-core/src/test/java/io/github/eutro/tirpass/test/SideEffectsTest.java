package io.github.eutro.tirpass.test;

import io.github.eutro.tirpass.core.ext.CommonExts;
import io.github.eutro.tirpass.core.ir.*;
import io.github.eutro.tirpass.core.passes.meta.SideEffects;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static io.github.eutro.tirpass.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class SideEffectsTest {
    @Test
    void testPureExpressions() {
        Var a = intVar("a");
        Var buf = handle("buf");
        assertFalse(SideEffects.hasSideEffect(imm(1)));
        assertFalse(SideEffects.hasSideEffect(new Select(Binary.lt(a, imm(0)), a, new Load(DataType.INT32, buf, a))));
        assertFalse(SideEffects.hasSideEffect(new Call(DataType.INT32, "abs", Collections.singletonList(a), CallType.PURE_INTRINSIC)));
    }

    @Test
    void testEffectfulCalls() {
        Var a = intVar("a");
        assertTrue(SideEffects.hasSideEffect(extern("read")));
        assertTrue(SideEffects.hasSideEffect(Binary.add(a, new Cast(DataType.INT32, extern("read")))));
        assertTrue(SideEffects.hasSideEffect(new Let(a, extern("read"), a)));
    }

    @Test
    void testPureFunctionRef() {
        FunctionRef ref = new FunctionRef("rand", 1);
        Call call = new Call(DataType.INT32, "rand", Collections.emptyList(), CallType.EXTERN, ref, 0);
        assertTrue(SideEffects.hasSideEffect(call));
        CommonExts.markPure(ref);
        assertFalse(SideEffects.hasSideEffect(call));
    }
}
