package io.github.eutro.tirpass.test;

import io.github.eutro.tirpass.core.ir.*;
import io.github.eutro.tirpass.core.util.StructuralEquality;
import org.junit.jupiter.api.Assertions;

import java.util.Arrays;

public class Utils {
    public static Var intVar(String name) {
        return new Var(name, DataType.INT32);
    }

    public static Var handle(String name) {
        return new Var(name, DataType.HANDLE);
    }

    public static IterVar threadAxis(String tag) {
        return new IterVar(intVar(tag), tag);
    }

    public static IntImm imm(int value) {
        return IntImm.int32(value);
    }

    /**
     * A call to an external function, which may have side effects.
     */
    public static Call extern(String name, Expr... args) {
        return new Call(DataType.INT32, name, Arrays.asList(args), CallType.EXTERN);
    }

    public static AttrStmt threadExtent(IterVar iv, Expr extent, Stmt body) {
        return new AttrStmt(iv, AttrKeys.THREAD_EXTENT, extent, body);
    }

    public static void assertStructurallyEqual(Node expected, Node actual) {
        if (!StructuralEquality.equal(expected, actual)) {
            Assertions.fail("expected:\n" + expected + "\nbut was:\n" + actual);
        }
    }
}
