package io.github.eutro.tirpass.core.ir;

/**
 * How a {@link Call} is dispatched, and whether it may have side effects.
 */
public enum CallType {
    /**
     * A call to an external function.
     */
    EXTERN(false),
    /**
     * A call to an external C++ function.
     */
    EXTERN_CPP(false),
    /**
     * A call to an external function known to be pure.
     */
    PURE_EXTERN(true),
    /**
     * A call to a {@link FunctionRef function} of the program, producing one of its outputs.
     */
    HALIDE(true),
    /**
     * A built-in operation of the compiler.
     */
    INTRINSIC(false),
    /**
     * A built-in operation of the compiler known to be pure.
     */
    PURE_INTRINSIC(true);

    public final boolean pure;

    CallType(boolean pure) {
        this.pure = pure;
    }
}
