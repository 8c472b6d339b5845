package io.github.eutro.tirpass.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A call, either to a named intrinsic or external function, or to a {@link FunctionRef}.
 */
public final class Call extends Expr {
    /**
     * The intrinsic invoking a device function by name with a flat list of arguments.
     * <p>
     * Its arguments are the name of the function as a {@link StringImm},
     * the parameters of the function, then the thread extents.
     */
    public static final String CALL_PACKED = "call_packed";

    public final String name;
    public final List<Expr> args;
    public final CallType callType;
    @Nullable
    public final FunctionRef func;
    public final int valueIndex;

    public Call(DataType type, String name, List<? extends Expr> args, CallType callType, @Nullable FunctionRef func, int valueIndex) {
        super(type);
        this.name = name;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.callType = callType;
        this.func = func;
        this.valueIndex = valueIndex;
    }

    public Call(DataType type, String name, List<? extends Expr> args, CallType callType) {
        this(type, name, args, callType, null, 0);
    }

    /**
     * Construct a call producing output {@code valueIndex} of {@code func}.
     *
     * @param type       The type of the output.
     * @param func       The function.
     * @param args       The arguments.
     * @param valueIndex The output to produce.
     */
    public Call(DataType type, FunctionRef func, List<? extends Expr> args, int valueIndex) {
        this(type, func.name, args, CallType.HALIDE, func, valueIndex);
    }

    public boolean isIntrinsic(String intrinsic) {
        return (callType == CallType.INTRINSIC || callType == CallType.PURE_INTRINSIC)
                && name.equals(intrinsic);
    }

    /**
     * Rebuild this call over new arguments, keeping everything else.
     *
     * @param args The new arguments.
     * @return The new call.
     */
    public Call withArgs(List<Expr> args) {
        return new Call(type, name, args, callType, func, valueIndex);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
