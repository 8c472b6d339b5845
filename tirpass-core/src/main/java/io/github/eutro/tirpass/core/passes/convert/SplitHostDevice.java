package io.github.eutro.tirpass.core.passes.convert;

import io.github.eutro.tirpass.core.ext.CommonExts;
import io.github.eutro.tirpass.core.ir.*;
import io.github.eutro.tirpass.core.passes.IRPass;
import io.github.eutro.tirpass.core.passes.meta.UseDefAnalysis;
import io.github.eutro.tirpass.core.util.StmtExprMutator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Splits a {@link LoweredFunc.Kind#MIXED mixed} function into a host function and the device
 * functions it launches.
 * <p>
 * Every outermost {@link AttrKeys#THREAD_EXTENT thread extent}, {@link AttrKeys#PIPELINE_EXEC_SCOPE
 * pipeline exec scope} or {@link AttrKeys#DEVICE_SCOPE device scope} attribute of the host body becomes
 * a device function named {@code <name>_kernel<k>}, taking its free variables as parameters:
 * handles first, then scalars, each in the order they are first used. The region is replaced by a
 * {@link Call#CALL_PACKED call_packed} of the new function with its parameters and thread extents.
 * A thread extent referring to a variable defined inside its region is an {@link IRInvariantException}.
 * <p>
 * The result is the host function followed by the device functions in the order they were extracted.
 */
public class SplitHostDevice implements IRPass<LoweredFunc, List<LoweredFunc>> {
    private static final Logger logger = LoggerFactory.getLogger(SplitHostDevice.class);

    public static final SplitHostDevice INSTANCE = new SplitHostDevice();

    public static List<LoweredFunc> splitHostDevice(LoweredFunc func) {
        return INSTANCE.run(func);
    }

    @Override
    public List<LoweredFunc> run(LoweredFunc func) {
        if (func.kind != LoweredFunc.Kind.MIXED) {
            throw new IllegalArgumentException("can only split mixed functions, "
                    + func.name + " is " + func.kind);
        }
        Splitter splitter = new Splitter(func);
        Stmt body = splitter.visitStmt(func.body);
        List<LoweredFunc> ret = new ArrayList<>();
        ret.add(func.withBody(body).withKind(LoweredFunc.Kind.HOST));
        ret.addAll(splitter.deviceFuncs);
        logger.debug("split {} into a host function and {} device function(s)", func.name, splitter.deviceFuncs.size());
        return ret;
    }

    private static class Splitter extends StmtExprMutator {
        final String name;
        final Map<Var, DataType> handleDataType;
        final List<LoweredFunc> deviceFuncs = new ArrayList<>();

        Splitter(LoweredFunc func) {
            name = func.name;
            handleDataType = new IdentityHashMap<>(func.handleDataType);
        }

        @Override
        public Expr visitExpr(Expr expr) {
            return expr;
        }

        @Override
        public Stmt visitAllocate(Allocate s) {
            handleDataType.put(s.bufferVar, s.elemType);
            return super.visitAllocate(s);
        }

        @Override
        public Stmt visitAttrStmt(AttrStmt s) {
            switch (s.key) {
                case AttrKeys.THREAD_EXTENT:
                case AttrKeys.PIPELINE_EXEC_SCOPE:
                case AttrKeys.DEVICE_SCOPE:
                    return splitDeviceFunc(s);
                default:
                    return super.visitAttrStmt(s);
            }
        }

        private Stmt splitDeviceFunc(Stmt region) {
            String kernelName = name + "_kernel" + deviceFuncs.size();
            UseDefAnalysis.Result result = UseDefAnalysis.analyze(region, Collections.emptyList(), false);
            checkExtents(kernelName, result);

            List<Var> args = new ArrayList<>();
            Map<Var, DataType> kernelHandleTypes = new LinkedHashMap<>();
            for (Var var : result.undefined) {
                if (!var.type.isHandle()) continue;
                args.add(var);
                DataType elemType = handleDataType.get(var);
                if (elemType != null) kernelHandleTypes.put(var, elemType);
            }
            for (Var var : result.undefined) {
                if (!var.type.isHandle()) args.add(var);
            }

            LoweredFunc kernel = new LoweredFunc(
                    kernelName,
                    args,
                    result.body,
                    LoweredFunc.Kind.DEVICE,
                    result.threadAxis,
                    kernelHandleTypes
            );
            kernel.attachExt(CommonExts.SPLIT_FROM, name);
            deviceFuncs.add(kernel);
            logger.debug("extracted {} with {} parameter(s) and {} thread axis(es)",
                    kernelName, args.size(), result.threadAxis.size());

            List<Expr> callArgs = new ArrayList<>();
            callArgs.add(new StringImm(kernelName));
            callArgs.addAll(args);
            callArgs.addAll(result.threadExtent);
            return new Evaluate(new Call(DataType.INT32, Call.CALL_PACKED, callArgs, CallType.INTRINSIC));
        }

        /**
         * The host evaluates the thread extents before the launch, so they may only refer to
         * variables that are live outside the region.
         */
        private static void checkExtents(String kernelName, UseDefAnalysis.Result result) {
            for (int i = 0; i < result.threadExtent.size(); i++) {
                Expr extent = result.threadExtent.get(i);
                for (Var var : UseDefAnalysis.undefinedVars(new Evaluate(extent), Collections.emptyList())) {
                    if (result.defCount.containsKey(var)) {
                        throw new IRInvariantException("extent " + extent + " of " + result.threadAxis.get(i)
                                + " in " + kernelName + " refers to " + var.displayName()
                                + ", which is defined inside the device region");
                    }
                }
            }
        }
    }
}
