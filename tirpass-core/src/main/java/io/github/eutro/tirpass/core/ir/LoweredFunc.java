package io.github.eutro.tirpass.core.ir;

import io.github.eutro.tirpass.core.ext.ExtHolder;

import java.util.*;

/**
 * A function after lowering: parameters, a body, and where it runs.
 * <p>
 * Instances are immutable apart from their exts; use {@link #withBody(Stmt)} and
 * {@link #withKind(Kind)} to derive new ones.
 */
public final class LoweredFunc extends ExtHolder {
    public enum Kind {
        /**
         * Still contains device regions that have not been split out.
         */
        MIXED,
        /**
         * Runs on the host, and launches device functions.
         */
        HOST,
        /**
         * A kernel extracted to run on the device.
         */
        DEVICE
    }

    public final String name;
    public final List<Var> args;
    public final Stmt body;
    public final Kind kind;
    public final List<IterVar> threadAxis;
    /**
     * The element types of the buffers that handle parameters point to, where known.
     */
    public final Map<Var, DataType> handleDataType;

    public LoweredFunc(
            String name,
            List<Var> args,
            Stmt body,
            Kind kind,
            List<IterVar> threadAxis,
            Map<Var, DataType> handleDataType
    ) {
        this.name = name;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.body = body;
        this.kind = kind;
        this.threadAxis = Collections.unmodifiableList(new ArrayList<>(threadAxis));
        this.handleDataType = Collections.unmodifiableMap(new LinkedHashMap<>(handleDataType));
    }

    public LoweredFunc(String name, List<Var> args, Stmt body, Kind kind) {
        this(name, args, body, kind, Collections.emptyList(), Collections.emptyMap());
    }

    public LoweredFunc withBody(Stmt body) {
        return copy(body, kind);
    }

    public LoweredFunc withKind(Kind kind) {
        return copy(body, kind);
    }

    private LoweredFunc copy(Stmt body, Kind kind) {
        LoweredFunc func = new LoweredFunc(name, args, body, kind, threadAxis, handleDataType);
        copyExtsInto(func);
        return func;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.name().toLowerCase(Locale.ROOT)).append(" fn ").append(name).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i != 0) sb.append(", ");
            Var arg = args.get(i);
            sb.append(arg.displayName()).append(": ").append(arg.type);
            DataType elemType = handleDataType.get(arg);
            if (elemType != null) sb.append('*').append(elemType);
        }
        sb.append(") {\n").append(body.toString().replaceAll("(?m)^", "  ")).append("\n}");
        return sb.toString();
    }
}
