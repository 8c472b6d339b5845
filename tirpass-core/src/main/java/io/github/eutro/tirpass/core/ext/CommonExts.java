package io.github.eutro.tirpass.core.ext;

public class CommonExts {
    /**
     * On a {@link io.github.eutro.tirpass.core.ir.FunctionRef}: calls to it have no observable side effect.
     */
    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");

    /**
     * On a {@link io.github.eutro.tirpass.core.ir.FunctionRef}: the name and descriptor
     * of the Java method its body was lifted from.
     */
    public static final Ext<String> LIFTED_FROM = Ext.create(String.class, "LIFTED_FROM");

    /**
     * On a {@link io.github.eutro.tirpass.core.ir.LoweredFunc}: the name of the function it was split from.
     */
    public static final Ext<String> SPLIT_FROM = Ext.create(String.class, "SPLIT_FROM");

    public static <T extends ExtContainer> T markPure(T t) {
        t.attachExt(IS_PURE, true);
        return t;
    }
}
