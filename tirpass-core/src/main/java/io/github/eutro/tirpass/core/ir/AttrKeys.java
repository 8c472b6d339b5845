package io.github.eutro.tirpass.core.ir;

/**
 * Well-known {@link AttrStmt#key attribute keys}.
 */
public final class AttrKeys {
    /**
     * Binds an {@link IterVar} to a hardware thread axis, with the value as its extent.
     */
    public static final String THREAD_EXTENT = "thread_extent";
    /**
     * Marks a pipeline stage executed on the device.
     */
    public static final String PIPELINE_EXEC_SCOPE = "pipeline_exec_scope";
    /**
     * Marks a region executed on the device without thread binding.
     */
    public static final String DEVICE_SCOPE = "device_scope";
    /**
     * Marks the storage scope of an allocated buffer. The node is the buffer variable.
     */
    public static final String STORAGE_SCOPE = "storage_scope";
    /**
     * A loop hint, carried through untouched.
     */
    public static final String PRAGMA_UNROLL = "pragma_unroll";

    private AttrKeys() {
    }
}
