package io.github.eutro.tirpass.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An {@link ExtContainer} which stores its exts in insertion order.
 */
public class ExtHolder implements ExtContainer {
    // allocated on the first attach, most holders never get an ext
    @Nullable
    private Map<Ext<?>, Object> exts;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (exts == null) exts = new LinkedHashMap<>();
        exts.put(ext, ext.check(value));
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (exts != null && exts.remove(ext) != null && exts.isEmpty()) {
            exts = null;
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return exts == null ? null : (T) exts.get(ext);
    }

    /**
     * Copy every ext of this holder into another container.
     *
     * @param into The container to copy into.
     */
    @SuppressWarnings("unchecked")
    public void copyExtsInto(ExtContainer into) {
        if (exts == null) return;
        exts.forEach((ext, value) -> into.attachExt((Ext<Object>) ext, value));
    }
}
