package io.github.eutro.tirpass.core.ext;

import org.jetbrains.annotations.Nullable;

/**
 * A key under which a value of type {@code T} can be stored in an {@link ExtContainer}.
 * <p>
 * Exts are compared by identity, so two exts with the same name are still different keys.
 *
 * @param <T> The type of the ext.
 */
public final class Ext<T> {
    private final Class<? super T> type;
    private final String name;

    private Ext(Class<? super T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * The class is only the erased type of the ext's values, so {@code R} may be
     * a parameterisation of {@code T} that a {@link Class} cannot express.
     *
     * @param type The erased type of the ext.
     * @param name The name of the ext, for debugging.
     * @param <T>  The erased type.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    public String getName() {
        return name;
    }

    /**
     * Check that a value may be stored under this ext.
     *
     * @param value The value.
     * @return The value.
     * @throws ClassCastException If it is not of the erased type of this ext.
     */
    @Nullable
    T check(@Nullable T value) {
        type.cast(value);
        return value;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
