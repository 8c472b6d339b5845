package io.github.eutro.tirpass.core.util;

import org.objectweb.asm.ClassReader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Finds the bytecode of loaded Java classes.
 */
public class ClassBytes {
    /**
     * Get a class reader over the bytecode of the given class, read from its class loader's resources.
     *
     * @param clazz The class.
     * @return The class reader.
     */
    public static ClassReader getClassReaderFor(Class<?> clazz) {
        String path = "/" + clazz.getName().replace('.', '/') + ".class";
        try (InputStream stream = clazz.getResourceAsStream(path)) {
            if (stream == null) {
                throw new IllegalArgumentException("no class file found for " + clazz.getName());
            }
            return new ClassReader(stream);
        } catch (IOException e) {
            throw new UncheckedIOException("reading class file of " + clazz.getName(), e);
        }
    }
}
