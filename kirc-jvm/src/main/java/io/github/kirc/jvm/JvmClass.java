package io.github.kirc.jvm;

/**
 * A class emitted by the {@link JvmBackend}.
 */
public final class JvmClass {
    /**
     * The binary name of the class.
     */
    public final String name;
    private final byte[] bytes;

    JvmClass(String name, byte[] bytes) {
        this.name = name;
        this.bytes = bytes;
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * Define the class in a fresh class loader, which can also see {@link KirRuntime}.
     *
     * @return The loaded class.
     */
    public Class<?> load() {
        return new DefiningClassLoader(KirRuntime.class.getClassLoader()).define(name, bytes);
    }

    private static class DefiningClassLoader extends ClassLoader {
        DefiningClassLoader(ClassLoader parent) {
            super(parent);
        }

        Class<?> define(String name, byte[] bytes) {
            return defineClass(name, bytes, 0, bytes.length);
        }
    }
}
