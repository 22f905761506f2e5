package io.github.kirc.core.ssa;

import org.jetbrains.annotations.Nullable;

/**
 * A global symbol of a module: a statically allocated region of memory.
 */
public final class Global {
    public final String name;
    public final Type type;
    @Nullable
    public final Constant initializer;
    public final int size;

    public Global(String name, Type type, @Nullable Constant initializer) {
        if (type == Type.VOID) throw new IllegalArgumentException("void global " + name);
        if (initializer != null && initializer.getType() != type) {
            throw new IllegalArgumentException("initializer of " + name + " is not a " + type);
        }
        this.name = name;
        this.type = type;
        this.initializer = initializer;
        this.size = type.bytes();
    }

    public GlobalRef ref() {
        return new GlobalRef(name);
    }

    @Override
    public String toString() {
        return "@" + name + ": " + type + (initializer == null ? "" : " = " + initializer);
    }
}
