package io.github.kirc.core.ssa;

import java.util.Objects;

/**
 * The address of a global symbol of the module.
 */
public final class GlobalRef implements Value {
    public final String name;

    public GlobalRef(String name) {
        this.name = Objects.requireNonNull(name);
    }

    @Override
    public Type getType() {
        return Type.PTR;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GlobalRef && ((GlobalRef) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "@" + name;
    }
}
