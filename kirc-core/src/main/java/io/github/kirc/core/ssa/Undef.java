package io.github.kirc.core.ssa;

import java.util.EnumMap;
import java.util.Map;

/**
 * An unspecified value of some type, read by loads that no store reaches.
 */
public final class Undef implements Value {
    private static final Map<Type, Undef> INSTANCES = new EnumMap<>(Type.class);

    static {
        for (Type type : Type.values()) {
            if (type != Type.VOID) INSTANCES.put(type, new Undef(type));
        }
    }

    private final Type type;

    private Undef(Type type) {
        this.type = type;
    }

    public static Undef of(Type type) {
        Undef undef = INSTANCES.get(type);
        if (undef == null) throw new IllegalArgumentException("no undef of type " + type);
        return undef;
    }

    @Override
    public Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return type + " undef";
    }
}
