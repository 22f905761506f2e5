package io.github.kirc.core.ssa;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The parameter and return types of a function.
 */
public final class Signature {
    public final List<Type> params;
    public final Type returnType;

    public Signature(List<Type> params, Type returnType) {
        for (Type param : params) {
            if (param == Type.VOID) throw new IllegalArgumentException("void parameter");
        }
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.returnType = returnType;
    }

    public static Signature of(Type returnType, Type... params) {
        return new Signature(Arrays.asList(params), returnType);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Signature)) return false;
        Signature that = (Signature) o;
        return params.equals(that.params) && returnType == that.returnType;
    }

    @Override
    public int hashCode() {
        return 31 * params.hashCode() + returnType.hashCode();
    }

    @Override
    public String toString() {
        return params.stream().map(Type::toString).collect(Collectors.joining(", ", "(", ")"))
                + " -> " + returnType;
    }
}
