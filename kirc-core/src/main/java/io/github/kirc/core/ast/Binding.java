package io.github.kirc.core.ast;

/**
 * A resolved local name: a parameter, a {@code let} or a loop variable.
 * <p>
 * Bindings are compared by identity; the name is only for diagnostics and register hints.
 */
public final class Binding {
    public final String name;
    public final AstType type;

    public Binding(String name, AstType type) {
        this.name = name;
        this.type = type;
    }

    @Override
    public String toString() {
        return name + ": " + type;
    }
}
