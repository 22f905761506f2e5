package io.github.kirc.core.ast;

import org.jetbrains.annotations.Nullable;

/**
 * A global variable, with an optional literal initializer ({@link Long}, {@link Double} or {@link Boolean}).
 */
public final class GlobalDecl extends AstNode {
    public final String name;
    public final AstType type;
    @Nullable
    public final Object initializer;

    public GlobalDecl(Span span, String name, AstType type, @Nullable Object initializer) {
        super(span);
        this.name = name;
        this.type = type;
        this.initializer = initializer;
    }
}
