package io.github.kirc.core.ast;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function of the program. A declaration without a body is external.
 */
public final class FunctionDecl extends AstNode {
    public final String name;
    public final List<Binding> params;
    public final AstType returnType;
    @Nullable
    public final Expr.BlockExpr body;
    public final boolean inline;
    public final boolean pure;

    public FunctionDecl(Span span, String name, List<Binding> params, AstType returnType,
                        @Nullable Expr.BlockExpr body, boolean inline, boolean pure) {
        super(span);
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.returnType = returnType;
        this.body = body;
        this.inline = inline;
        this.pure = pure;
    }

    public FunctionDecl(Span span, String name, List<Binding> params, AstType returnType, @Nullable Expr.BlockExpr body) {
        this(span, name, params, returnType, body, false, false);
    }
}
