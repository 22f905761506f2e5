package io.github.kirc.core.ast;

/**
 * Base class of typed AST nodes.
 */
public abstract class AstNode {
    public final Span span;

    protected AstNode(Span span) {
        this.span = span;
    }
}
