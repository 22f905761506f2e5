package io.github.kirc.core.ast;

/**
 * A range of source text, carried from the front end into diagnostics.
 */
public final class Span {
    public static final Span NONE = new Span(0, 0, 0, 0);

    public final int start;
    public final int end;
    public final int line;
    public final int column;

    public Span(int start, int end, int line, int column) {
        this.start = start;
        this.end = end;
        this.line = line;
        this.column = column;
    }

    public static Span at(int line, int column) {
        return new Span(0, 0, line, column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
