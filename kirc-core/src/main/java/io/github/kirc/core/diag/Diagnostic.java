package io.github.kirc.core.diag;

import io.github.kirc.core.ast.Span;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * A structured report of a fatal compile error.
 */
public final class Diagnostic {
    @NotNull
    public final Category category;
    @NotNull
    public final Stage stage;
    @Nullable
    public final String function;
    @NotNull
    public final String message;
    @Nullable
    public final Span span;

    public Diagnostic(@NotNull Category category, @NotNull Stage stage, @Nullable String function,
                      @NotNull String message, @Nullable Span span) {
        this.category = category;
        this.stage = stage;
        this.function = function;
        this.message = message;
        this.span = span;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(stage.name().toLowerCase(Locale.ROOT)).append(": ");
        if (function != null) sb.append("in ").append(function).append(": ");
        sb.append(message);
        if (span != null) sb.append(" (at ").append(span).append(')');
        return sb.toString();
    }
}
