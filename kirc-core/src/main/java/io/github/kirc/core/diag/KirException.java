package io.github.kirc.core.diag;

import io.github.kirc.core.ast.Span;
import org.jetbrains.annotations.Nullable;

/**
 * A fatal compile error, carrying its {@link Diagnostic}.
 */
public class KirException extends RuntimeException {
    private final Diagnostic diagnostic;

    public KirException(Diagnostic diagnostic) {
        super(diagnostic.toString());
        this.diagnostic = diagnostic;
    }

    public KirException(Diagnostic diagnostic, Throwable cause) {
        super(diagnostic.toString(), cause);
        this.diagnostic = diagnostic;
    }

    /**
     * Create an internal compiler error.
     *
     * @param stage    The stage.
     * @param function The function being compiled, if any.
     * @param message  The message.
     * @param span     The source span, if any.
     * @return The exception.
     */
    public static KirException internal(Stage stage, @Nullable String function, String message, @Nullable Span span) {
        return new KirException(new Diagnostic(Category.INTERNAL, stage, function, message, span));
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
