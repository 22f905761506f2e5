package io.github.kirc.core.diag;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown by the verifier for the first IR invariant it finds violated.
 */
public class MalformedIrException extends KirException {
    public MalformedIrException(@Nullable String function, String message) {
        super(new Diagnostic(Category.MALFORMED_IR, Stage.VERIFY, function, message, null));
    }
}
