package io.github.kirc.core.interp;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when interpreted code traps at runtime.
 */
public class TrapException extends RuntimeException {
    @Nullable
    private final String function;

    public TrapException(@Nullable String function, String message) {
        super(function == null ? message : String.format("trap in %s: %s", function, message));
        this.function = function;
    }

    @Nullable
    public String getFunction() {
        return function;
    }
}
