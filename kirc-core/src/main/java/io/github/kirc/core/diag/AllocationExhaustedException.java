package io.github.kirc.core.diag;

/**
 * Thrown when a function cannot be register allocated, even with spilling.
 */
public class AllocationExhaustedException extends KirException {
    public AllocationExhaustedException(String function, String message) {
        super(new Diagnostic(Category.ALLOCATION_EXHAUSTED, Stage.REGALLOC, function, message, null));
    }
}
