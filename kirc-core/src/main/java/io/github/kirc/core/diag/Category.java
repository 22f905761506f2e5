package io.github.kirc.core.diag;

/**
 * The kinds of errors a compile can report. All but {@link #LINT} are fatal.
 */
public enum Category {
    /** An IR invariant was violated; always an internal compiler error. */
    MALFORMED_IR,
    /** The selected backend has no lowering for an instruction. */
    UNSUPPORTED_OPCODE,
    /** Register allocation could not be satisfied, even with spilling. */
    ALLOCATION_EXHAUSTED,
    /** Any other internal compiler error, such as a type lowering cannot represent. */
    INTERNAL,
    /** A finding of a lint plugin; never fatal. */
    LINT,
}
