package io.github.kirc.core.ops;

/**
 * How the operand types of an instruction relate to its result type.
 * <p>
 * {@link io.github.kirc.core.passes.meta.Verify} interprets these.
 */
public enum TypingRule {
    /** No operands, no result. */
    NONE,
    /** One {@code i1} condition. */
    BRANCH,
    /** One integer selector. */
    SELECTOR,
    /** The function's return type, or nothing for void functions. */
    RETURN,
    /** No operands, a {@code ptr} result, the allocated type in the immediate. */
    ALLOCATE,
    /** A {@code ptr} operand, any non-void result. */
    READ,
    /** A {@code ptr} and a value, no result. */
    WRITE,
    /** {@code ptr, i8, i64}, no result. */
    FILL,
    /** {@code ptr, ptr, i64}, no result. */
    TRANSFER,
    /** {@code ptr, i64} to {@code ptr}. */
    OFFSET,
    /** {@code T, T} to {@code T}, numeric {@code T}. */
    NUMERIC_BINARY,
    /** {@code T} to {@code T}, numeric {@code T}. */
    NUMERIC_UNARY,
    /** {@code T, T} to {@code T}, integer {@code T}. */
    INTEGER_BINARY,
    /** {@code T} to {@code T}, integer {@code T}. */
    INTEGER_UNARY,
    /** {@code T, T} to {@code i1}. */
    COMPARE,
    /** Integer to strictly narrower integer. */
    NARROW,
    /** Integer to strictly wider integer. */
    WIDEN,
    /** Integer to float. */
    INT_TO_FLOAT,
    /** Float to integer. */
    FLOAT_TO_INT,
    /** Float to float of a different width. */
    FLOAT_TO_FLOAT,
    /** {@code ptr} to integer. */
    ATOMIC_READ,
    /** {@code ptr, T} to nothing, integer {@code T}. */
    ATOMIC_WRITE,
    /** {@code ptr, T} to {@code T}, integer {@code T}. */
    ATOMIC_MODIFY,
    /** {@code ptr, T, T} to {@code T}, integer {@code T}. */
    ATOMIC_EXCHANGE,
    /** Arbitrary, named by the immediate. */
    OPAQUE,
    /** Checked against the callee's signature. */
    CALL,
    /** Checked against the function's signature. */
    PARAM,
    /** {@code T} to {@code T}. */
    IDENTITY,
    /** {@code T} to nothing. */
    STORE_SLOT,
    /** Nothing to {@code T}. */
    LOAD_SLOT,
    /** Every operand of the result type. */
    MERGE,
}
