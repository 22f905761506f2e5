package io.github.kirc.core.ops;

/**
 * The coarse classes instructions fall into.
 */
public enum OpClass {
    CONTROL,
    MEMORY,
    ARITHMETIC,
    BITWISE,
    COMPARISON,
    CAST,
    ATOMIC,
    INTRINSIC,
    MISC,
    PHI,
}
