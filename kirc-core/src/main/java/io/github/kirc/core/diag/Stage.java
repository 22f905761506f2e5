package io.github.kirc.core.diag;

/**
 * The pipeline stage a {@link Diagnostic} originates from.
 */
public enum Stage {
    LOWERING,
    VERIFY,
    SSA,
    OPTIMIZE,
    REGALLOC,
    BACKEND,
    LINT,
}
