package io.github.kirc.core.pipeline;

/**
 * Preset optimization pipelines.
 */
public enum OptLevel {
    /** No optimization passes at all. */
    NONE(0),
    /** Constant folding, copy propagation and dead code elimination. */
    LESS(5),
    /** Every pass. */
    DEFAULT(5),
    /** Every pass, with a larger iteration budget. */
    AGGRESSIVE(10),
    ;

    public final int rounds;

    OptLevel(int rounds) {
        this.rounds = rounds;
    }
}
