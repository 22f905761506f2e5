package io.github.kirc.core.pipeline;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The configuration of one optimization run, passed explicitly to the {@link PassManager}.
 * <p>
 * Unless an explicit pass list is given, the passes are those of the {@link OptLevel}.
 */
public final class PipelineConfig {
    public static final int DEFAULT_MAX_ROUNDS = 10;
    public static final int DEFAULT_INLINE_THRESHOLD = 10;
    public static final int DEFAULT_INLINE_DEPTH = 4;
    public static final int DEFAULT_UNROLL_TRIP_CAP = 16;
    public static final int DEFAULT_UNROLL_SIZE_CAP = 256;

    public final OptLevel optLevel;
    @Nullable
    private final List<FunctionPass> passes;
    public final int maxRounds;
    public final boolean verify;
    public final int inlineThreshold;
    public final int inlineDepth;
    public final int unrollTripCap;
    public final int unrollSizeCap;

    private PipelineConfig(Builder builder) {
        optLevel = builder.optLevel;
        passes = builder.passes == null ? null : Collections.unmodifiableList(new ArrayList<>(builder.passes));
        maxRounds = builder.maxRounds;
        verify = builder.verify;
        inlineThreshold = builder.inlineThreshold;
        inlineDepth = builder.inlineDepth;
        unrollTripCap = builder.unrollTripCap;
        unrollSizeCap = builder.unrollSizeCap;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The configuration for an optimization level, with its iteration budget and default limits.
     *
     * @param level The level.
     * @return The configuration.
     */
    public static PipelineConfig forLevel(OptLevel level) {
        return builder().optLevel(level).maxRounds(level.rounds).build();
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    /**
     * Get the ordered list of passes to run.
     *
     * @return The explicit pass list, or the passes of {@link #optLevel}.
     */
    public List<FunctionPass> passes() {
        return passes == null ? Passes.forLevel(this) : passes;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.optLevel = optLevel;
        builder.passes = passes;
        builder.maxRounds = maxRounds;
        builder.verify = verify;
        builder.inlineThreshold = inlineThreshold;
        builder.inlineDepth = inlineDepth;
        builder.unrollTripCap = unrollTripCap;
        builder.unrollSizeCap = unrollSizeCap;
        return builder;
    }

    @Override
    public String toString() {
        return String.format("PipelineConfig{level=%s, maxRounds=%d, verify=%s, inline=%d/%d, unroll=%d/%d}",
                optLevel, maxRounds, verify, inlineThreshold, inlineDepth, unrollTripCap, unrollSizeCap);
    }

    public static final class Builder {
        private OptLevel optLevel = OptLevel.DEFAULT;
        @Nullable
        private List<FunctionPass> passes;
        private int maxRounds = DEFAULT_MAX_ROUNDS;
        private boolean verify = false;
        private int inlineThreshold = DEFAULT_INLINE_THRESHOLD;
        private int inlineDepth = DEFAULT_INLINE_DEPTH;
        private int unrollTripCap = DEFAULT_UNROLL_TRIP_CAP;
        private int unrollSizeCap = DEFAULT_UNROLL_SIZE_CAP;

        private Builder() {
        }

        public Builder optLevel(OptLevel optLevel) {
            this.optLevel = optLevel;
            return this;
        }

        /**
         * Run exactly these passes, in order, instead of those of the optimization level.
         *
         * @param passes The passes.
         * @return This builder.
         */
        public Builder passes(List<? extends FunctionPass> passes) {
            this.passes = new ArrayList<>(passes);
            return this;
        }

        public Builder maxRounds(int maxRounds) {
            if (maxRounds < 0) throw new IllegalArgumentException("negative round budget " + maxRounds);
            this.maxRounds = maxRounds;
            return this;
        }

        public Builder verify(boolean verify) {
            this.verify = verify;
            return this;
        }

        public Builder inlineThreshold(int inlineThreshold) {
            this.inlineThreshold = inlineThreshold;
            return this;
        }

        public Builder inlineDepth(int inlineDepth) {
            this.inlineDepth = inlineDepth;
            return this;
        }

        public Builder unrollTripCap(int unrollTripCap) {
            this.unrollTripCap = unrollTripCap;
            return this;
        }

        public Builder unrollSizeCap(int unrollSizeCap) {
            this.unrollSizeCap = unrollSizeCap;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }
}
