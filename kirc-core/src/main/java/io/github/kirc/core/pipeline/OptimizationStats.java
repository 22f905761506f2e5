package io.github.kirc.core.pipeline;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.ExtContainer;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Counters of what the optimizer did, per function while it runs and aggregated per module afterwards.
 */
public final class OptimizationStats {
    public enum Counter {
        FOLDED_CONSTANTS,
        REMOVED_INSNS,
        PROPAGATED_COPIES,
        CSE_EXPRESSIONS,
        INLINED_CALLS,
        UNROLLED_LOOPS,
        ROUNDS,
    }

    private static final OptimizationStats DISCARD = new OptimizationStats();

    private final AtomicLongArray counts = new AtomicLongArray(Counter.values().length);

    /**
     * Get the stats attached to some IR with {@link CommonExts#OPT_STATS}, or a sink that
     * discards what it is given if there are none.
     *
     * @param container The IR object.
     * @return The stats.
     */
    public static OptimizationStats of(ExtContainer container) {
        OptimizationStats stats = container.getNullable(CommonExts.OPT_STATS);
        return stats == null ? DISCARD : stats;
    }

    public void add(Counter counter, long amount) {
        if (this == DISCARD) return;
        counts.addAndGet(counter.ordinal(), amount);
    }

    public long get(Counter counter) {
        return counts.get(counter.ordinal());
    }

    /**
     * Add all the counts of another set of stats to these.
     *
     * @param other The other stats.
     */
    public void merge(OptimizationStats other) {
        for (Counter counter : Counter.values()) {
            add(counter, other.get(counter));
        }
    }

    public Map<Counter, Long> asMap() {
        Map<Counter, Long> map = new EnumMap<>(Counter.class);
        for (Counter counter : Counter.values()) {
            map.put(counter, get(counter));
        }
        return map;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("OptimizationStats{");
        boolean first = true;
        for (Counter counter : Counter.values()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(counter.name().toLowerCase(Locale.ROOT)).append('=').append(get(counter));
        }
        return sb.append('}').toString();
    }
}
