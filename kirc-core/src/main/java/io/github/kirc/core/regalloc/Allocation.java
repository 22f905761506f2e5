package io.github.kirc.core.regalloc;

import io.github.kirc.core.ssa.Function;
import io.github.kirc.core.ssa.Register;
import io.github.kirc.core.ssa.Value;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The result of allocating a function: a {@link Location} for every register it references.
 * <p>
 * Registers which were spilled map to their {@link StackSlot}; they no longer occur in the
 * function, whose uses and definitions of them now go through scratch registers with
 * explicit reloads and spills.
 */
public final class Allocation {
    public final Function function;
    public final TargetDesc target;
    private final Map<Register, Location> locations;
    private final List<LiveInterval> intervals;
    private final int slotCount;

    Allocation(Function function, TargetDesc target, Map<Register, Location> locations,
               List<LiveInterval> intervals, int slotCount) {
        this.function = function;
        this.target = target;
        this.locations = Collections.unmodifiableMap(locations);
        this.intervals = Collections.unmodifiableList(intervals);
        this.slotCount = slotCount;
    }

    /**
     * Get the location of a value.
     *
     * @param value The value.
     * @return The location, or null if it is not a register or was never allocated.
     */
    @Nullable
    public Location locationOf(Value value) {
        return value instanceof Register ? locations.get(value) : null;
    }

    public Map<Register, Location> getLocations() {
        return locations;
    }

    /**
     * Get the live intervals the allocation was computed from, sorted by start.
     *
     * @return The intervals.
     */
    public List<LiveInterval> getIntervals() {
        return intervals;
    }

    public int getSlotCount() {
        return slotCount;
    }

    public int spillCount() {
        int count = 0;
        for (LiveInterval interval : intervals) {
            if (interval.isSpilled()) count++;
        }
        return count;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("allocation of ").append(function.name).append(" for ").append(target).append(":\n");
        for (LiveInterval interval : intervals) {
            sb.append("  ").append(interval).append('\n');
        }
        return sb.toString();
    }
}
