package io.github.kirc.core.regalloc;

import io.github.kirc.core.ssa.RegClass;
import io.github.kirc.core.ssa.Register;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * The span of linear positions over which a register must be kept available.
 * Both ends are inclusive.
 * <p>
 * The instruction at index {@code i} in block order reads its operands at {@link #readPos(int) 2i}
 * and writes its result at {@link #writePos(int) 2i + 1}.
 */
public final class LiveInterval {
    public final Register register;
    public final RegClass regClass;
    public final int start;
    public final int end;
    /**
     * The read positions of the instructions using the register, ascending.
     */
    public final List<Integer> uses;
    @Nullable
    Location location;

    LiveInterval(Register register, int start, int end, List<Integer> uses) {
        this.register = register;
        this.regClass = register.type.regClass();
        this.start = start;
        this.end = end;
        this.uses = new ArrayList<>(uses);
    }

    /**
     * Get where the register was placed, once allocated.
     *
     * @return The location.
     */
    @Nullable
    public Location getLocation() {
        return location;
    }

    public boolean isSpilled() {
        return location instanceof StackSlot;
    }

    public static int readPos(int index) {
        return 2 * index;
    }

    public static int writePos(int index) {
        return 2 * index + 1;
    }

    public boolean overlaps(LiveInterval other) {
        return start <= other.end && other.start <= end;
    }

    @Override
    public String toString() {
        return String.format("%s[%d, %d] -> %s", register, start, end, location);
    }
}
