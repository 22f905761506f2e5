package io.github.kirc.core.regalloc;

import io.github.kirc.core.ssa.RegClass;

import java.util.Objects;

/**
 * A spill slot in the function's frame.
 */
public final class StackSlot extends Location {
    public final int index;

    public StackSlot(RegClass regClass, int index) {
        super(regClass);
        this.index = index;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSlot(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return index == ((StackSlot) o).index;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index);
    }

    @Override
    public String toString() {
        return "slot" + index;
    }
}
