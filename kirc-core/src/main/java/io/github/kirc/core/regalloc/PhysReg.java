package io.github.kirc.core.regalloc;

import io.github.kirc.core.ssa.RegClass;

import java.util.Objects;

/**
 * A physical register.
 * <p>
 * The {@link #index} counts allocatable registers first, then the scratch registers of the class.
 */
public final class PhysReg extends Location {
    public final int index;
    public final String name;
    public final boolean scratch;

    public PhysReg(RegClass regClass, int index, String name, boolean scratch) {
        super(regClass);
        this.index = index;
        this.name = name;
        this.scratch = scratch;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitReg(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PhysReg physReg = (PhysReg) o;
        return index == physReg.index && regClass == physReg.regClass;
    }

    @Override
    public int hashCode() {
        return Objects.hash(regClass, index);
    }

    @Override
    public String toString() {
        return name;
    }
}
