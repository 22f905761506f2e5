package io.github.kirc.core.regalloc;

import io.github.kirc.core.ssa.RegClass;

/**
 * Where an allocated value lives: a {@link PhysReg} or a {@link StackSlot}.
 */
public abstract class Location {
    public final RegClass regClass;

    Location(RegClass regClass) {
        this.regClass = regClass;
    }

    /**
     * Accept a visitor.
     *
     * @param visitor The visitor.
     * @param <R>     The visitor's result type.
     * @return The visitor's result.
     */
    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitReg(PhysReg reg);

        R visitSlot(StackSlot slot);
    }
}
