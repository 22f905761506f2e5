package io.github.kirc.core.ssa;

/**
 * An operand of an instruction: a {@link Constant}, a {@link Register},
 * a {@link GlobalRef} or {@link Undef}.
 * <p>
 * Values are immutable. Replacing a value means rewriting the operand
 * lists that refer to it.
 */
public interface Value {
    /**
     * Get the type of this value.
     *
     * @return The type.
     */
    Type getType();
}
