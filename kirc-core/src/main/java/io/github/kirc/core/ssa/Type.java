package io.github.kirc.core.ssa;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * The closed set of KIR value types.
 */
public enum Type {
    VOID(0, null),
    I1(1, RegClass.INT),
    I8(8, RegClass.INT),
    I16(16, RegClass.INT),
    I32(32, RegClass.INT),
    I64(64, RegClass.INT),
    F32(32, RegClass.FLOAT),
    F64(64, RegClass.FLOAT),
    PTR(64, RegClass.INT),
    ;

    /**
     * The width of this type in bits, 0 for {@link #VOID}.
     */
    public final int bits;
    @Nullable
    private final RegClass regClass;

    Type(int bits, @Nullable RegClass regClass) {
        this.bits = bits;
        this.regClass = regClass;
    }

    /**
     * Get the register class values of this type are allocated to.
     *
     * @return The class.
     * @throws IllegalStateException If this is {@link #VOID}.
     */
    public RegClass regClass() {
        if (regClass == null) throw new IllegalStateException("void has no register class");
        return regClass;
    }

    public boolean isInt() {
        return this == I1 || this == I8 || this == I16 || this == I32 || this == I64;
    }

    public boolean isFloat() {
        return this == F32 || this == F64;
    }

    /**
     * Whether this is an integer or float type, i.e. something arithmetic applies to.
     *
     * @return Whether this type is numeric.
     */
    public boolean isNumeric() {
        return isInt() || isFloat();
    }

    public int bytes() {
        return this == I1 ? 1 : bits / 8;
    }

    /**
     * Normalize raw integer bits to this type's width.
     * <p>
     * {@link #I1} is kept as 0 or 1, narrower integers are sign-extended to 64 bits.
     *
     * @param bits The raw bits.
     * @return The normalized bits.
     */
    public long normalize(long bits) {
        switch (this) {
            case I1:
                return bits & 1;
            case I8:
                return (byte) bits;
            case I16:
                return (short) bits;
            case I32:
                return (int) bits;
            default:
                return bits;
        }
    }

    /**
     * The unsigned mask of this type's width.
     *
     * @return The mask.
     */
    public long mask() {
        return bits >= 64 ? -1L : (1L << bits) - 1;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
