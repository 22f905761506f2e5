package io.github.kirc.core.ssa;

/**
 * A typed literal.
 * <p>
 * Integer constants hold their bits {@link Type#normalize(long) normalized} to the width of
 * their type, float constants hold a {@code double} (rounded to float precision for {@link Type#F32}).
 * Equality is structural.
 */
public final class Constant implements Value {
    public static final Constant TRUE = new Constant(Type.I1, 1, 0);
    public static final Constant FALSE = new Constant(Type.I1, 0, 0);

    private final Type type;
    private final long bits;
    private final double fvalue;

    private Constant(Type type, long bits, double fvalue) {
        this.type = type;
        this.bits = bits;
        this.fvalue = fvalue;
    }

    public static Constant of(Type type, long value) {
        if (type.isFloat()) return ofFloat(type, value);
        if (type == Type.VOID) throw new IllegalArgumentException("void constant");
        return new Constant(type, type.normalize(value), 0);
    }

    public static Constant ofFloat(Type type, double value) {
        if (!type.isFloat()) throw new IllegalArgumentException("not a float type: " + type);
        return new Constant(type, 0, type == Type.F32 ? (double) (float) value : value);
    }

    public static Constant bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Constant i32(int value) {
        return of(Type.I32, value);
    }

    public static Constant i64(long value) {
        return of(Type.I64, value);
    }

    public static Constant f64(double value) {
        return ofFloat(Type.F64, value);
    }

    public static Constant f32(float value) {
        return ofFloat(Type.F32, value);
    }

    /**
     * The zero of a type.
     *
     * @param type The type.
     * @return Zero.
     */
    public static Constant zero(Type type) {
        return type.isFloat() ? ofFloat(type, 0) : of(type, 0);
    }

    @Override
    public Type getType() {
        return type;
    }

    public boolean isFloat() {
        return type.isFloat();
    }

    public long longValue() {
        return isFloat() ? (long) fvalue : bits;
    }

    /**
     * The bits of this integer constant, zero-extended from its width.
     *
     * @return The unsigned value.
     */
    public long unsignedValue() {
        return bits & type.mask();
    }

    public double doubleValue() {
        return isFloat() ? fvalue : bits;
    }

    public boolean isZero() {
        return isFloat() ? fvalue == 0 : bits == 0;
    }

    public boolean isOne() {
        return isFloat() ? fvalue == 1 : bits == 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constant)) return false;
        Constant that = (Constant) o;
        if (type != that.type) return false;
        return isFloat()
                ? Double.doubleToRawLongBits(fvalue) == Double.doubleToRawLongBits(that.fvalue)
                : bits == that.bits;
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Long.hashCode(isFloat() ? Double.doubleToRawLongBits(fvalue) : bits);
    }

    @Override
    public String toString() {
        if (type == Type.I1) return bits != 0 ? "true" : "false";
        return type + " " + (isFloat() ? Double.toString(fvalue) : Long.toString(bits));
    }
}
