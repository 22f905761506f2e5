package io.github.kirc.jvm;

/**
 * Runtime helpers called from generated classes.
 */
public final class KirRuntime {
    private KirRuntime() {
    }

    /**
     * Convert a float to an integer of the given width, saturating at its bounds, with NaN as 0.
     *
     * @param value The float.
     * @param bits  The width of the integer type.
     * @return The integer, sign-extended to a long.
     */
    public static long ftoi(double value, int bits) {
        if (bits >= 64) return (long) value;
        if (bits == 1) return Double.isNaN(value) || value == 0 ? 0 : 1;
        long max = (1L << (bits - 1)) - 1;
        long min = -max - 1;
        return Math.max(min, Math.min(max, (long) value));
    }

    /**
     * Thrown in place of an {@code UNREACHABLE} instruction.
     *
     * @param function The function.
     * @param message  The trap message.
     * @return Never returns.
     */
    public static IllegalStateException unreachable(String function, String message) {
        return new IllegalStateException(String.format("reached unreachable code in %s: %s", function, message));
    }
}
