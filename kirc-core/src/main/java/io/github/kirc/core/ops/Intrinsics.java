package io.github.kirc.core.ops;

import io.github.kirc.core.ssa.Type;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * The intrinsics with known, pure semantics. Any other intrinsic name is
 * treated as opaque and side-effecting.
 */
public final class Intrinsics {
    public static final String SQRT = "sqrt";
    public static final String FABS = "fabs";
    public static final String ABS = "abs";
    public static final String MIN = "min";
    public static final String MAX = "max";
    public static final String POPCOUNT = "popcount";

    private static final Set<String> PURE = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            SQRT, FABS, ABS, MIN, MAX, POPCOUNT
    )));

    private Intrinsics() {
    }

    public static boolean isPure(@Nullable String name) {
        return name != null && PURE.contains(name);
    }

    /**
     * Check whether a pure intrinsic accepts the given operand types for the given result type.
     *
     * @param name     The intrinsic.
     * @param result   The result type.
     * @param operands The operand types.
     * @return Whether the types are consistent, or true for opaque intrinsics.
     */
    public static boolean typeChecks(String name, Type result, Type... operands) {
        switch (name) {
            case SQRT:
            case FABS:
                return result.isFloat() && operands.length == 1 && operands[0] == result;
            case ABS:
            case POPCOUNT:
                return result.isInt() && operands.length == 1 && operands[0] == result;
            case MIN:
            case MAX:
                return result.isNumeric() && operands.length == 2
                        && operands[0] == result && operands[1] == result;
            default:
                return true;
        }
    }
}
