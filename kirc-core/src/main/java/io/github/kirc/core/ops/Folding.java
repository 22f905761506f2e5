package io.github.kirc.core.ops;

import io.github.kirc.core.ssa.Constant;
import io.github.kirc.core.ssa.Type;
import io.github.kirc.core.ssa.Value;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Evaluates opcodes with pure, statically known semantics over constant operands.
 * <p>
 * Integer arithmetic wraps at the width of the type and is signed unless the opcode says
 * otherwise, float arithmetic follows IEEE-754 in double precision, rounded to float
 * precision for {@link Type#F32}.
 */
public final class Folding {
    private Folding() {
    }

    /**
     * Evaluate an instruction over constant operands.
     *
     * @param op   The opcode.
     * @param type The result type.
     * @param args The operands.
     * @param imm  The immediate of the instruction.
     * @return The result, or null if any operand is not a constant, the opcode has no static
     * semantics, or evaluating it would trap.
     */
    @Nullable
    public static Constant fold(Opcode op, Type type, List<Value> args, @Nullable Object imm) {
        Constant[] cs = new Constant[args.size()];
        for (int i = 0; i < cs.length; i++) {
            Value arg = args.get(i);
            if (!(arg instanceof Constant)) return null;
            cs[i] = (Constant) arg;
        }
        switch (op.opClass) {
            case ARITHMETIC:
            case BITWISE:
                if (cs.length == 1) return unary(op, type, cs[0]);
                return binary(op, type, cs[0], cs[1]);
            case COMPARISON:
                return Constant.bool(compare(op, cs[0], cs[1]));
            case CAST:
                return cast(op, type, cs[0]);
            case INTRINSIC:
                return imm instanceof String ? intrinsic((String) imm, type, cs) : null;
            case MISC:
                return op == Opcode.COPY ? cs[0] : null;
            default:
                return null;
        }
    }

    @Nullable
    public static Constant unary(Opcode op, Type type, Constant x) {
        switch (op) {
            case NEG:
                return type.isFloat() ? Constant.ofFloat(type, -x.doubleValue()) : Constant.of(type, -x.longValue());
            case NOT:
                return Constant.of(type, ~x.longValue());
            default:
                return null;
        }
    }

    /**
     * Evaluate a binary arithmetic or bitwise opcode.
     *
     * @param op   The opcode.
     * @param type The operand and result type.
     * @param a    The left operand.
     * @param b    The right operand.
     * @return The result, or null for integer division by zero.
     */
    @Nullable
    public static Constant binary(Opcode op, Type type, Constant a, Constant b) {
        if (type.isFloat()) {
            double x = a.doubleValue();
            double y = b.doubleValue();
            switch (op) {
                case ADD:
                    return Constant.ofFloat(type, x + y);
                case SUB:
                    return Constant.ofFloat(type, x - y);
                case MUL:
                    return Constant.ofFloat(type, x * y);
                case DIV:
                    return Constant.ofFloat(type, x / y);
                case REM:
                    return Constant.ofFloat(type, x % y);
                default:
                    return null;
            }
        }
        long x = a.longValue();
        long y = b.longValue();
        int shift = (int) (y & (Math.max(type.bits, 8) - 1));
        switch (op) {
            case ADD:
                return Constant.of(type, x + y);
            case SUB:
                return Constant.of(type, x - y);
            case MUL:
                return Constant.of(type, x * y);
            case DIV:
                return y == 0 ? null : Constant.of(type, x / y);
            case REM:
                return y == 0 ? null : Constant.of(type, x % y);
            case AND:
                return Constant.of(type, x & y);
            case OR:
                return Constant.of(type, x | y);
            case XOR:
                return Constant.of(type, x ^ y);
            case SHL:
                return Constant.of(type, x << shift);
            case SHR:
                return Constant.of(type, x >> shift);
            case USHR:
                return Constant.of(type, a.unsignedValue() >>> shift);
            default:
                return null;
        }
    }

    public static boolean compare(Opcode op, Constant a, Constant b) {
        if (a.isFloat()) {
            double x = a.doubleValue();
            double y = b.doubleValue();
            switch (op) {
                case EQ:
                    return x == y;
                case NE:
                    return x != y;
                case LT:
                    return x < y;
                case LE:
                    return x <= y;
                case GT:
                    return x > y;
                case GE:
                    return x >= y;
            }
        } else {
            long x = a.longValue();
            long y = b.longValue();
            switch (op) {
                case EQ:
                    return x == y;
                case NE:
                    return x != y;
                case LT:
                    return x < y;
                case LE:
                    return x <= y;
                case GT:
                    return x > y;
                case GE:
                    return x >= y;
            }
        }
        throw new IllegalArgumentException(op + " is not a comparison");
    }

    @Nullable
    public static Constant cast(Opcode op, Type type, Constant x) {
        switch (op) {
            case TRUNC:
            case SEXT:
                return Constant.of(type, x.longValue());
            case ZEXT:
                return Constant.of(type, x.unsignedValue());
            case ITOF:
                return Constant.ofFloat(type, (double) x.longValue());
            case FTOI:
                return Constant.of(type, floatToInt(x.doubleValue(), type));
            case FCONV:
                return Constant.ofFloat(type, x.doubleValue());
            default:
                return null;
        }
    }

    /**
     * Convert a float to an integer type, saturating at the bounds of the type and mapping NaN to 0.
     *
     * @param value The float.
     * @param type  The integer type.
     * @return The converted bits.
     */
    public static long floatToInt(double value, Type type) {
        if (type == Type.I64 || type == Type.PTR) return (long) value;
        if (type == Type.I1) return Double.isNaN(value) || value == 0 ? 0 : 1;
        long max = (1L << (type.bits - 1)) - 1;
        long min = -max - 1;
        long l = (long) value;
        return Math.max(min, Math.min(max, l));
    }

    @Nullable
    public static Constant intrinsic(String name, Type type, Constant... args) {
        switch (name) {
            case Intrinsics.SQRT:
                return Constant.ofFloat(type, Math.sqrt(args[0].doubleValue()));
            case Intrinsics.FABS:
                return Constant.ofFloat(type, Math.abs(args[0].doubleValue()));
            case Intrinsics.ABS:
                return Constant.of(type, Math.abs(args[0].longValue()));
            case Intrinsics.POPCOUNT:
                return Constant.of(type, Long.bitCount(args[0].unsignedValue()));
            case Intrinsics.MIN:
                return type.isFloat()
                        ? Constant.ofFloat(type, Math.min(args[0].doubleValue(), args[1].doubleValue()))
                        : Constant.of(type, Math.min(args[0].longValue(), args[1].longValue()));
            case Intrinsics.MAX:
                return type.isFloat()
                        ? Constant.ofFloat(type, Math.max(args[0].doubleValue(), args[1].doubleValue()))
                        : Constant.of(type, Math.max(args[0].longValue(), args[1].longValue()));
            default:
                return null;
        }
    }
}
