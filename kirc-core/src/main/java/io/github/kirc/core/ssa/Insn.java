package io.github.kirc.core.ssa;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.Ext;
import io.github.kirc.core.ext.ExtHolder;
import io.github.kirc.core.ops.Intrinsics;
import io.github.kirc.core.ops.Opcode;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A single three-address instruction.
 * <p>
 * The meaning of {@link #imm} is fixed per opcode: the callee name for {@link Opcode#CALL},
 * the parameter index for {@link Opcode#PARAM}, the allocated {@link Type} for {@link Opcode#ALLOCA},
 * the {@code long[]} case values for {@link Opcode#SWITCH}, the intrinsic name for
 * {@link Opcode#INTRINSIC}, the trap message for {@link Opcode#UNREACHABLE}, the volatile flag
 * for memory operations and the slot index for {@link Opcode#SPILL}/{@link Opcode#RELOAD}.
 * <p>
 * {@link #blocks} holds the successors of a terminator, or the incoming block of each
 * operand of a {@link Opcode#PHI}, index-aligned with {@link #args}.
 */
public final class Insn extends ExtHolder {
    public final Opcode op;
    public final Type type;
    @Nullable
    private Register result;
    public final List<Value> args;
    public final List<BasicBlock> blocks;
    @Nullable
    public Object imm;

    public Insn(Opcode op, Type type, List<? extends Value> args, List<BasicBlock> blocks, @Nullable Object imm) {
        this.op = op;
        this.type = type;
        this.args = new ArrayList<>(args);
        this.blocks = new ArrayList<>(blocks);
        this.imm = imm;
    }

    public Insn(Opcode op, Type type, Value... args) {
        this(op, type, Arrays.asList(args), new ArrayList<>(), null);
    }

    public static Insn binary(Opcode op, Value lhs, Value rhs) {
        return new Insn(op, op.isComparison() ? Type.I1 : lhs.getType(), lhs, rhs);
    }

    public static Insn unary(Opcode op, Value operand) {
        return new Insn(op, operand.getType(), operand);
    }

    public static Insn cast(Opcode op, Value operand, Type to) {
        return new Insn(op, to, operand);
    }

    public static Insn copy(Value value) {
        return new Insn(Opcode.COPY, value.getType(), value);
    }

    public static Insn param(Type type, int index) {
        return new Insn(Opcode.PARAM, type).withImm(index);
    }

    public static Insn call(Type returnType, String callee, List<? extends Value> args) {
        return new Insn(Opcode.CALL, returnType, args, new ArrayList<>(), callee);
    }

    public static Insn intrinsic(Type type, String name, Value... args) {
        return new Insn(Opcode.INTRINSIC, type, Arrays.asList(args), new ArrayList<>(), name);
    }

    public static Insn alloca(Type allocated) {
        return new Insn(Opcode.ALLOCA, Type.PTR).withImm(allocated);
    }

    public static Insn load(Type type, Value ptr) {
        return new Insn(Opcode.LOAD, type, ptr).withImm(false);
    }

    public static Insn store(Value ptr, Value value) {
        return new Insn(Opcode.STORE, Type.VOID, ptr, value).withImm(false);
    }

    public static Insn phi(Type type, List<BasicBlock> preds, List<? extends Value> values) {
        return new Insn(Opcode.PHI, type, values, preds, null);
    }

    public static Insn jump(BasicBlock target) {
        return new Insn(Opcode.JUMP, Type.VOID).withBlocks(target);
    }

    public static Insn jumpIf(Value cond, BasicBlock ifTrue, BasicBlock ifFalse) {
        return new Insn(Opcode.JUMP_IF, Type.VOID, cond).withBlocks(ifTrue, ifFalse);
    }

    /**
     * A multi-way branch; {@code targets} holds one block per case followed by the default.
     *
     * @param selector The value switched on.
     * @param cases    The case values.
     * @param targets  The case targets, then the default target.
     * @return The instruction.
     */
    public static Insn switchOn(Value selector, long[] cases, List<BasicBlock> targets) {
        if (targets.size() != cases.length + 1) throw new IllegalArgumentException("case/target mismatch");
        return new Insn(Opcode.SWITCH, Type.VOID, Arrays.asList(selector), targets, cases.clone());
    }

    public static Insn ret(@Nullable Value value) {
        return value == null ? new Insn(Opcode.RET, Type.VOID) : new Insn(Opcode.RET, Type.VOID, value);
    }

    public static Insn unreachable(String message) {
        return new Insn(Opcode.UNREACHABLE, Type.VOID).withImm(message);
    }

    public static Insn spill(Value value, int slot) {
        return new Insn(Opcode.SPILL, Type.VOID, value).withImm(slot);
    }

    public static Insn reload(Type type, int slot) {
        return new Insn(Opcode.RELOAD, type).withImm(slot);
    }

    public Insn withImm(@Nullable Object imm) {
        this.imm = imm;
        return this;
    }

    public Insn withBlocks(BasicBlock... blocks) {
        this.blocks.clear();
        this.blocks.addAll(Arrays.asList(blocks));
        return this;
    }

    @Nullable
    public Register getResult() {
        return result;
    }

    /**
     * Set the register this instruction defines, updating {@link CommonExts#ASSIGNED_AT}.
     *
     * @param result The register, or null.
     * @return This, for convenience.
     */
    public Insn assignTo(@Nullable Register result) {
        if (this.result != null && this.result.getNullable(CommonExts.ASSIGNED_AT) == this) {
            this.result.removeExt(CommonExts.ASSIGNED_AT);
        }
        this.result = result;
        if (result != null) {
            result.attachExt(CommonExts.ASSIGNED_AT, this);
        }
        return this;
    }

    public String getCallee() {
        return (String) immOfType(Opcode.CALL);
    }

    public int getParamIndex() {
        return (Integer) immOfType(Opcode.PARAM);
    }

    public Type getAllocatedType() {
        return (Type) immOfType(Opcode.ALLOCA);
    }

    public long[] getCases() {
        return (long[]) immOfType(Opcode.SWITCH);
    }

    public String getIntrinsicName() {
        return (String) immOfType(Opcode.INTRINSIC);
    }

    public int getSlot() {
        if (op != Opcode.SPILL && op != Opcode.RELOAD) throw new IllegalStateException(op + " has no slot");
        return (Integer) imm;
    }

    public boolean isVolatile() {
        return imm instanceof Boolean && (Boolean) imm;
    }

    private Object immOfType(Opcode expected) {
        if (op != expected) throw new IllegalStateException(op + " is not " + expected);
        return imm;
    }

    /**
     * Whether this instruction may be removed when its result is unused.
     * <p>
     * Calls are removable only when the callee is known to be {@link Function#pure pure}.
     *
     * @return Whether this instruction has an observable effect.
     */
    public boolean hasSideEffects() {
        switch (op) {
            case CALL: {
                Function callee = lookupCallee();
                return callee == null || !callee.pure;
            }
            case INTRINSIC:
                return !Intrinsics.isPure((String) imm);
            case LOAD:
                return isVolatile();
            default:
                return op.sideEffecting;
        }
    }

    /**
     * Whether this instruction may trap at run time, which is observable even if its result is unused.
     *
     * @return Whether it is an integer division by something other than a non-zero constant.
     */
    public boolean mayTrap() {
        if ((op != Opcode.DIV && op != Opcode.REM) || !type.isInt()) return false;
        Value divisor = args.get(1);
        return !(divisor instanceof Constant) || ((Constant) divisor).isZero();
    }

    @Nullable
    private Function lookupCallee() {
        BasicBlock block = getNullable(CommonExts.OWNING_BLOCK);
        if (block == null) return null;
        Function func = block.getNullable(CommonExts.OWNING_FUNCTION);
        if (func == null) return null;
        Module module = func.getNullable(CommonExts.OWNING_MODULE);
        if (module == null) return null;
        return module.getFunction((String) imm);
    }

    /**
     * Whether two instructions with equal operands are guaranteed to compute equal results.
     *
     * @return Whether this may be merged with an equal instruction.
     */
    public boolean isIdempotent() {
        if (op == Opcode.INTRINSIC) return Intrinsics.isPure((String) imm);
        return op.idempotent;
    }

    public boolean isTerminator() {
        return op.terminator;
    }

    /**
     * Replace every operand equal to {@code from} with {@code to}.
     *
     * @param from The old value.
     * @param to   The new value.
     * @return Whether any operand was replaced.
     */
    public boolean replaceArg(Value from, Value to) {
        boolean changed = false;
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i).equals(from)) {
                args.set(i, to);
                changed = true;
            }
        }
        return changed;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (result != null) {
            sb.append(result).append(" = ");
        }
        sb.append(op);
        if (op == Opcode.PHI) {
            for (int i = 0; i < args.size(); i++) {
                sb.append(i == 0 ? " [" : ", [").append(args.get(i))
                        .append(", ").append(blocks.get(i).toTargetString()).append(']');
            }
            return sb.toString();
        }
        if (result != null) {
            sb.append(' ').append(type);
        }
        if (imm != null && !(imm instanceof Boolean)) {
            sb.append(' ').append(imm instanceof long[] ? Arrays.toString((long[]) imm) : imm);
        } else if (isVolatile()) {
            sb.append(" volatile");
        }
        for (int i = 0; i < args.size(); i++) {
            sb.append(i == 0 ? " " : ", ").append(args.get(i));
        }
        if (!blocks.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock block : blocks) {
                sb.append(' ').append(block.toTargetString());
            }
        }
        return sb.toString();
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
