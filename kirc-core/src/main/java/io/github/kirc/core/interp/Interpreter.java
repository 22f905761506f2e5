package io.github.kirc.core.interp;

import io.github.kirc.core.ops.Folding;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.ssa.*;
import io.github.kirc.core.ssa.Module;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.*;

/**
 * A reference interpreter for modules, before register allocation.
 * <p>
 * Values are {@link Constant}s: integers wrap at the width of their type, floats follow IEEE-754.
 * Memory is a flat little-endian byte array; globals are laid out first, and each call's
 * {@link Opcode#ALLOCA allocas} are released when it returns. Address 0 is never allocated.
 * <p>
 * Integer division by zero, {@link Opcode#UNREACHABLE}, out of bounds memory accesses, calls to
 * undefined functions, recursing too deeply, and running out of steps all raise a {@link TrapException}.
 */
public class Interpreter {
    private static final Logger LOGGER = LoggerFactory.getLogger(Interpreter.class);

    public static final long DEFAULT_STEP_BUDGET = 10_000_000L;
    private static final int MAX_CALL_DEPTH = 256;
    private static final int MAX_MEMORY = 16 << 20;
    private static final int ALIGN = 8;

    private final Module module;
    private final long stepBudget;
    private final Map<String, Long> globalAddresses = new HashMap<>();
    private byte[] memory = new byte[1024];
    private int sp = ALIGN;
    private long steps;
    private int depth;

    public Interpreter(Module module) {
        this(module, DEFAULT_STEP_BUDGET);
    }

    /**
     * Construct an interpreter, laying out and initializing the module's globals.
     *
     * @param module     The module.
     * @param stepBudget The number of instructions that may be executed before trapping.
     */
    public Interpreter(Module module, long stepBudget) {
        this.module = module;
        this.stepBudget = stepBudget;
        for (Global global : module.getGlobals()) {
            long addr = allocate(null, global.size);
            globalAddresses.put(global.name, addr);
            if (global.initializer != null) {
                write(null, global.type, addr, global.initializer);
            }
        }
    }

    public long getSteps() {
        return steps;
    }

    /**
     * Read the current value of a global.
     *
     * @param name The global's name.
     * @return The value.
     */
    public Constant readGlobal(String name) {
        Global global = module.getGlobal(name);
        if (global == null) throw new IllegalArgumentException("no global named " + name);
        return read(null, global.type, globalAddresses.get(name));
    }

    /**
     * Call a function of the module.
     *
     * @param name The function's name.
     * @param args The arguments.
     * @return The returned value, or null for a void function.
     */
    @Nullable
    public Constant call(String name, Constant... args) {
        Function func = module.getFunction(name);
        if (func == null) throw new IllegalArgumentException("no function named " + name);
        if (args.length != func.signature.params.size()) {
            throw new IllegalArgumentException(String.format("%s takes %d arguments, got %d",
                    name, func.signature.params.size(), args.length));
        }
        try {
            return invoke(func, Arrays.asList(args));
        } catch (StackOverflowError e) {
            // the host stack can run out before the depth limit when frames are large
            depth = 0;
            throw new TrapException(name, "call depth exceeded");
        }
    }

    @Nullable
    private Constant invoke(Function func, List<Constant> args) {
        if (func.isDeclaration()) throw new TrapException(func.name, "call to an undefined function");
        if (++depth > MAX_CALL_DEPTH) {
            depth--;
            throw new TrapException(func.name, "call depth exceeded");
        }
        int frameBase = sp;
        try {
            return new Frame(func, args).execute();
        } finally {
            sp = frameBase;
            depth--;
        }
    }

    private class Frame {
        final Function func;
        final List<Constant> args;
        final Map<Register, Constant> regs = new HashMap<>();
        final Map<Integer, Constant> slots = new HashMap<>();

        Frame(Function func, List<Constant> args) {
            this.func = func;
            this.args = args;
        }

        @Nullable
        Constant execute() {
            BasicBlock prev = null;
            BasicBlock block = func.entry();
            while (true) {
                List<Insn> insns = block.getInsns();
                int i = enterPhis(block, prev);
                BasicBlock next = null;
                for (; i < insns.size(); i++) {
                    Insn insn = insns.get(i);
                    if (++steps > stepBudget) {
                        throw new TrapException(func.name, String.format("step budget of %d exhausted", stepBudget));
                    }
                    switch (insn.op) {
                        case JUMP:
                            next = insn.blocks.get(0);
                            break;
                        case JUMP_IF:
                            next = insn.blocks.get(eval(insn.args.get(0)).isZero() ? 1 : 0);
                            break;
                        case SWITCH: {
                            long selector = eval(insn.args.get(0)).longValue();
                            long[] cases = insn.getCases();
                            int target = cases.length;
                            for (int c = 0; c < cases.length; c++) {
                                if (cases[c] == selector) {
                                    target = c;
                                    break;
                                }
                            }
                            next = insn.blocks.get(target);
                            break;
                        }
                        case RET:
                            return insn.args.isEmpty() ? null : eval(insn.args.get(0));
                        case UNREACHABLE:
                            throw new TrapException(func.name, "unreachable: " + insn.imm);
                        default:
                            Constant value = executeInsn(insn);
                            Register result = insn.getResult();
                            if (result != null) {
                                regs.put(result, Objects.requireNonNull(value, "no value"));
                            }
                    }
                }
                if (next == null) throw new TrapException(func.name, "fell off the end of " + block.toTargetString());
                prev = block;
                block = next;
            }
        }

        int enterPhis(BasicBlock block, @Nullable BasicBlock prev) {
            List<Insn> phis = block.getPhis();
            if (phis.isEmpty()) return 0;
            if (prev == null) throw new TrapException(func.name, "phi in the entry block");
            // all phis read their operands before any is written
            List<Constant> values = new ArrayList<>(phis.size());
            for (Insn phi : phis) {
                int index = phi.blocks.indexOf(prev);
                if (index < 0) {
                    throw new TrapException(func.name, String.format("phi has no operand for %s", prev.toTargetString()));
                }
                values.add(eval(phi.args.get(index)));
            }
            for (int i = 0; i < phis.size(); i++) {
                Register result = phis.get(i).getResult();
                if (result != null) regs.put(result, values.get(i));
            }
            return phis.size();
        }

        @Nullable
        Constant executeInsn(Insn insn) {
            List<Value> args = insn.args;
            switch (insn.op) {
                case ALLOCA:
                    return pointer(allocate(func.name, Math.max(1, insn.getAllocatedType().bytes())));
                case LOAD:
                case ATOMIC_LOAD:
                    return read(func.name, insn.type, address(args.get(0)));
                case STORE:
                case ATOMIC_STORE:
                    write(func.name, args.get(1).getType(), address(args.get(0)), eval(args.get(1)));
                    return null;
                case MEMSET: {
                    int addr = checkRange(func.name, address(args.get(0)), eval(args.get(2)).longValue());
                    long len = eval(args.get(2)).longValue();
                    Arrays.fill(memory, addr, (int) (addr + len), (byte) eval(args.get(1)).longValue());
                    return null;
                }
                case MEMCPY: {
                    long len = eval(args.get(2)).longValue();
                    int dst = checkRange(func.name, address(args.get(0)), len);
                    int src = checkRange(func.name, address(args.get(1)), len);
                    System.arraycopy(memory, src, memory, dst, (int) len);
                    return null;
                }
                case PTR_ADD:
                    return pointer(address(args.get(0)) + eval(args.get(1)).longValue());
                case ATOMIC_ADD: {
                    long addr = address(args.get(0));
                    Constant old = read(func.name, insn.type, addr);
                    write(func.name, insn.type, addr, Constant.of(insn.type, old.longValue() + eval(args.get(1)).longValue()));
                    return old;
                }
                case ATOMIC_CAS: {
                    long addr = address(args.get(0));
                    Constant old = read(func.name, insn.type, addr);
                    if (old.equals(eval(args.get(1)))) {
                        write(func.name, insn.type, addr, eval(args.get(2)));
                    }
                    return old;
                }
                case CALL: {
                    Function callee = module.getFunction(insn.getCallee());
                    if (callee == null) throw new TrapException(func.name, "call to unknown function " + insn.getCallee());
                    List<Constant> callArgs = new ArrayList<>(args.size());
                    for (Value arg : args) {
                        callArgs.add(eval(arg));
                    }
                    Constant ret = invoke(callee, callArgs);
                    return ret == null && insn.type != Type.VOID ? Constant.zero(insn.type) : ret;
                }
                case PARAM:
                    return param(insn.getParamIndex());
                case SPILL:
                    slots.put(insn.getSlot(), eval(args.get(0)));
                    return null;
                case RELOAD: {
                    Constant value = slots.get(insn.getSlot());
                    return value == null ? Constant.zero(insn.type) : value;
                }
                default: {
                    List<Value> operands = new ArrayList<>(args.size());
                    for (Value arg : args) {
                        operands.add(eval(arg));
                    }
                    Constant value = Folding.fold(insn.op, insn.type, operands, insn.imm);
                    if (value != null) return value;
                    if (insn.op == Opcode.DIV || insn.op == Opcode.REM) {
                        throw new TrapException(func.name, "integer division by zero");
                    }
                    throw new TrapException(func.name, "cannot interpret " + insn);
                }
            }
        }

        Constant param(int index) {
            if (index < 0 || index >= args.size()) throw new TrapException(func.name, "no parameter " + index);
            return args.get(index);
        }

        Constant eval(Value value) {
            if (value instanceof Constant) return (Constant) value;
            if (value instanceof Undef) return Constant.zero(value.getType());
            if (value instanceof GlobalRef) {
                Long addr = globalAddresses.get(((GlobalRef) value).name);
                if (addr == null) throw new TrapException(func.name, "no global named " + ((GlobalRef) value).name);
                return pointer(addr);
            }
            Constant c = regs.get(value);
            if (c == null) throw new TrapException(func.name, value + " read before it was written");
            return c;
        }

        long address(Value value) {
            return eval(value).longValue();
        }
    }

    private static Constant pointer(long addr) {
        return Constant.of(Type.PTR, addr);
    }

    private long allocate(@Nullable String func, int size) {
        int addr = sp;
        int end = addr + (size + ALIGN - 1) / ALIGN * ALIGN;
        if (end > MAX_MEMORY) throw new TrapException(func, "out of memory");
        if (end > memory.length) {
            memory = Arrays.copyOf(memory, Math.min(MAX_MEMORY, Math.max(end, memory.length * 2)));
        }
        Arrays.fill(memory, addr, end, (byte) 0);
        sp = end;
        return addr;
    }

    private int checkRange(@Nullable String func, long addr, long len) {
        if (addr <= 0 || len < 0 || addr + len > sp) {
            throw new TrapException(func, String.format("access of %d bytes at %d is out of bounds", len, addr));
        }
        return (int) addr;
    }

    private Constant read(@Nullable String func, Type type, long addr) {
        ByteBuffer buf = ByteBuffer.wrap(memory).order(ByteOrder.LITTLE_ENDIAN);
        int at = checkRange(func, addr, type.bytes());
        switch (type) {
            case I1:
                return Constant.bool(memory[at] != 0);
            case I8:
                return Constant.of(type, memory[at]);
            case I16:
                return Constant.of(type, buf.getShort(at));
            case I32:
                return Constant.of(type, buf.getInt(at));
            case I64:
            case PTR:
                return Constant.of(type, buf.getLong(at));
            case F32:
                return Constant.ofFloat(type, buf.getFloat(at));
            case F64:
                return Constant.ofFloat(type, buf.getDouble(at));
            default:
                throw new TrapException(func, "cannot load a " + type);
        }
    }

    private void write(@Nullable String func, Type type, long addr, Constant value) {
        ByteBuffer buf = ByteBuffer.wrap(memory).order(ByteOrder.LITTLE_ENDIAN);
        int at = checkRange(func, addr, type.bytes());
        switch (type) {
            case I1:
            case I8:
                memory[at] = (byte) value.longValue();
                break;
            case I16:
                buf.putShort(at, (short) value.longValue());
                break;
            case I32:
                buf.putInt(at, (int) value.longValue());
                break;
            case I64:
            case PTR:
                buf.putLong(at, value.longValue());
                break;
            case F32:
                buf.putFloat(at, (float) value.doubleValue());
                break;
            case F64:
                buf.putDouble(at, value.doubleValue());
                break;
            default:
                throw new TrapException(func, "cannot store a " + type);
        }
        LOGGER.trace("stored {} at {}", value, addr);
    }
}
