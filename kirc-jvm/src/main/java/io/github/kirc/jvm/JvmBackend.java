package io.github.kirc.jvm;

import io.github.kirc.core.backend.AllocatedModule;
import io.github.kirc.core.backend.Backend;
import io.github.kirc.core.diag.UnsupportedOpcodeException;
import io.github.kirc.core.ops.Intrinsics;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.regalloc.Allocation;
import io.github.kirc.core.regalloc.Location;
import io.github.kirc.core.regalloc.PhysReg;
import io.github.kirc.core.regalloc.TargetDesc;
import io.github.kirc.core.ssa.*;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Label;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;
import org.objectweb.asm.commons.Method;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A direct emitter which compiles an allocated module into a JVM class,
 * with one public static method per function.
 * <p>
 * Integer, boolean and pointer values are passed and held as {@code long}s, sign-extended from their
 * width, and float values as {@code double}s. Every physical register is a JVM local of its class,
 * and the spill slots of a call are the elements of a {@code long[]} allocated on entry.
 * <p>
 * Memory, atomics, globals and opaque intrinsics have no lowering here, and raise
 * {@link UnsupportedOpcodeException}. Calls to declared but undefined functions
 * compile to a stub which throws {@link UnsupportedOperationException}.
 */
public class JvmBackend implements Backend<JvmClass> {
    private static final Logger LOGGER = LoggerFactory.getLogger(JvmBackend.class);

    private static final Type RUNTIME = Type.getType(KirRuntime.class);
    private static final Type MATH = Type.getType(Math.class);
    private static final Type LONG_ARRAY = Type.getType(long[].class);

    private final String className;
    private final TargetDesc target;

    public JvmBackend(String className) {
        this(className, TargetDesc.x86_64());
    }

    /**
     * Construct a JVM backend.
     *
     * @param className The binary name of the class to emit.
     * @param target    The register description to allocate for; its registers become locals.
     */
    public JvmBackend(String className, TargetDesc target) {
        this.className = className;
        this.target = target;
    }

    @Override
    public String name() {
        return "jvm";
    }

    @Override
    public TargetDesc target() {
        return target;
    }

    @Override
    public JvmClass emit(AllocatedModule input) {
        if (!input.isAllocated()) {
            throw new IllegalArgumentException("the JVM backend consumes allocated modules");
        }
        ClassWriter cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
        String internalName = className.replace('.', '/');
        cw.visit(Opcodes.V1_8,
                Opcodes.ACC_PUBLIC | Opcodes.ACC_FINAL | Opcodes.ACC_SUPER,
                internalName,
                null,
                Type.getInternalName(Object.class),
                null);
        input.walk(new ClassEmitter(cw, Type.getObjectType(internalName)));
        cw.visitEnd();
        LOGGER.debug("emitted class {} for {} functions", className, input.module.getFunctions().size());
        return new JvmClass(className, cw.toByteArray());
    }

    static Type jvmType(io.github.kirc.core.ssa.Type type) {
        if (type == io.github.kirc.core.ssa.Type.VOID) return Type.VOID_TYPE;
        return type.regClass() == RegClass.FLOAT ? Type.DOUBLE_TYPE : Type.LONG_TYPE;
    }

    static Method methodOf(io.github.kirc.core.ssa.Function func) {
        List<io.github.kirc.core.ssa.Type> params = func.signature.params;
        Type[] args = new Type[params.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = jvmType(params.get(i));
        }
        return new Method(func.name, jvmType(func.signature.returnType), args);
    }

    private class ClassEmitter implements AllocatedModule.Walker {
        final ClassWriter cw;
        final Type owner;

        GeneratorAdapter ga;
        io.github.kirc.core.ssa.Function func;
        final Map<RegClass, int[]> locals = new EnumMap<>(RegClass.class);
        final Map<BasicBlock, Label> labels = new HashMap<>();
        int spills = -1;

        ClassEmitter(ClassWriter cw, Type owner) {
            this.cw = cw;
            this.owner = owner;
        }

        @Override
        public void visitGlobal(Global global) {
            LOGGER.trace("global {} is not accessible from the JVM backend", global.name);
        }

        @Override
        public void visitDeclaration(io.github.kirc.core.ssa.Function func) {
            GeneratorAdapter stub = new GeneratorAdapter(Opcodes.ACC_PUBLIC | Opcodes.ACC_STATIC,
                    methodOf(func), null, null, cw);
            stub.visitCode();
            stub.throwException(Type.getType(UnsupportedOperationException.class),
                    "external function " + func.name);
            stub.endMethod();
        }

        @Override
        public void enterFunction(io.github.kirc.core.ssa.Function func, @Nullable Allocation allocation) {
            Allocation alloc = Objects.requireNonNull(allocation);
            this.func = func;
            ga = new GeneratorAdapter(Opcodes.ACC_PUBLIC | Opcodes.ACC_STATIC, methodOf(func), null, null, cw);
            ga.visitCode();

            locals.clear();
            labels.clear();
            for (RegClass cls : RegClass.values()) {
                int count = alloc.target.registers(cls).size() + alloc.target.scratch(cls).size();
                Type type = cls == RegClass.FLOAT ? Type.DOUBLE_TYPE : Type.LONG_TYPE;
                int[] slots = new int[count];
                for (int i = 0; i < count; i++) {
                    slots[i] = ga.newLocal(type);
                    // every register starts out as zero, so no path reads an unset local
                    if (cls == RegClass.FLOAT) {
                        ga.push(0D);
                    } else {
                        ga.push(0L);
                    }
                    ga.storeLocal(slots[i]);
                }
                locals.put(cls, slots);
            }
            spills = -1;
            if (alloc.getSlotCount() > 0) {
                spills = ga.newLocal(LONG_ARRAY);
                ga.push(alloc.getSlotCount());
                ga.newArray(Type.LONG_TYPE);
                ga.storeLocal(spills);
            }
            for (BasicBlock block : func.blocks) {
                labels.put(block, ga.newLabel());
            }
        }

        @Override
        public void enterBlock(BasicBlock block) {
            ga.mark(labels.get(block));
        }

        @Override
        public void exitFunction(io.github.kirc.core.ssa.Function func) {
            ga.endMethod();
            ga = null;
        }

        void unsupported(Insn insn) {
            throw new UnsupportedOpcodeException(func.name, insn.op, name());
        }

        void load(Insn insn, Value value, @Nullable Location location) {
            io.github.kirc.core.ssa.Type type = value.getType();
            boolean isFloat = type.isFloat();
            if (value instanceof Constant) {
                Constant c = (Constant) value;
                if (isFloat) {
                    ga.push(c.doubleValue());
                } else {
                    ga.push(c.longValue());
                }
            } else if (value instanceof Undef) {
                if (isFloat) {
                    ga.push(0D);
                } else {
                    ga.push(0L);
                }
            } else if (value instanceof GlobalRef) {
                unsupported(insn);
            } else {
                if (!(location instanceof PhysReg)) {
                    throw new IllegalStateException(String.format("%s in %s is not in a register", value, func.name));
                }
                ga.loadLocal(local((PhysReg) location));
            }
        }

        int local(PhysReg reg) {
            return locals.get(reg.regClass)[reg.index];
        }

        void loadArgs(Insn insn, List<@Nullable Location> operands) {
            for (int i = 0; i < insn.args.size(); i++) {
                load(insn, insn.args.get(i), operands.get(i));
            }
        }

        /**
         * Normalize the value on the stack to the width of the type, and store it to the result register.
         */
        void store(Insn insn, @Nullable Location result) {
            io.github.kirc.core.ssa.Type type = insn.type;
            normalize(type);
            if (insn.getResult() == null) {
                ga.pop2();
                return;
            }
            if (!(result instanceof PhysReg)) {
                throw new IllegalStateException(String.format("result of %s in %s is not in a register", insn, func.name));
            }
            ga.storeLocal(local((PhysReg) result));
        }

        void normalize(io.github.kirc.core.ssa.Type type) {
            switch (type) {
                case I1:
                    ga.push(1L);
                    ga.math(GeneratorAdapter.AND, Type.LONG_TYPE);
                    break;
                case I8:
                    ga.cast(Type.LONG_TYPE, Type.INT_TYPE);
                    ga.cast(Type.INT_TYPE, Type.BYTE_TYPE);
                    ga.cast(Type.INT_TYPE, Type.LONG_TYPE);
                    break;
                case I16:
                    ga.cast(Type.LONG_TYPE, Type.INT_TYPE);
                    ga.cast(Type.INT_TYPE, Type.SHORT_TYPE);
                    ga.cast(Type.INT_TYPE, Type.LONG_TYPE);
                    break;
                case I32:
                    ga.cast(Type.LONG_TYPE, Type.INT_TYPE);
                    ga.cast(Type.INT_TYPE, Type.LONG_TYPE);
                    break;
                case F32:
                    ga.cast(Type.DOUBLE_TYPE, Type.FLOAT_TYPE);
                    ga.cast(Type.FLOAT_TYPE, Type.DOUBLE_TYPE);
                    break;
                default:
                    break;
            }
        }

        void mask(io.github.kirc.core.ssa.Type type) {
            if (type.mask() == -1L) return;
            ga.push(type.mask());
            ga.math(GeneratorAdapter.AND, Type.LONG_TYPE);
        }

        @Override
        public void visitInsn(Insn insn, @Nullable Location result, List<@Nullable Location> operands) {
            io.github.kirc.core.ssa.Type t = insn.type;
            List<Value> args = insn.args;
            switch (insn.op) {
                case JUMP:
                    ga.goTo(labels.get(insn.blocks.get(0)));
                    break;
                case JUMP_IF:
                    load(insn, args.get(0), operands.get(0));
                    ga.push(0L);
                    ga.ifCmp(Type.LONG_TYPE, GeneratorAdapter.NE, labels.get(insn.blocks.get(0)));
                    ga.goTo(labels.get(insn.blocks.get(1)));
                    break;
                case SWITCH: {
                    long[] cases = insn.getCases();
                    for (int i = 0; i < cases.length; i++) {
                        load(insn, args.get(0), operands.get(0));
                        ga.push(cases[i]);
                        ga.ifCmp(Type.LONG_TYPE, GeneratorAdapter.EQ, labels.get(insn.blocks.get(i)));
                    }
                    ga.goTo(labels.get(insn.blocks.get(cases.length)));
                    break;
                }
                case RET:
                    if (!args.isEmpty()) load(insn, args.get(0), operands.get(0));
                    ga.returnValue();
                    break;
                case UNREACHABLE:
                    ga.push(func.name);
                    ga.push(String.valueOf(insn.imm));
                    ga.invokeStatic(RUNTIME, Method.getMethod(
                            "IllegalStateException unreachable(String, String)"));
                    ga.throwException();
                    break;

                case ADD:
                case SUB:
                case MUL:
                case DIV:
                case REM:
                case AND:
                case OR:
                case XOR:
                    loadArgs(insn, operands);
                    ga.math(mathOp(insn.op), jvmType(t));
                    store(insn, result);
                    break;
                case NEG:
                    loadArgs(insn, operands);
                    ga.math(GeneratorAdapter.NEG, jvmType(t));
                    store(insn, result);
                    break;
                case NOT:
                    loadArgs(insn, operands);
                    ga.push(-1L);
                    ga.math(GeneratorAdapter.XOR, Type.LONG_TYPE);
                    store(insn, result);
                    break;
                case SHL:
                case SHR:
                case USHR:
                    load(insn, args.get(0), operands.get(0));
                    if (insn.op == Opcode.USHR) mask(t);
                    load(insn, args.get(1), operands.get(1));
                    ga.cast(Type.LONG_TYPE, Type.INT_TYPE);
                    ga.push(Math.max(t.bits, 8) - 1);
                    ga.math(GeneratorAdapter.AND, Type.INT_TYPE);
                    ga.math(insn.op == Opcode.SHL ? GeneratorAdapter.SHL
                            : insn.op == Opcode.SHR ? GeneratorAdapter.SHR
                            : GeneratorAdapter.USHR, Type.LONG_TYPE);
                    store(insn, result);
                    break;

                case EQ:
                case NE:
                case LT:
                case LE:
                case GT:
                case GE: {
                    loadArgs(insn, operands);
                    Label isTrue = ga.newLabel();
                    Label end = ga.newLabel();
                    ga.ifCmp(jvmType(args.get(0).getType()), compareMode(insn.op), isTrue);
                    ga.push(0L);
                    ga.goTo(end);
                    ga.mark(isTrue);
                    ga.push(1L);
                    ga.mark(end);
                    store(insn, result);
                    break;
                }

                case TRUNC:
                case SEXT:
                    loadArgs(insn, operands);
                    store(insn, result);
                    break;
                case ZEXT:
                    loadArgs(insn, operands);
                    mask(args.get(0).getType());
                    store(insn, result);
                    break;
                case ITOF:
                    loadArgs(insn, operands);
                    ga.cast(Type.LONG_TYPE, Type.DOUBLE_TYPE);
                    store(insn, result);
                    break;
                case FTOI:
                    loadArgs(insn, operands);
                    ga.push(t.bits);
                    ga.invokeStatic(RUNTIME, Method.getMethod("long ftoi(double, int)"));
                    store(insn, result);
                    break;
                case FCONV:
                    loadArgs(insn, operands);
                    store(insn, result);
                    break;

                case INTRINSIC:
                    intrinsic(insn, result, operands);
                    break;
                case CALL: {
                    io.github.kirc.core.ssa.Function callee = func
                            .getExtOrThrow(io.github.kirc.core.ext.CommonExts.OWNING_MODULE)
                            .getFunction(insn.getCallee());
                    if (callee == null) {
                        throw new IllegalStateException("call to unknown function " + insn.getCallee());
                    }
                    loadArgs(insn, operands);
                    ga.invokeStatic(owner, methodOf(callee));
                    if (t != io.github.kirc.core.ssa.Type.VOID) store(insn, result);
                    break;
                }
                case PARAM:
                    ga.loadArg(insn.getParamIndex());
                    store(insn, result);
                    break;
                case COPY:
                    loadArgs(insn, operands);
                    store(insn, result);
                    break;
                case SPILL: {
                    Value value = args.get(0);
                    ga.loadLocal(spills);
                    ga.push(insn.getSlot());
                    load(insn, value, operands.get(0));
                    if (value.getType().isFloat()) {
                        ga.invokeStatic(Type.getType(Double.class), Method.getMethod("long doubleToRawLongBits(double)"));
                    }
                    ga.arrayStore(Type.LONG_TYPE);
                    break;
                }
                case RELOAD:
                    ga.loadLocal(spills);
                    ga.push(insn.getSlot());
                    ga.arrayLoad(Type.LONG_TYPE);
                    if (t.isFloat()) {
                        ga.invokeStatic(Type.getType(Double.class), Method.getMethod("double longBitsToDouble(long)"));
                    }
                    store(insn, result);
                    break;

                default:
                    unsupported(insn);
            }
        }

        void intrinsic(Insn insn, @Nullable Location result, List<@Nullable Location> operands) {
            io.github.kirc.core.ssa.Type t = insn.type;
            String desc = t.isFloat() ? "double" : "long";
            switch (insn.getIntrinsicName()) {
                case Intrinsics.SQRT:
                    loadArgs(insn, operands);
                    ga.invokeStatic(MATH, Method.getMethod("double sqrt(double)"));
                    break;
                case Intrinsics.FABS:
                case Intrinsics.ABS:
                    loadArgs(insn, operands);
                    ga.invokeStatic(MATH, Method.getMethod(desc + " abs(" + desc + ")"));
                    break;
                case Intrinsics.MIN:
                    loadArgs(insn, operands);
                    ga.invokeStatic(MATH, Method.getMethod(desc + " min(" + desc + ", " + desc + ")"));
                    break;
                case Intrinsics.MAX:
                    loadArgs(insn, operands);
                    ga.invokeStatic(MATH, Method.getMethod(desc + " max(" + desc + ", " + desc + ")"));
                    break;
                case Intrinsics.POPCOUNT:
                    loadArgs(insn, operands);
                    mask(t);
                    ga.invokeStatic(Type.getType(Long.class), Method.getMethod("int bitCount(long)"));
                    ga.cast(Type.INT_TYPE, Type.LONG_TYPE);
                    break;
                default:
                    unsupported(insn);
            }
            store(insn, result);
        }
    }

    private static int mathOp(Opcode op) {
        switch (op) {
            case ADD:
                return GeneratorAdapter.ADD;
            case SUB:
                return GeneratorAdapter.SUB;
            case MUL:
                return GeneratorAdapter.MUL;
            case DIV:
                return GeneratorAdapter.DIV;
            case REM:
                return GeneratorAdapter.REM;
            case AND:
                return GeneratorAdapter.AND;
            case OR:
                return GeneratorAdapter.OR;
            case XOR:
                return GeneratorAdapter.XOR;
            default:
                throw new IllegalArgumentException(op.toString());
        }
    }

    private static int compareMode(Opcode op) {
        switch (op) {
            case EQ:
                return GeneratorAdapter.EQ;
            case NE:
                return GeneratorAdapter.NE;
            case LT:
                return GeneratorAdapter.LT;
            case LE:
                return GeneratorAdapter.LE;
            case GT:
                return GeneratorAdapter.GT;
            case GE:
                return GeneratorAdapter.GE;
            default:
                throw new IllegalArgumentException(op.toString());
        }
    }
}
