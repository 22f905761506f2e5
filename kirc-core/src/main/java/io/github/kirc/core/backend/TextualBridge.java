package io.github.kirc.core.backend;

import io.github.kirc.core.diag.UnsupportedOpcodeException;
import io.github.kirc.core.ops.Intrinsics;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.regalloc.Allocation;
import io.github.kirc.core.regalloc.Location;
import io.github.kirc.core.regalloc.TargetDesc;
import io.github.kirc.core.ssa.*;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A bridge to an external optimizing toolchain, which prints a module in SSA form
 * as LLVM-style textual IR, one instruction per KIR instruction.
 * <p>
 * The external toolchain does its own register allocation, so this backend has no {@link #target()}.
 * Every function definition is preceded by a comment giving its calling convention.
 */
public class TextualBridge implements Backend<String> {
    private final AbiTable abi;

    public TextualBridge(AbiTable abi) {
        this.abi = abi;
    }

    public TextualBridge() {
        this(AbiTable.x86_64());
    }

    @Override
    public String name() {
        return "llvm-text";
    }

    @Override
    public @Nullable TargetDesc target() {
        return null;
    }

    @Override
    public String emit(AllocatedModule input) {
        if (input.isAllocated()) {
            throw new IllegalArgumentException("the textual bridge consumes modules in SSA form");
        }
        Printer printer = new Printer();
        input.walk(printer);
        return printer.sb.toString();
    }

    private class Printer implements AllocatedModule.Walker {
        final StringBuilder sb = new StringBuilder();
        Function func;

        @Override
        public void visitGlobal(Global global) {
            sb.append('@').append(global.name).append(" = global ")
                    .append(type(global.type)).append(' ')
                    .append(global.initializer == null ? zero(global.type) : value(global.initializer))
                    .append('\n');
        }

        @Override
        public void visitDeclaration(Function func) {
            sb.append("declare ").append(type(func.signature.returnType))
                    .append(" @").append(func.name).append('(');
            List<Type> params = func.signature.params;
            for (int i = 0; i < params.size(); i++) {
                if (i != 0) sb.append(", ");
                sb.append(type(params.get(i)));
            }
            sb.append(")\n");
        }

        @Override
        public void enterFunction(Function func, @Nullable Allocation allocation) {
            this.func = func;
            sb.append("\n; abi: ").append(abi.layout(func.signature)).append('\n');
            sb.append("define ").append(type(func.signature.returnType))
                    .append(" @").append(func.name).append('(');
            List<Type> params = func.signature.params;
            for (int i = 0; i < params.size(); i++) {
                if (i != 0) sb.append(", ");
                sb.append(type(params.get(i))).append(" %arg").append(i);
            }
            sb.append(") {\n");
        }

        @Override
        public void enterBlock(BasicBlock block) {
            sb.append(block.toTargetString()).append(":\n");
        }

        @Override
        public void exitFunction(Function func) {
            sb.append("}\n");
        }

        @Override
        public void visitInsn(Insn insn, @Nullable Location result, List<@Nullable Location> operands) {
            sb.append("  ");
            Register reg = insn.getResult();
            if (insn.op == Opcode.ATOMIC_CAS) {
                compareExchange(insn, reg);
                return;
            }
            if (reg != null) {
                sb.append(register(reg)).append(" = ");
            }
            List<Value> args = insn.args;
            Type t = insn.type;
            switch (insn.op) {
                case JUMP:
                    sb.append("br label %").append(insn.blocks.get(0).toTargetString());
                    break;
                case JUMP_IF:
                    sb.append("br ").append(typed(args.get(0)))
                            .append(", label %").append(insn.blocks.get(0).toTargetString())
                            .append(", label %").append(insn.blocks.get(1).toTargetString());
                    break;
                case SWITCH: {
                    long[] cases = insn.getCases();
                    Type selector = args.get(0).getType();
                    sb.append("switch ").append(typed(args.get(0)))
                            .append(", label %").append(insn.blocks.get(cases.length).toTargetString())
                            .append(" [");
                    for (int i = 0; i < cases.length; i++) {
                        sb.append(' ').append(type(selector)).append(' ').append(cases[i])
                                .append(", label %").append(insn.blocks.get(i).toTargetString());
                    }
                    sb.append(" ]");
                    break;
                }
                case RET:
                    sb.append(args.isEmpty() ? "ret void" : "ret " + typed(args.get(0)));
                    break;
                case UNREACHABLE:
                    sb.append("unreachable");
                    break;

                case ALLOCA:
                    sb.append("alloca ").append(type(insn.getAllocatedType()));
                    break;
                case LOAD:
                    sb.append(insn.isVolatile() ? "load volatile " : "load ")
                            .append(type(t)).append(", ").append(typed(args.get(0)));
                    break;
                case STORE:
                    sb.append(insn.isVolatile() ? "store volatile " : "store ")
                            .append(typed(args.get(1))).append(", ").append(typed(args.get(0)));
                    break;
                case MEMSET:
                    sb.append("call void @llvm.memset.p0.i64(").append(typedList(args)).append(", i1 false)");
                    break;
                case MEMCPY:
                    sb.append("call void @llvm.memcpy.p0.p0.i64(").append(typedList(args)).append(", i1 false)");
                    break;
                case PTR_ADD:
                    sb.append("getelementptr i8, ").append(typedList(args));
                    break;

                case ADD:
                case SUB:
                case MUL:
                case DIV:
                case REM:
                case AND:
                case OR:
                case XOR:
                case SHL:
                case SHR:
                case USHR:
                    sb.append(binaryName(insn.op, t)).append(' ').append(type(t)).append(' ')
                            .append(value(args.get(0))).append(", ").append(value(args.get(1)));
                    break;
                case NEG:
                    if (t.isFloat()) {
                        sb.append("fneg ").append(typed(args.get(0)));
                    } else {
                        sb.append("sub ").append(type(t)).append(" 0, ").append(value(args.get(0)));
                    }
                    break;
                case NOT:
                    sb.append("xor ").append(typed(args.get(0))).append(t == Type.I1 ? ", true" : ", -1");
                    break;

                case EQ:
                case NE:
                case LT:
                case LE:
                case GT:
                case GE: {
                    Type operand = args.get(0).getType();
                    sb.append(operand.isFloat() ? "fcmp " : "icmp ")
                            .append(compareName(insn.op, operand)).append(' ')
                            .append(typed(args.get(0))).append(", ").append(value(args.get(1)));
                    break;
                }

                case TRUNC:
                case SEXT:
                case ZEXT:
                case ITOF:
                case FTOI:
                case FCONV:
                    sb.append(castName(insn.op, args.get(0).getType(), t)).append(' ')
                            .append(typed(args.get(0))).append(" to ").append(type(t));
                    break;

                case ATOMIC_LOAD:
                    sb.append("load atomic ").append(type(t)).append(", ").append(typed(args.get(0)))
                            .append(" seq_cst, align ").append(t.bytes());
                    break;
                case ATOMIC_STORE:
                    sb.append("store atomic ").append(typed(args.get(1))).append(", ").append(typed(args.get(0)))
                            .append(" seq_cst, align ").append(args.get(1).getType().bytes());
                    break;
                case ATOMIC_ADD:
                    sb.append("atomicrmw add ").append(typedList(args)).append(" seq_cst");
                    break;
                case INTRINSIC:
                    intrinsic(insn);
                    break;
                case CALL:
                    sb.append("call ").append(type(t)).append(" @").append(insn.getCallee())
                            .append('(').append(typedList(args)).append(')');
                    break;
                case PARAM:
                    sb.append("select i1 true, ").append(type(t)).append(" %arg").append(insn.getParamIndex())
                            .append(", ").append(type(t)).append(" %arg").append(insn.getParamIndex());
                    break;
                case COPY:
                    sb.append("select i1 true, ").append(typed(args.get(0))).append(", ").append(typed(args.get(0)));
                    break;
                case PHI:
                    sb.append("phi ").append(type(t));
                    for (int i = 0; i < args.size(); i++) {
                        sb.append(i == 0 ? " [ " : ", [ ").append(value(args.get(i)))
                                .append(", %").append(insn.blocks.get(i).toTargetString()).append(" ]");
                    }
                    break;
                case SPILL:
                case RELOAD:
                default:
                    throw new UnsupportedOpcodeException(func.name, insn.op, name());
            }
            sb.append('\n');
        }

        private void compareExchange(Insn insn, @Nullable Register reg) {
            String pair = "%cas." + (reg == null ? "void" : Integer.toString(reg.id));
            // cmpxchg yields a pair, the old value is its first element
            sb.append(pair).append(" = cmpxchg ").append(typedList(insn.args)).append(" seq_cst seq_cst\n");
            if (reg != null) {
                sb.append("  ").append(register(reg)).append(" = extractvalue { ")
                        .append(type(insn.type)).append(", i1 } ").append(pair).append(", 0\n");
            }
        }

        private void intrinsic(Insn insn) {
            String name = insn.getIntrinsicName();
            Type t = insn.type;
            List<Value> args = insn.args;
            String llvmName;
            String extra = "";
            switch (name) {
                case Intrinsics.SQRT:
                    llvmName = "llvm.sqrt." + type(t);
                    break;
                case Intrinsics.FABS:
                    llvmName = "llvm.fabs." + type(t);
                    break;
                case Intrinsics.ABS:
                    llvmName = "llvm.abs." + type(t);
                    extra = ", i1 false";
                    break;
                case Intrinsics.MIN:
                    llvmName = (t.isFloat() ? "llvm.minnum." : "llvm.smin.") + type(t);
                    break;
                case Intrinsics.MAX:
                    llvmName = (t.isFloat() ? "llvm.maxnum." : "llvm.smax.") + type(t);
                    break;
                case Intrinsics.POPCOUNT:
                    llvmName = "llvm.ctpop." + type(t);
                    break;
                default:
                    llvmName = name;
            }
            sb.append("call ").append(type(t)).append(" @").append(llvmName)
                    .append('(').append(typedList(args)).append(extra).append(')');
        }

        private String typedList(List<Value> values) {
            StringBuilder list = new StringBuilder();
            for (int i = 0; i < values.size(); i++) {
                if (i != 0) list.append(", ");
                list.append(typed(values.get(i)));
            }
            return list.toString();
        }
    }

    static String type(Type type) {
        switch (type) {
            case F32:
                return "float";
            case F64:
                return "double";
            case PTR:
                return "ptr";
            case VOID:
                return "void";
            default:
                return "i" + type.bits;
        }
    }

    static String typed(Value value) {
        return type(value.getType()) + " " + value(value);
    }

    static String register(Register reg) {
        return reg.name == null ? "%r" + reg.id : "%" + reg.name + "." + reg.id;
    }

    static String value(Value value) {
        if (value instanceof Register) return register((Register) value);
        if (value instanceof GlobalRef) return "@" + ((GlobalRef) value).name;
        if (value instanceof Undef) return "undef";
        Constant c = (Constant) value;
        if (c.getType() == Type.I1) return c.isZero() ? "false" : "true";
        if (c.isFloat()) return String.format("0x%016X", Double.doubleToRawLongBits(c.doubleValue()));
        if (c.getType() == Type.PTR && c.isZero()) return "null";
        return Long.toString(c.longValue());
    }

    private static String zero(Type type) {
        if (type == Type.PTR) return "null";
        if (type == Type.I1) return "false";
        return type.isFloat() ? "0.0" : "0";
    }

    private static String binaryName(Opcode op, Type type) {
        boolean f = type.isFloat();
        switch (op) {
            case ADD:
                return f ? "fadd" : "add";
            case SUB:
                return f ? "fsub" : "sub";
            case MUL:
                return f ? "fmul" : "mul";
            case DIV:
                return f ? "fdiv" : "sdiv";
            case REM:
                return f ? "frem" : "srem";
            case AND:
                return "and";
            case OR:
                return "or";
            case XOR:
                return "xor";
            case SHL:
                return "shl";
            case SHR:
                return "ashr";
            case USHR:
                return "lshr";
            default:
                throw new IllegalArgumentException(op.toString());
        }
    }

    private static String compareName(Opcode op, Type operand) {
        boolean f = operand.isFloat();
        switch (op) {
            case EQ:
                return f ? "oeq" : "eq";
            case NE:
                return f ? "une" : "ne";
            case LT:
                return f ? "olt" : "slt";
            case LE:
                return f ? "ole" : "sle";
            case GT:
                return f ? "ogt" : "sgt";
            case GE:
                return f ? "oge" : "sge";
            default:
                throw new IllegalArgumentException(op.toString());
        }
    }

    private static String castName(Opcode op, Type from, Type to) {
        switch (op) {
            case TRUNC:
                return "trunc";
            case SEXT:
                return "sext";
            case ZEXT:
                return "zext";
            case ITOF:
                return "sitofp";
            case FTOI:
                return "fptosi";
            case FCONV:
                return to.bits > from.bits ? "fpext" : "fptrunc";
            default:
                throw new IllegalArgumentException(op.toString());
        }
    }
}
