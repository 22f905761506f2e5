package io.github.kirc.core.passes.opts;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.MetadataState;
import io.github.kirc.core.ops.Folding;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.pipeline.FunctionPass;
import io.github.kirc.core.pipeline.OptimizationStats;
import io.github.kirc.core.ssa.*;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A pass which evaluates instructions whose operands are all constants, and simplifies
 * integer instructions with an identity operand into {@link Opcode#COPY copies}.
 * <p>
 * Conditional branches and switches on a constant become plain jumps, and the phis of the
 * blocks no longer jumped to lose their incoming operand. Integer division by a zero
 * constant is left alone, to trap at run time.
 */
public class ConstantFolding implements FunctionPass {
    /**
     * A singleton instance of this pass.
     */
    public static final ConstantFolding INSTANCE = new ConstantFolding();

    @Override
    public Boolean run(Function func) {
        Map<Register, Value> replacements = new HashMap<>();
        int folded = 0;
        boolean cfgChanged = false;

        for (BasicBlock block : func.blocks) {
            List<Insn> insns = block.getInsns();
            ListIterator<Insn> iter = insns.listIterator();
            while (iter.hasNext()) {
                Insn insn = iter.next();
                resolveArgs(insn, replacements);
                if (insn.isTerminator()) {
                    if (foldBranch(block, insn)) {
                        cfgChanged = true;
                        folded++;
                    }
                    continue;
                }
                Register result = insn.getResult();
                if (result == null || insn.op == Opcode.PHI) continue;

                Constant constant = Folding.fold(insn.op, insn.type, insn.args, insn.imm);
                if (constant != null) {
                    replacements.put(result, constant);
                    insn.assignTo(null);
                    iter.remove();
                    folded++;
                    continue;
                }
                Value simplified = simplify(insn);
                if (simplified != null) {
                    Register kept = insn.getResult();
                    insn.assignTo(null);
                    iter.set(Insn.copy(simplified).assignTo(kept));
                    folded++;
                }
            }
        }
        IRUtils.substitute(func, replacements);

        if (folded == 0) return false;
        OptimizationStats.of(func).add(OptimizationStats.Counter.FOLDED_CONSTANTS, folded);
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        if (cfgChanged) {
            ms.graphChanged();
        } else {
            ms.varsChanged();
        }
        return true;
    }

    private static void resolveArgs(Insn insn, Map<Register, Value> replacements) {
        if (replacements.isEmpty()) return;
        List<Value> args = insn.args;
        for (int i = 0; i < args.size(); i++) {
            args.set(i, IRUtils.resolve(args.get(i), replacements));
        }
    }

    private static boolean foldBranch(BasicBlock block, Insn insn) {
        BasicBlock taken;
        if (insn.op == Opcode.JUMP_IF && insn.args.get(0) instanceof Constant) {
            taken = insn.blocks.get(((Constant) insn.args.get(0)).isZero() ? 1 : 0);
        } else if (insn.op == Opcode.SWITCH && insn.args.get(0) instanceof Constant) {
            long selector = ((Constant) insn.args.get(0)).longValue();
            long[] cases = insn.getCases();
            taken = insn.blocks.get(cases.length);
            for (int i = 0; i < cases.length; i++) {
                if (cases[i] == selector) {
                    taken = insn.blocks.get(i);
                    break;
                }
            }
        } else {
            return false;
        }
        for (BasicBlock dropped : new LinkedHashSet<>(insn.blocks)) {
            if (dropped != taken) IRUtils.removePhiIncoming(dropped, block);
        }
        List<Insn> insns = block.getInsns();
        insns.set(insns.size() - 1, Insn.jump(taken));
        return true;
    }

    /**
     * Simplify an integer instruction with an identity or absorbing constant operand.
     *
     * @param insn The instruction.
     * @return The value the instruction always computes, or null.
     */
    @Nullable
    private static Value simplify(Insn insn) {
        if (!insn.type.isInt() || insn.args.size() != 2) return null;
        Value a = insn.args.get(0);
        Value b = insn.args.get(1);
        switch (insn.op) {
            case ADD:
            case OR:
            case XOR:
                if (isZero(b)) return a;
                if (isZero(a)) return b;
                return null;
            case SUB:
            case SHL:
            case SHR:
            case USHR:
                return isZero(b) ? a : null;
            case MUL:
                if (isOne(b)) return a;
                if (isOne(a)) return b;
                if (isZero(a) || isZero(b)) return Constant.zero(insn.type);
                return null;
            case DIV:
                return isOne(b) ? a : null;
            case AND:
                if (isZero(a) || isZero(b)) return Constant.zero(insn.type);
                return null;
            default:
                return null;
        }
    }

    private static boolean isZero(Value value) {
        return value instanceof Constant && ((Constant) value).isZero();
    }

    private static boolean isOne(Value value) {
        return value instanceof Constant && ((Constant) value).isOne();
    }
}
