package io.github.kirc.core.ssa;

import java.util.*;

/**
 * Operand rewriting helpers shared by the passes.
 */
public final class IRUtils {
    private IRUtils() {
    }

    /**
     * Rewrite every use of {@code from} in the function to {@code to}.
     *
     * @param func The function.
     * @param from The register being replaced.
     * @param to   The replacement.
     * @return The number of operands rewritten.
     */
    public static int replaceAllUses(Function func, Register from, Value to) {
        return substitute(func, Collections.singletonMap(from, to));
    }

    /**
     * Rewrite every operand that is a key of {@code replacements} to its value,
     * following chains of replacements to their end.
     *
     * @param func         The function.
     * @param replacements The replacements.
     * @return The number of operands rewritten.
     */
    public static int substitute(Function func, Map<Register, ? extends Value> replacements) {
        if (replacements.isEmpty()) return 0;
        int count = 0;
        for (BasicBlock block : func.blocks) {
            for (Insn insn : block.getInsns()) {
                List<Value> args = insn.args;
                for (int i = 0; i < args.size(); i++) {
                    Value arg = args.get(i);
                    if (arg instanceof Register && replacements.containsKey(arg)) {
                        args.set(i, resolve(arg, replacements));
                        count++;
                    }
                }
            }
        }
        return count;
    }

    /**
     * Follow a chain of replacements from {@code value}.
     *
     * @param value        The starting value.
     * @param replacements The replacements.
     * @return The last value in the chain.
     */
    public static Value resolve(Value value, Map<Register, ? extends Value> replacements) {
        Value cur = value;
        int steps = 0;
        while (cur instanceof Register && replacements.containsKey(cur)) {
            Value next = replacements.get(cur);
            if (next == cur) break;
            cur = next;
            if (++steps > replacements.size()) {
                throw new IllegalStateException("cyclic replacement of " + value);
            }
        }
        return cur;
    }

    /**
     * Remove the incoming operand for {@code pred} from every phi of {@code block}.
     *
     * @param block The block whose phis to update.
     * @param pred  The predecessor that no longer jumps to it.
     */
    public static void removePhiIncoming(BasicBlock block, BasicBlock pred) {
        for (Insn phi : block.getPhis()) {
            for (int i = phi.blocks.size() - 1; i >= 0; i--) {
                if (phi.blocks.get(i) == pred) {
                    phi.blocks.remove(i);
                    phi.args.remove(i);
                }
            }
        }
    }

    /**
     * Count the uses of every register in the function.
     *
     * @param func The function.
     * @return The use counts; registers with no uses are absent.
     */
    public static Map<Register, Integer> useCounts(Function func) {
        Map<Register, Integer> counts = new HashMap<>();
        for (BasicBlock block : func.blocks) {
            for (Insn insn : block.getInsns()) {
                for (Value arg : insn.args) {
                    if (arg instanceof Register) {
                        counts.merge((Register) arg, 1, Integer::sum);
                    }
                }
            }
        }
        return counts;
    }

    /**
     * Replace the instruction at {@code index} in {@code block}, moving its result register to the replacement.
     *
     * @param block       The block.
     * @param index       The index of the instruction to replace.
     * @param replacement The new instruction, without a result.
     */
    public static void replaceInsn(BasicBlock block, int index, Insn replacement) {
        Insn old = block.getInsns().get(index);
        Register result = old.getResult();
        old.assignTo(null);
        block.getInsns().set(index, replacement.assignTo(result));
    }
}
