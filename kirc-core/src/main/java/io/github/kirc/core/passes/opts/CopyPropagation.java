package io.github.kirc.core.passes.opts;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.pipeline.FunctionPass;
import io.github.kirc.core.pipeline.OptimizationStats;
import io.github.kirc.core.ssa.*;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * A pass which contracts {@link Opcode#COPY copies}, and phis whose operands are all the same
 * value (ignoring the phi itself), replacing every use of their result with their source.
 */
public class CopyPropagation implements FunctionPass {
    /**
     * A singleton instance of this pass.
     */
    public static final CopyPropagation INSTANCE = new CopyPropagation();

    @Override
    public Boolean run(Function func) {
        Map<Register, Value> replacements = new HashMap<>();
        for (BasicBlock block : func.blocks) {
            Iterator<Insn> iter = block.getInsns().iterator();
            while (iter.hasNext()) {
                Insn insn = iter.next();
                Register result = insn.getResult();
                if (result == null) continue;
                Value source = null;
                if (insn.op == Opcode.COPY) {
                    source = IRUtils.resolve(insn.args.get(0), replacements);
                } else if (insn.op == Opcode.PHI) {
                    source = trivialPhiValue(insn, result, replacements);
                }
                if (source == null || source == result) continue;
                replacements.put(result, source);
                insn.assignTo(null);
                iter.remove();
            }
        }
        if (replacements.isEmpty()) return false;

        IRUtils.substitute(func, replacements);
        OptimizationStats.of(func).add(OptimizationStats.Counter.PROPAGATED_COPIES, replacements.size());
        func.getExtOrThrow(CommonExts.METADATA_STATE).varsChanged();
        return true;
    }

    /**
     * Get the single value a phi merges, if it only merges one.
     *
     * @param phi          The phi.
     * @param result       The phi's result.
     * @param replacements The replacements found so far, which operands are resolved through.
     * @return The value, {@link Undef} if the phi only merges itself, or null if it merges several values.
     */
    @Nullable
    static Value trivialPhiValue(Insn phi, Register result, Map<Register, Value> replacements) {
        Value unique = null;
        for (Value operand : phi.args) {
            Value arg = IRUtils.resolve(operand, replacements);
            if (arg == result) continue;
            if (unique == null) {
                unique = arg;
            } else if (!unique.equals(arg)) {
                return null;
            }
        }
        return unique == null ? Undef.of(phi.type) : unique;
    }
}
