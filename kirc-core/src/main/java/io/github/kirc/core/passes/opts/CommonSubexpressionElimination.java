package io.github.kirc.core.passes.opts;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.MetadataState;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.pipeline.FunctionPass;
import io.github.kirc.core.pipeline.OptimizationStats;
import io.github.kirc.core.ssa.*;

import java.util.*;

/**
 * A pass which merges instructions computing the same value.
 * <p>
 * The dominator tree is walked depth-first with a scoped table of the expressions available
 * at each point, keyed by opcode, type, immediate and operands (in canonical order for
 * commutative opcodes). An instruction whose key is already available is removed,
 * and uses of its result redirected to the dominating one. Only
 * {@link Insn#isIdempotent() idempotent} instructions take part, so calls, memory and
 * atomic operations are never merged.
 */
public class CommonSubexpressionElimination implements FunctionPass {
    /**
     * A singleton instance of this pass.
     */
    public static final CommonSubexpressionElimination INSTANCE = new CommonSubexpressionElimination();

    @Override
    public Boolean run(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.DOMS);

        Map<Register, Value> replacements = new HashMap<>();
        Map<ExprKey, Register> available = new HashMap<>();

        class Walker {
            void dfs(BasicBlock block) {
                List<ExprKey> added = new ArrayList<>();
                Iterator<Insn> iter = block.getInsns().iterator();
                while (iter.hasNext()) {
                    Insn insn = iter.next();
                    Register result = insn.getResult();
                    if (result == null || insn.op == Opcode.PHI || !insn.isIdempotent()) continue;
                    ExprKey key = new ExprKey(insn, replacements);
                    Register existing = available.get(key);
                    if (existing != null) {
                        replacements.put(result, existing);
                        insn.assignTo(null);
                        iter.remove();
                    } else {
                        available.put(key, result);
                        added.add(key);
                    }
                }
                for (BasicBlock child : block.getExtOrThrow(CommonExts.DOM_CHILDREN)) {
                    dfs(child);
                }
                for (ExprKey key : added) {
                    available.remove(key);
                }
            }
        }
        new Walker().dfs(func.entry());

        if (replacements.isEmpty()) return false;
        IRUtils.substitute(func, replacements);
        OptimizationStats.of(func).add(OptimizationStats.Counter.CSE_EXPRESSIONS, replacements.size());
        ms.varsChanged();
        return true;
    }

    private static final class ExprKey {
        final Opcode op;
        final Type type;
        final Object imm;
        final List<Value> args;

        ExprKey(Insn insn, Map<Register, Value> replacements) {
            op = insn.op;
            type = insn.type;
            imm = insn.imm instanceof long[] ? Arrays.toString((long[]) insn.imm) : insn.imm;
            List<Value> resolved = new ArrayList<>(insn.args.size());
            for (Value arg : insn.args) {
                resolved.add(IRUtils.resolve(arg, replacements));
            }
            if (op.isCommutative() && resolved.size() == 2 && order(resolved.get(0)) > order(resolved.get(1))) {
                Collections.reverse(resolved);
            }
            args = resolved;
        }

        private static long order(Value value) {
            return value instanceof Register ? ((Register) value).id : Long.MAX_VALUE;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ExprKey)) return false;
            ExprKey that = (ExprKey) o;
            return op == that.op && type == that.type
                    && Objects.equals(imm, that.imm)
                    && args.equals(that.args);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, type, imm, args);
        }
    }
}
