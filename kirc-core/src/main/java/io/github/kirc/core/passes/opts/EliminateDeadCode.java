package io.github.kirc.core.passes.opts;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.MetadataState;
import io.github.kirc.core.pipeline.FunctionPass;
import io.github.kirc.core.pipeline.OptimizationStats;
import io.github.kirc.core.ssa.*;

import java.util.*;

/**
 * A pass which removes blocks unreachable from the entry, and every instruction
 * whose result is never used by anything with an observable effect.
 * <p>
 * Liveness is propagated from side-effecting instructions, terminators and integer divisions
 * that may trap, so dead cycles of phis are removed as well, and running the pass again on
 * its own output changes nothing.
 */
public class EliminateDeadCode implements FunctionPass {
    /**
     * A singleton instance of this pass.
     */
    public static final EliminateDeadCode INSTANCE = new EliminateDeadCode();

    @Override
    public Boolean run(Function func) {
        int removed = 0;
        boolean cfgChanged = false;

        Set<BasicBlock> reachable = reachableBlocks(func);
        if (reachable.size() != func.blocks.size()) {
            for (BasicBlock block : new ArrayList<>(func.blocks)) {
                if (reachable.contains(block)) continue;
                for (BasicBlock succ : new LinkedHashSet<>(block.successors())) {
                    if (reachable.contains(succ)) IRUtils.removePhiIncoming(succ, block);
                }
                removed += block.getInsns().size();
                func.blocks.remove(block);
            }
            cfgChanged = true;
        }

        Map<Register, List<Insn>> defs = new HashMap<>();
        Set<Insn> live = new HashSet<>();
        Deque<Insn> work = new ArrayDeque<>();
        for (BasicBlock block : func.blocks) {
            for (Insn insn : block.getInsns()) {
                if (insn.getResult() != null) {
                    defs.computeIfAbsent(insn.getResult(), $ -> new ArrayList<>()).add(insn);
                }
                if (isRoot(insn) && live.add(insn)) {
                    work.push(insn);
                }
            }
        }
        while (!work.isEmpty()) {
            Insn insn = work.pop();
            for (Value arg : insn.args) {
                if (!(arg instanceof Register)) continue;
                for (Insn def : defs.getOrDefault(arg, Collections.emptyList())) {
                    if (live.add(def)) work.push(def);
                }
            }
        }

        for (BasicBlock block : func.blocks) {
            Iterator<Insn> iter = block.getInsns().iterator();
            while (iter.hasNext()) {
                Insn insn = iter.next();
                if (!live.contains(insn)) {
                    insn.assignTo(null);
                    iter.remove();
                    removed++;
                }
            }
        }

        if (removed == 0 && !cfgChanged) return false;
        OptimizationStats.of(func).add(OptimizationStats.Counter.REMOVED_INSNS, removed);
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        if (cfgChanged) {
            ms.graphChanged();
        } else {
            ms.varsChanged();
        }
        return true;
    }

    private static boolean isRoot(Insn insn) {
        return insn.isTerminator() || insn.hasSideEffects() || insn.mayTrap();
    }

    static Set<BasicBlock> reachableBlocks(Function func) {
        Set<BasicBlock> reached = new HashSet<>();
        if (func.blocks.isEmpty()) return reached;
        Deque<BasicBlock> work = new ArrayDeque<>();
        reached.add(func.entry());
        work.push(func.entry());
        while (!work.isEmpty()) {
            for (BasicBlock succ : work.pop().successors()) {
                if (reached.add(succ)) work.push(succ);
            }
        }
        return reached;
    }
}
