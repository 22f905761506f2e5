package io.github.kirc.core.passes.opts;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.pipeline.FunctionPass;
import io.github.kirc.core.pipeline.OptimizationStats;
import io.github.kirc.core.ssa.*;
import io.github.kirc.core.ssa.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A pass which inlines calls to small functions, and to functions marked inline.
 * <p>
 * Calls copied in by inlining remember the ids of the functions they were copied through,
 * in {@link CommonExts#INLINE_CHAIN}. A call back into the function being optimized, into a
 * function already on its chain, or past the depth limit is refused, and left as a call.
 */
public class Inline implements FunctionPass {
    private static final Logger LOGGER = LoggerFactory.getLogger(Inline.class);

    private final int threshold;
    private final int maxDepth;

    /**
     * Construct an inlining pass.
     *
     * @param threshold Callees with fewer instructions than this are inlined.
     * @param maxDepth  The maximum length of an inlining chain.
     */
    public Inline(int threshold, int maxDepth) {
        this.threshold = threshold;
        this.maxDepth = maxDepth;
    }

    @Override
    public boolean readsOtherFunctions() {
        return true;
    }

    @Override
    public Boolean run(Function func) {
        Module module = func.getExtOrThrow(CommonExts.OWNING_MODULE);
        Set<Insn> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        int inlined = 0;
        boolean progress = true;
        while (progress) {
            progress = false;
            for (Insn call : findCalls(func)) {
                if (!seen.add(call)) continue;
                Function callee = module.getFunction(call.getCallee());
                if (callee == null || callee.isDeclaration()) continue;
                if (!callee.inline && callee.insnCount() >= threshold) continue;
                if (refuse(func, call, callee)) continue;

                new Inliner(func).inline(call, callee);
                inlined++;
                // blocks were split, so rescan
                progress = true;
                break;
            }
        }
        if (inlined == 0) return false;
        OptimizationStats.of(func).add(OptimizationStats.Counter.INLINED_CALLS, inlined);
        return true;
    }

    private boolean refuse(Function func, Insn call, Function callee) {
        Set<Integer> chain = call.getExt(CommonExts.INLINE_CHAIN).orElse(Collections.emptySet());
        String reason;
        if (callee == func) {
            reason = "it is recursive";
        } else if (chain.contains(callee.id)) {
            reason = "it is already on the inlining chain";
        } else if (chain.size() >= maxDepth) {
            reason = String.format("the inlining chain is at the depth limit of %d", maxDepth);
        } else {
            return false;
        }
        LOGGER.debug("not inlining {} into {}: {}", callee.name, func.name, reason);
        return true;
    }

    private static List<Insn> findCalls(Function func) {
        List<Insn> calls = new ArrayList<>();
        for (BasicBlock block : func.blocks) {
            for (Insn insn : block.getInsns()) {
                if (insn.op == Opcode.CALL) calls.add(insn);
            }
        }
        return calls;
    }
}
