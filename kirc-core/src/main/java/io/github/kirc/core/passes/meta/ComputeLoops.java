package io.github.kirc.core.passes.meta;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.CommonExts.Loop;
import io.github.kirc.core.ext.MetadataState;
import io.github.kirc.core.passes.InPlaceIRPass;
import io.github.kirc.core.ssa.BasicBlock;
import io.github.kirc.core.ssa.Function;

import java.util.*;

/**
 * Finds the natural loops of a function, storing them in {@link CommonExts#LOOPS}
 * in the block order of their headers.
 * <p>
 * Back edges sharing a header are merged into one loop.
 */
public class ComputeLoops implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeLoops INSTANCE = new ComputeLoops();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS, MetadataState.DOMS);

        Map<BasicBlock, Loop> byHeader = new LinkedHashMap<>();
        for (BasicBlock header : func.blocks) {
            if (!ComputeDoms.isReachable(header)) continue;
            for (BasicBlock pred : header.getExtOrThrow(CommonExts.PREDS)) {
                if (!ComputeDoms.dominates(header, pred)) continue;
                Loop loop = byHeader.computeIfAbsent(header, Loop::new);
                loop.latches.add(pred);
                collectBody(loop, pred);
            }
        }

        func.attachExt(CommonExts.LOOPS, new ArrayList<>(byHeader.values()));
        ms.validate(MetadataState.LOOPS);
    }

    private static void collectBody(Loop loop, BasicBlock latch) {
        loop.body.add(loop.header);
        Deque<BasicBlock> work = new ArrayDeque<>();
        if (loop.body.add(latch)) work.push(latch);
        while (!work.isEmpty()) {
            BasicBlock block = work.pop();
            for (BasicBlock pred : block.getExtOrThrow(CommonExts.PREDS)) {
                if (ComputeDoms.isReachable(pred) && loop.body.add(pred)) {
                    work.push(pred);
                }
            }
        }
    }

    /**
     * Whether a loop contains no other loop.
     *
     * @param loop  The loop.
     * @param loops All loops of its function.
     * @return Whether the loop is innermost.
     */
    public static boolean isInnermost(Loop loop, List<Loop> loops) {
        for (Loop other : loops) {
            if (other != loop && loop.contains(other.header)) return false;
        }
        return true;
    }
}
