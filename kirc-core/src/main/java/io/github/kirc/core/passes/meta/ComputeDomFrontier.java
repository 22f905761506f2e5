package io.github.kirc.core.passes.meta;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.MetadataState;
import io.github.kirc.core.passes.InPlaceIRPass;
import io.github.kirc.core.ssa.BasicBlock;
import io.github.kirc.core.ssa.Function;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Computes {@link CommonExts#DOM_FRONTIER} for each block.
 */
public class ComputeDomFrontier implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDomFrontier INSTANCE = new ComputeDomFrontier();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.DOMS, MetadataState.PREDS);

        // Cooper, Keith D.; Harvey, Timothy J.; Kennedy, Ken (2001). "A Simple, Fast Dominance Algorithm"
        for (BasicBlock block : func.blocks) {
            block.attachExt(CommonExts.DOM_FRONTIER, new LinkedHashSet<>());
        }
        for (BasicBlock block : func.blocks) {
            if (!ComputeDoms.isReachable(block)) continue;
            List<BasicBlock> preds = block.getExtOrThrow(CommonExts.PREDS);
            if (preds.size() < 2) continue;
            BasicBlock idom = block.getNullable(CommonExts.IDOM);
            for (BasicBlock pred : preds) {
                if (!ComputeDoms.isReachable(pred)) continue;
                BasicBlock runner = pred;
                while (runner != null && runner != idom) {
                    runner.getExtOrThrow(CommonExts.DOM_FRONTIER).add(block);
                    runner = runner.getNullable(CommonExts.IDOM);
                }
            }
        }

        ms.validate(MetadataState.DOM_FRONTIER);
    }
}
