package io.github.kirc.core.passes.meta;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.MetadataState;
import io.github.kirc.core.passes.InPlaceIRPass;
import io.github.kirc.core.ssa.BasicBlock;
import io.github.kirc.core.ssa.Function;

import java.util.ArrayList;
import java.util.LinkedHashSet;

/**
 * Computes {@link CommonExts#PREDS} for each block.
 * <p>
 * Predecessors are listed once each, in block order, which fixes the operand order of phis.
 */
public class ComputePreds implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);

        for (BasicBlock block : func.blocks) {
            block.attachExt(CommonExts.PREDS, new ArrayList<>());
        }
        for (BasicBlock block : func.blocks) {
            for (BasicBlock target : new LinkedHashSet<>(block.successors())) {
                // successors outside the function are left for the verifier to report
                if (target.getNullable(CommonExts.OWNING_FUNCTION) != func) continue;
                target.getExtOrThrow(CommonExts.PREDS).add(block);
            }
        }

        ms.validate(MetadataState.PREDS);
    }
}
