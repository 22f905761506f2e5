package io.github.kirc.core.pipeline;

import io.github.kirc.core.passes.IRPass;
import io.github.kirc.core.passes.form.LowerPhis;
import io.github.kirc.core.passes.form.Mem2Reg;
import io.github.kirc.core.passes.opts.*;
import io.github.kirc.core.ssa.Function;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Some pre-composed passes.
 */
public class Passes {
    /**
     * Passes turning freshly lowered IR into SSA form.
     */
    public static final IRPass<Function, Function> TO_SSA = Mem2Reg.INSTANCE;

    /**
     * Passes that must run before register allocation.
     */
    public static final IRPass<Function, Function> PRE_ALLOCATION =
            EliminateDeadCode.INSTANCE.asInPlace()
                    .then(LowerPhis.INSTANCE);

    /**
     * Get the optimization passes of a configuration's optimization level.
     *
     * @param config The configuration, supplying the limits of the passes.
     * @return The ordered passes.
     */
    public static List<FunctionPass> forLevel(PipelineConfig config) {
        switch (config.optLevel) {
            case NONE:
                return Collections.emptyList();
            case LESS:
                return Arrays.asList(
                        ConstantFolding.INSTANCE,
                        CopyPropagation.INSTANCE,
                        EliminateDeadCode.INSTANCE
                );
            case DEFAULT:
            case AGGRESSIVE:
                return new ArrayList<>(Arrays.asList(
                        new Inline(config.inlineThreshold, config.inlineDepth),
                        ConstantFolding.INSTANCE,
                        CopyPropagation.INSTANCE,
                        CommonSubexpressionElimination.INSTANCE,
                        new UnrollLoops(config.unrollTripCap, config.unrollSizeCap),
                        CollapseJumps.INSTANCE,
                        EliminateDeadCode.INSTANCE
                ));
            default:
                throw new IllegalStateException("unhandled level " + config.optLevel);
        }
    }
}
