package io.github.kirc.core.pipeline;

import io.github.kirc.core.passes.IRPass;
import io.github.kirc.core.passes.InPlaceIRPass;
import io.github.kirc.core.ssa.Function;

/**
 * An optimization pass over a single function, reporting whether it changed anything.
 * <p>
 * Passes never talk to each other except through the functions they mutate.
 */
public interface FunctionPass extends IRPass<Function, Boolean> {
    /**
     * Whether this pass reads functions other than the one it is run on.
     * <p>
     * Such passes are run once per function, sequentially, callees before callers,
     * before the rest of the passes run on functions independently.
     *
     * @return Whether this pass reads other functions.
     */
    default boolean readsOtherFunctions() {
        return false;
    }

    /**
     * View this as an in-place pass, discarding whether it changed anything.
     *
     * @return The in-place pass.
     */
    default InPlaceIRPass<Function> asInPlace() {
        return this::run;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
