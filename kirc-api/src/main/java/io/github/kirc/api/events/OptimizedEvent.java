package io.github.kirc.api.events;

import io.github.kirc.core.pipeline.OptimizationStats;
import io.github.kirc.core.ssa.Module;
import org.jetbrains.annotations.NotNull;

/**
 * Fired once the pass manager has finished with the module, and transform plugins have run.
 * The module is still in SSA form.
 */
public class OptimizedEvent implements ModuleCompileEvent {
    @NotNull
    public final Module module;
    @NotNull
    public final OptimizationStats stats;

    public OptimizedEvent(@NotNull Module module, @NotNull OptimizationStats stats) {
        this.module = module;
        this.stats = stats;
    }
}
