package io.github.kirc.api.events;

import io.github.kirc.core.ssa.Module;
import org.jetbrains.annotations.NotNull;

/**
 * Fired once the program has been lowered to KIR and verified, before SSA construction.
 * Listeners may replace the module.
 */
public class ModuleLoweredEvent implements ModuleCompileEvent {
    @NotNull
    public Module module;

    public ModuleLoweredEvent(@NotNull Module module) {
        this.module = module;
    }
}
