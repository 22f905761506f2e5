package io.github.kirc.api.events;

import io.github.kirc.core.ssa.Module;
import org.jetbrains.annotations.NotNull;

/**
 * Fired once every function of the module has been promoted to SSA form and verified.
 */
public class SsaConstructedEvent implements ModuleCompileEvent {
    @NotNull
    public Module module;

    public SsaConstructedEvent(@NotNull Module module) {
        this.module = module;
    }
}
