package io.github.kirc.api.events;

import io.github.kirc.core.backend.AllocatedModule;
import org.jetbrains.annotations.NotNull;

/**
 * Fired once registers have been allocated, before the allocated module is dispatched to backends.
 * The functions of the module are frozen.
 */
public class AllocatedEvent implements ModuleCompileEvent {
    @NotNull
    public final AllocatedModule allocated;

    public AllocatedEvent(@NotNull AllocatedModule allocated) {
        this.allocated = allocated;
    }
}
