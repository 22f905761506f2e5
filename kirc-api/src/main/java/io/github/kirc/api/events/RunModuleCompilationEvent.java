package io.github.kirc.api.events;

import io.github.kirc.api.KirCompiler;
import io.github.kirc.api.ModuleCompilation;

/**
 * Fired on the {@link KirCompiler} when one of its compilations starts running,
 * so that listeners can be attached to it.
 */
public class RunModuleCompilationEvent implements CompilerEvent {
    public final ModuleCompilation compilation;

    public RunModuleCompilationEvent(ModuleCompilation compilation) {
        this.compilation = compilation;
    }
}
