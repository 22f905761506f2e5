package io.github.kirc.api.plugins;

import io.github.kirc.core.ssa.Module;

/**
 * A plugin which rewrites a module after the core optimization pipeline.
 * <p>
 * The module it receives and the module it returns are in SSA form, and the returned module is
 * verified before it moves on to allocation.
 */
public interface TransformPass {
    String name();

    Module transform(Module module);
}
