package io.github.kirc.api.plugins;

import io.github.kirc.core.backend.AllocatedModule;

/**
 * A plugin which produces an extra output from a finished module, after every backend has run.
 * <p>
 * It receives the allocated module if any backend requested allocation, otherwise the SSA module.
 * Either way the module must not be modified.
 *
 * @param <R> The type of output.
 */
public interface CodeGenPlugin<R> {
    String name();

    R generate(AllocatedModule finished);
}
