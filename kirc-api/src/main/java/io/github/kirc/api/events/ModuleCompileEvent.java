package io.github.kirc.api.events;

import io.github.kirc.api.ModuleCompilation;

/**
 * An event fired on a {@link ModuleCompilation}.
 */
public interface ModuleCompileEvent {
}
