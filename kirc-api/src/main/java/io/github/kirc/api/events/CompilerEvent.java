package io.github.kirc.api.events;

import io.github.kirc.api.KirCompiler;

/**
 * An event fired on a {@link KirCompiler}.
 */
public interface CompilerEvent {
}
