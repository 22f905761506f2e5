package io.github.kirc.api.config;

import io.github.kirc.core.backend.Backend;
import io.github.kirc.core.backend.TextualBridge;
import io.github.kirc.jvm.JvmBackend;

/**
 * The backends that can be selected by name in configuration.
 */
public final class Backends {
    public static final String LLVM_TEXT = "llvm-text";
    public static final String JVM = "jvm";

    private Backends() {
    }

    /**
     * Create a backend by name.
     *
     * @param name   The name of the backend.
     * @param config The configuration supplying its settings.
     * @return The backend.
     * @throws IllegalArgumentException If there is no backend with that name.
     */
    public static Backend<?> create(String name, CompilerConfig config) {
        switch (name) {
            case LLVM_TEXT:
                return new TextualBridge();
            case JVM:
                return new JvmBackend(config.jvmClassName, config.target);
            default:
                throw new IllegalArgumentException("unknown backend " + name);
        }
    }
}
