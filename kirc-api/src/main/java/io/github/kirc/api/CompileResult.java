package io.github.kirc.api;

import io.github.kirc.core.diag.Diagnostic;
import io.github.kirc.core.pipeline.OptimizationStats;
import io.github.kirc.core.ssa.Module;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The outcome of a successful {@link ModuleCompilation}.
 */
public final class CompileResult {
    /**
     * The finished module; frozen if any backend requested allocation.
     */
    public final Module module;
    public final OptimizationStats stats;
    /**
     * The non-fatal findings of lint plugins.
     */
    public final List<Diagnostic> diagnostics;
    private final Map<String, Object> outputs;

    CompileResult(Module module, OptimizationStats stats, List<Diagnostic> diagnostics, Map<String, Object> outputs) {
        this.module = module;
        this.stats = stats;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    /**
     * Get every output, keyed by the name of the backend or plugin that produced it.
     *
     * @return The outputs, in the order they were produced.
     */
    public Map<String, Object> getOutputs() {
        return outputs;
    }

    /**
     * Get the output of a backend or plugin.
     *
     * @param producer The name of the backend or plugin.
     * @param type     The type of the output.
     * @param <T>      The type of the output.
     * @return The output, or null if there is none.
     * @throws ClassCastException If the output is not of that type.
     */
    @Nullable
    public <T> T getOutput(String producer, Class<T> type) {
        return type.cast(outputs.get(producer));
    }
}
