package io.github.kirc.api.config;

import io.github.kirc.core.pipeline.PipelineConfig;
import io.github.kirc.core.regalloc.TargetDesc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The settings of a {@link io.github.kirc.api.KirCompiler compiler driver}.
 */
public final class CompilerConfig {
    public final PipelineConfig pipeline;
    /**
     * The number of threads functions are optimized and allocated on; 1 compiles on the calling thread.
     */
    public final int workers;
    /**
     * The register description allocating backends are given.
     */
    public final TargetDesc target;
    /**
     * The names of the backends to dispatch to, in order.
     */
    public final List<String> backends;
    /**
     * The binary name of the class the JVM backend emits.
     */
    public final String jvmClassName;

    public CompilerConfig(PipelineConfig pipeline, int workers, TargetDesc target,
                          List<String> backends, String jvmClassName) {
        if (workers < 1) throw new IllegalArgumentException("workers must be positive, got " + workers);
        this.pipeline = pipeline;
        this.workers = workers;
        this.target = target;
        this.backends = Collections.unmodifiableList(new ArrayList<>(backends));
        this.jvmClassName = jvmClassName;
    }

    public static CompilerConfig defaults() {
        return new CompilerConfig(PipelineConfig.defaults(), 1, TargetDesc.x86_64(),
                Arrays.asList(Backends.LLVM_TEXT), "kirc.Module");
    }

    public CompilerConfig withPipeline(PipelineConfig pipeline) {
        return new CompilerConfig(pipeline, workers, target, backends, jvmClassName);
    }

    public CompilerConfig withWorkers(int workers) {
        return new CompilerConfig(pipeline, workers, target, backends, jvmClassName);
    }

    public CompilerConfig withTarget(TargetDesc target) {
        return new CompilerConfig(pipeline, workers, target, backends, jvmClassName);
    }

    public CompilerConfig withBackends(String... backends) {
        return new CompilerConfig(pipeline, workers, target, Arrays.asList(backends), jvmClassName);
    }

    @Override
    public String toString() {
        return String.format("CompilerConfig{%s, workers=%d, target=%s, backends=%s}",
                pipeline, workers, target, backends);
    }
}
