package io.github.kirc.api;

import io.github.kirc.api.config.Backends;
import io.github.kirc.api.config.CompilerConfig;
import io.github.kirc.api.config.ConfigLoader;
import io.github.kirc.api.events.*;
import io.github.kirc.api.plugins.CodeGenPlugin;
import io.github.kirc.api.plugins.LintPass;
import io.github.kirc.api.plugins.TransformPass;
import io.github.kirc.core.ast.Program;
import io.github.kirc.core.backend.Backend;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * The compiler driver, through which programs are {@link #submit(Program) submitted} for compilation.
 * <p>
 * The backends named by the configuration are added on construction; more backends and plugins can be
 * added before compiling. If the configuration asks for more than one worker, the compiler owns a thread
 * pool that functions are optimized and allocated on, which {@link #close()} shuts down.
 */
public class KirCompiler extends EventSupplier<CompilerEvent> implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(KirCompiler.class);

    private final CompilerConfig config;
    @Nullable
    private final ExecutorService executor;
    private final List<Backend<?>> backends = new CopyOnWriteArrayList<>();
    private final List<LintPass> lints = new CopyOnWriteArrayList<>();
    private final List<TransformPass> transforms = new CopyOnWriteArrayList<>();
    private final List<CodeGenPlugin<?>> codeGens = new CopyOnWriteArrayList<>();

    /**
     * Construct a compiler configured from the classpath and system properties.
     *
     * @see ConfigLoader#load()
     */
    public KirCompiler() {
        this(ConfigLoader.load());
    }

    public KirCompiler(CompilerConfig config) {
        this.config = config;
        for (String name : config.backends) {
            backends.add(Backends.create(name, config));
        }
        if (config.workers > 1) {
            AtomicInteger count = new AtomicInteger();
            executor = Executors.newFixedThreadPool(config.workers, r -> {
                Thread thread = new Thread(r, "kirc-worker-" + count.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
        } else {
            executor = null;
        }
        LOGGER.debug("created compiler with {}", config);
    }

    public CompilerConfig getConfig() {
        return config;
    }

    @Nullable
    ExecutorService getExecutor() {
        return executor;
    }

    List<Backend<?>> getBackends() {
        return Collections.unmodifiableList(new ArrayList<>(backends));
    }

    List<LintPass> getLints() {
        return lints;
    }

    List<TransformPass> getTransforms() {
        return transforms;
    }

    List<CodeGenPlugin<?>> getCodeGens() {
        return codeGens;
    }

    public KirCompiler addBackend(Backend<?> backend) {
        backends.add(backend);
        return this;
    }

    public KirCompiler addLint(LintPass lint) {
        lints.add(lint);
        return this;
    }

    public KirCompiler addTransform(TransformPass transform) {
        transforms.add(transform);
        return this;
    }

    public KirCompiler addCodeGen(CodeGenPlugin<?> codeGen) {
        codeGens.add(codeGen);
        return this;
    }

    // it's not, but show a warning if the result is unused
    @Contract(pure = true)
    @NotNull
    public ModuleCompilation submit(Program program) {
        return new ModuleCompilation(this, program);
    }

    /**
     * Get a dispatcher which attaches listeners to every compilation this compiler runs.
     *
     * @return The dispatcher.
     */
    public EventDispatcher<ModuleCompileEvent> lift() {
        return new EventDispatcher<ModuleCompileEvent>() {
            @Override
            public <T extends ModuleCompileEvent> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
                KirCompiler.this.listen(RunModuleCompilationEvent.class, evt ->
                        evt.compilation.listen(eventClass, listener));
            }
        };
    }

    /**
     * Collect the outputs of every compilation into a queue.
     *
     * @return The queue of emitted outputs.
     */
    public BlockingQueue<EmitEvent> outputsAsQueue() {
        BlockingQueue<EmitEvent> queue = new LinkedBlockingQueue<>();
        lift().listen(EmitEvent.class, queue::add);
        return queue;
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
