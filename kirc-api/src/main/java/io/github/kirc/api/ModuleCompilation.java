package io.github.kirc.api;

import io.github.kirc.api.events.*;
import io.github.kirc.api.plugins.CodeGenPlugin;
import io.github.kirc.api.plugins.LintPass;
import io.github.kirc.api.plugins.TransformPass;
import io.github.kirc.core.ast.Program;
import io.github.kirc.core.backend.AllocatedModule;
import io.github.kirc.core.backend.Backend;
import io.github.kirc.core.diag.Diagnostic;
import io.github.kirc.core.diag.KirException;
import io.github.kirc.core.passes.convert.AstToKir;
import io.github.kirc.core.passes.meta.Verify;
import io.github.kirc.core.pipeline.OptimizationStats;
import io.github.kirc.core.pipeline.PassManager;
import io.github.kirc.core.pipeline.Passes;
import io.github.kirc.core.regalloc.TargetDesc;
import io.github.kirc.core.ssa.Function;
import io.github.kirc.core.ssa.Module;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;

/**
 * The compilation of a single program.
 * <p>
 * Compilation, performed when {@link #run()} is called, takes place as follows:
 * <ol>
 *     <li>{@link RunModuleCompilationEvent} is fired on the {@link KirCompiler compiler}.</li>
 *     <li>The program is {@link AstToKir lowered to KIR} and verified.</li>
 *     <li>{@link LintPass Lint plugins} inspect the module.</li>
 *     <li>{@link ModuleLoweredEvent} is fired.</li>
 *     <li>Every function is {@link Passes#TO_SSA promoted to SSA form}, and the module verified again.</li>
 *     <li>{@link SsaConstructedEvent} is fired.</li>
 *     <li>The {@link PassManager pass manager} optimizes the module, then {@link TransformPass transform plugins} run.</li>
 *     <li>{@link OptimizedEvent} is fired.</li>
 *     <li>Backends consuming SSA emit their outputs.</li>
 *     <li>If any backend wants allocated code, registers are allocated and {@link AllocatedEvent} is fired,
 *     then those backends emit their outputs.</li>
 *     <li>{@link CodeGenPlugin Code generation plugins} emit their outputs.</li>
 * </ol>
 * {@link EmitEvent} is fired for every output.
 * <p>
 * A compilation can be {@link #cancel() cancelled} from another thread. It then stops at the
 * next boundary between two passes or stages by throwing a {@link CancellationException}.
 */
public class ModuleCompilation extends EventSupplier<ModuleCompileEvent> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModuleCompilation.class);

    private final KirCompiler cc;
    private volatile boolean cancelled = false;

    /**
     * The program being compiled.
     */
    @NotNull
    public final Program program;

    ModuleCompilation(KirCompiler cc, @NotNull Program program) {
        this.cc = cc;
        this.program = program;
    }

    /**
     * Request that this compilation stop.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    private void checkCancelled(String stage) {
        if (cancelled || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("compile cancelled before " + stage);
        }
    }

    /**
     * Run the compilation.
     * <p>
     * See the documentation of this class for details.
     *
     * @return The result.
     * @throws KirException          If the compile fails with a fatal diagnostic.
     * @throws CancellationException If the compile was cancelled.
     */
    public CompileResult run() {
        try {
            return doRun();
        } catch (KirException e) {
            LOGGER.error("compile failed: {}", e.getDiagnostic());
            throw e;
        }
    }

    private CompileResult doRun() {
        cc.dispatch(RunModuleCompilationEvent.class, new RunModuleCompilationEvent(this));
        ExecutorService executor = cc.getExecutor();

        long start = System.nanoTime();
        Module module = AstToKir.INSTANCE.run(program);
        Verify.INSTANCE.run(module);
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (LintPass lint : cc.getLints()) {
            List<Diagnostic> found = lint.lint(module);
            for (Diagnostic diagnostic : found) {
                LOGGER.warn("{}: {}", lint.name(), diagnostic);
            }
            diagnostics.addAll(found);
        }
        module = dispatch(ModuleLoweredEvent.class, new ModuleLoweredEvent(module)).module;
        start = logStage("lowering", start);

        checkCancelled("SSA construction");
        for (Function func : module.getFunctions()) {
            if (!func.isDeclaration()) Passes.TO_SSA.run(func);
        }
        Verify.INSTANCE.run(module);
        module = dispatch(SsaConstructedEvent.class, new SsaConstructedEvent(module)).module;
        start = logStage("SSA construction", start);

        checkCancelled("optimization");
        PassManager passManager = new PassManager(cc.getConfig().pipeline, this::isCancelled);
        OptimizationStats stats = passManager.run(module, executor);
        for (TransformPass transform : cc.getTransforms()) {
            checkCancelled(transform.name());
            module = transform.transform(module);
            Verify.INSTANCE.run(module);
        }
        dispatch(OptimizedEvent.class, new OptimizedEvent(module, stats));
        start = logStage("optimization", start);

        Map<String, Object> outputs = new LinkedHashMap<>();
        List<Backend<?>> allocating = new ArrayList<>();
        AllocatedModule finished = AllocatedModule.ssa(module);
        for (Backend<?> backend : cc.getBackends()) {
            if (backend.target() == null) {
                checkCancelled(backend.name());
                emit(outputs, backend.name(), backend.emit(finished));
            } else {
                allocating.add(backend);
            }
        }
        if (!allocating.isEmpty()) {
            checkCancelled("register allocation");
            TargetDesc target = allocationTarget(allocating);
            finished = AllocatedModule.allocate(module, target, executor);
            dispatch(AllocatedEvent.class, new AllocatedEvent(finished));
            start = logStage("register allocation", start);
            for (Backend<?> backend : allocating) {
                checkCancelled(backend.name());
                emit(outputs, backend.name(), backend.emit(finished));
            }
        }
        for (CodeGenPlugin<?> plugin : cc.getCodeGens()) {
            checkCancelled(plugin.name());
            emit(outputs, plugin.name(), plugin.generate(finished));
        }
        logStage("emission", start);
        return new CompileResult(module, stats, diagnostics, outputs);
    }

    private static TargetDesc allocationTarget(List<Backend<?>> allocating) {
        TargetDesc target = Objects.requireNonNull(allocating.get(0).target());
        for (Backend<?> backend : allocating) {
            TargetDesc other = Objects.requireNonNull(backend.target());
            if (!other.name.equals(target.name)) {
                throw new IllegalStateException(String.format(
                        "backends %s and %s want different targets %s and %s",
                        allocating.get(0).name(), backend.name(), target, other));
            }
        }
        return target;
    }

    private void emit(Map<String, Object> outputs, String producer, @Nullable Object output) {
        if (output == null) return;
        EmitEvent event = dispatch(EmitEvent.class, new EmitEvent(producer, output));
        if (!event.isCancelled()) {
            outputs.put(producer, event.output);
        }
    }

    private static long logStage(String stage, long start) {
        long now = System.nanoTime();
        LOGGER.debug("{} took {} ms", stage, (now - start) / 1_000_000);
        return now;
    }
}
