package io.github.kirc.core.pipeline;

import io.github.kirc.core.diag.KirException;
import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.passes.meta.InferPurity;
import io.github.kirc.core.passes.meta.Verify;
import io.github.kirc.core.ssa.BasicBlock;
import io.github.kirc.core.ssa.Function;
import io.github.kirc.core.ssa.Insn;
import io.github.kirc.core.ssa.Module;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.BooleanSupplier;

/**
 * Runs an ordered list of {@link FunctionPass}es over the functions of a module.
 * <p>
 * The whole list is repeated in rounds until a round changes nothing or the iteration budget
 * of the {@link PipelineConfig} is spent. Within a round the passes keep their configured order.
 * A pass that {@link FunctionPass#readsOtherFunctions() reads other functions} runs over every
 * function on the calling thread, callees before callers, so a callee that shrank in an earlier
 * round can still be inlined. Consecutive passes that only touch their own function run on each
 * function independently, in parallel if an {@link ExecutorService} is given.
 * <p>
 * A compile can only be cancelled between two passes, by throwing a {@link CancellationException}.
 */
public class PassManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(PassManager.class);

    private final PipelineConfig config;
    private final BooleanSupplier cancelled;

    public PassManager(PipelineConfig config) {
        this(config, () -> false);
    }

    /**
     * Construct a pass manager.
     *
     * @param config    The configuration.
     * @param cancelled Polled between passes; once it returns true the run is abandoned.
     */
    public PassManager(PipelineConfig config, BooleanSupplier cancelled) {
        this.config = config;
        this.cancelled = cancelled;
    }

    public PipelineConfig getConfig() {
        return config;
    }

    /**
     * Optimize every defined function of a module on the calling thread.
     *
     * @param module The module.
     * @return The aggregated statistics, also attached to the module.
     */
    public OptimizationStats run(Module module) {
        return run(module, null);
    }

    /**
     * Optimize every defined function of a module.
     *
     * @param module   The module.
     * @param executor The executor to optimize functions on in parallel, or null to use the calling thread.
     * @return The aggregated statistics, also attached to the module.
     */
    public OptimizationStats run(Module module, @Nullable ExecutorService executor) {
        OptimizationStats total = new OptimizationStats();
        module.attachExt(CommonExts.OPT_STATS, total);

        List<FunctionPass> passes = config.passes();
        if (passes.isEmpty() || config.maxRounds == 0) {
            LOGGER.debug("no optimization passes to run");
            return total;
        }
        List<List<FunctionPass>> segments = segments(passes);

        List<Function> functions = new ArrayList<>();
        for (Function func : bottomUp(module)) {
            if (func.isDeclaration()) continue;
            func.attachExt(CommonExts.OPT_STATS, new OptimizationStats());
            functions.add(func);
        }

        int round = 1;
        for (; round <= config.maxRounds; round++) {
            // purity only changes here, never while functions are optimized in parallel
            InferPurity.INSTANCE.run(module);
            boolean changed = false;
            for (List<FunctionPass> segment : segments) {
                if (segment.get(0).readsOtherFunctions()) {
                    for (Function func : functions) {
                        changed |= runPasses(func, segment);
                    }
                    InferPurity.INSTANCE.run(module);
                } else {
                    changed |= runLocal(functions, segment, executor);
                }
            }
            for (Function func : functions) {
                OptimizationStats.of(func).add(OptimizationStats.Counter.ROUNDS, 1);
            }
            if (!changed) {
                LOGGER.debug("reached a fixpoint after {} rounds", round);
                break;
            }
            LOGGER.debug("round {} changed the module", round);
        }
        if (round > config.maxRounds) {
            LOGGER.debug("used up the budget of {} rounds", config.maxRounds);
        }

        for (Function func : functions) {
            total.merge(func.getExtOrThrow(CommonExts.OPT_STATS));
            func.removeExt(CommonExts.OPT_STATS);
        }
        LOGGER.debug("optimized {} functions: {}", functions.size(), total);
        return total;
    }

    /**
     * Split a pass list into maximal runs of passes that either all read other functions or all do not.
     */
    private static List<List<FunctionPass>> segments(List<FunctionPass> passes) {
        List<List<FunctionPass>> segments = new ArrayList<>();
        List<FunctionPass> current = null;
        for (FunctionPass pass : passes) {
            if (current == null || current.get(0).readsOtherFunctions() != pass.readsOtherFunctions()) {
                current = new ArrayList<>();
                segments.add(current);
            }
            current.add(pass);
        }
        return segments;
    }

    private boolean runLocal(List<Function> functions, List<FunctionPass> passes, @Nullable ExecutorService executor) {
        boolean changed = false;
        if (executor == null) {
            for (Function func : functions) {
                changed |= runPasses(func, passes);
            }
            return changed;
        }
        List<Future<Boolean>> futures = new ArrayList<>();
        for (Function func : functions) {
            futures.add(executor.submit(() -> runPasses(func, passes)));
        }
        for (Boolean result : join(futures)) {
            changed |= result;
        }
        return changed;
    }

    private static <T> List<T> join(List<Future<T>> futures) {
        List<T> results = new ArrayList<>();
        RuntimeException failure = null;
        for (Future<T> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (Future<?> other : futures) other.cancel(true);
                throw new CancellationException("interrupted while optimizing");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                RuntimeException thrown = cause instanceof RuntimeException
                        ? (RuntimeException) cause
                        : new IllegalStateException(cause);
                if (failure == null) {
                    failure = thrown;
                } else if (failure != thrown) {
                    failure.addSuppressed(thrown);
                }
            }
        }
        if (failure != null) throw failure;
        return results;
    }

    /**
     * Run passes over one function once, in order.
     *
     * @param func   The function.
     * @param passes The passes.
     * @return Whether anything changed.
     */
    public boolean runPasses(Function func, List<FunctionPass> passes) {
        boolean changed = false;
        for (FunctionPass pass : passes) {
            changed |= runPass(pass, func);
        }
        return changed;
    }

    private boolean runPass(FunctionPass pass, Function func) {
        if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("compile cancelled before " + pass.name() + " on " + func.name);
        }
        boolean changed = pass.run(func);
        if (changed && config.verify) {
            try {
                Verify.INSTANCE.verifyFunction(func);
            } catch (KirException e) {
                e.addSuppressed(new RuntimeException("after pass " + pass.name()));
                throw e;
            }
        }
        return changed;
    }

    /**
     * Order the functions of a module so that callees come before their callers,
     * breaking cycles arbitrarily.
     *
     * @param module The module.
     * @return The functions, callees first.
     */
    public static List<Function> bottomUp(Module module) {
        List<Function> order = new ArrayList<>();
        Set<Function> visited = new HashSet<>();
        for (Function root : module.getFunctions()) {
            if (visited.contains(root)) continue;
            // iterative postorder over the call graph
            Deque<Iterator<Function>> stack = new ArrayDeque<>();
            Deque<Function> path = new ArrayDeque<>();
            visited.add(root);
            path.push(root);
            stack.push(callees(module, root).iterator());
            while (!stack.isEmpty()) {
                Iterator<Function> it = stack.peek();
                if (it.hasNext()) {
                    Function next = it.next();
                    if (visited.add(next)) {
                        path.push(next);
                        stack.push(callees(module, next).iterator());
                    }
                } else {
                    stack.pop();
                    order.add(path.pop());
                }
            }
        }
        return order;
    }

    private static Set<Function> callees(Module module, Function func) {
        Set<Function> callees = new LinkedHashSet<>();
        for (BasicBlock block : func.blocks) {
            for (Insn insn : block.getInsns()) {
                if (insn.op == Opcode.CALL) {
                    Function callee = module.getFunction(insn.getCallee());
                    if (callee != null) callees.add(callee);
                }
            }
        }
        return callees;
    }
}
