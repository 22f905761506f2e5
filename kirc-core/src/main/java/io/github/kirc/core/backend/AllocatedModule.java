package io.github.kirc.core.backend;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.passes.IRPass;
import io.github.kirc.core.pipeline.Passes;
import io.github.kirc.core.regalloc.Allocation;
import io.github.kirc.core.regalloc.LinearScan;
import io.github.kirc.core.regalloc.Location;
import io.github.kirc.core.regalloc.TargetDesc;
import io.github.kirc.core.ssa.*;
import io.github.kirc.core.ssa.Module;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.concurrent.*;

/**
 * A module together with the register allocation of each of its defined functions.
 * <p>
 * Once allocated, the functions are frozen and only ever read again.
 * An unallocated instance wraps a module still in SSA form, for backends which do their own allocation.
 */
public final class AllocatedModule {
    public final Module module;
    @Nullable
    public final TargetDesc target;
    private final Map<Function, Allocation> allocations;

    private AllocatedModule(Module module, @Nullable TargetDesc target, Map<Function, Allocation> allocations) {
        this.module = module;
        this.target = target;
        this.allocations = allocations;
    }

    /**
     * Wrap a module without allocating it.
     *
     * @param module The module.
     * @return The unallocated module.
     */
    public static AllocatedModule ssa(Module module) {
        return new AllocatedModule(module, null, Collections.emptyMap());
    }

    /**
     * Allocate every defined function of a module on the calling thread.
     *
     * @param module The module.
     * @param target The target description.
     * @return The allocated module.
     */
    public static AllocatedModule allocate(Module module, TargetDesc target) {
        return allocate(module, target, null);
    }

    /**
     * Allocate every defined function of a module, after {@link Passes#PRE_ALLOCATION} has
     * removed dead code and lowered phis.
     *
     * @param module   The module.
     * @param target   The target description.
     * @param executor The executor to allocate functions on in parallel, or null to use the calling thread.
     * @return The allocated module.
     */
    public static AllocatedModule allocate(Module module, TargetDesc target, @Nullable ExecutorService executor) {
        IRPass<Function, Allocation> scan = Passes.PRE_ALLOCATION.then(new LinearScan(target));
        Map<Function, Allocation> allocations = new LinkedHashMap<>();
        if (executor == null) {
            for (Function func : module.getFunctions()) {
                if (!func.isDeclaration()) allocations.put(func, scan.run(func));
            }
        } else {
            Map<Function, Future<Allocation>> futures = new LinkedHashMap<>();
            for (Function func : module.getFunctions()) {
                if (!func.isDeclaration()) futures.put(func, executor.submit(() -> scan.run(func)));
            }
            for (Map.Entry<Function, Future<Allocation>> entry : futures.entrySet()) {
                try {
                    allocations.put(entry.getKey(), entry.getValue().get());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("interrupted while allocating");
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException) throw (RuntimeException) cause;
                    throw new IllegalStateException(cause);
                }
            }
        }
        module.freeze();
        return new AllocatedModule(module, target, allocations);
    }

    public boolean isAllocated() {
        return target != null;
    }

    /**
     * Get the allocation of a function.
     *
     * @param func The function.
     * @return The allocation.
     * @throws IllegalStateException If the function was not allocated.
     */
    public Allocation allocationOf(Function func) {
        Allocation allocation = allocations.get(func);
        if (allocation == null) {
            allocation = func.getNullable(CommonExts.ALLOCATION);
        }
        if (allocation == null) throw new IllegalStateException("function " + func.name + " is not allocated");
        return allocation;
    }

    /**
     * Walk the module: every global, then every defined function's blocks in order,
     * and their instructions in order, each with the locations of its result and operands.
     *
     * @param walker The walker.
     */
    public void walk(Walker walker) {
        for (Global global : module.getGlobals()) {
            walker.visitGlobal(global);
        }
        for (Function func : module.getFunctions()) {
            if (func.isDeclaration()) {
                walker.visitDeclaration(func);
                continue;
            }
            Allocation allocation = isAllocated() ? allocationOf(func) : null;
            walker.enterFunction(func, allocation);
            for (BasicBlock block : func.blocks) {
                walker.enterBlock(block);
                for (Insn insn : block.getInsns()) {
                    Location result = null;
                    List<Location> operands = new ArrayList<>(insn.args.size());
                    if (allocation != null) {
                        Register reg = insn.getResult();
                        result = reg == null ? null : allocation.locationOf(reg);
                        for (Value arg : insn.args) {
                            operands.add(allocation.locationOf(arg));
                        }
                    } else {
                        for (int i = 0; i < insn.args.size(); i++) operands.add(null);
                    }
                    walker.visitInsn(insn, result, Collections.unmodifiableList(operands));
                }
            }
            walker.exitFunction(func);
        }
        walker.visitEnd();
    }

    /**
     * A read-only walk over an {@link AllocatedModule}.
     */
    public interface Walker {
        default void visitGlobal(Global global) {
        }

        default void visitDeclaration(Function func) {
        }

        /**
         * Visit a defined function.
         *
         * @param func       The function.
         * @param allocation Its allocation, or null if the module is in SSA form.
         */
        void enterFunction(Function func, @Nullable Allocation allocation);

        default void enterBlock(BasicBlock block) {
        }

        /**
         * Visit an instruction.
         *
         * @param insn     The instruction.
         * @param result   The location of its result, or null if it has none or the module is unallocated.
         * @param operands The location of each operand, null for non-registers.
         */
        void visitInsn(Insn insn, @Nullable Location result, List<@Nullable Location> operands);

        default void exitFunction(Function func) {
        }

        default void visitEnd() {
        }
    }
}
