package io.github.kirc.core.backend;

import io.github.kirc.core.regalloc.TargetDesc;
import org.jetbrains.annotations.Nullable;

/**
 * A backend consuming a finished module.
 * <p>
 * A backend with a {@link #target() target} consumes the module after register allocation
 * for that target, through {@link AllocatedModule#walk}. A backend without one does its own
 * allocation, and consumes the module still in SSA form.
 *
 * @param <R> The output of the backend.
 */
public interface Backend<R> {
    String name();

    /**
     * Get the register description this backend wants the module allocated for.
     *
     * @return The target, or null if this backend consumes SSA.
     */
    @Nullable
    TargetDesc target();

    /**
     * Emit the module.
     *
     * @param input The module, allocated if this backend has a {@link #target()}.
     * @return The output.
     */
    R emit(AllocatedModule input);
}
