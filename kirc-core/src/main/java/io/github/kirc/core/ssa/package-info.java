/**
 * The KIR data model: {@link io.github.kirc.core.ssa.Module modules} own an arena of
 * {@link io.github.kirc.core.ssa.Function functions}, which own
 * {@link io.github.kirc.core.ssa.BasicBlock basic blocks} of
 * {@link io.github.kirc.core.ssa.Insn instructions} over
 * {@link io.github.kirc.core.ssa.Value values}.
 * <p>
 * Once promoted by {@link io.github.kirc.core.passes.form.Mem2Reg}, every
 * {@link io.github.kirc.core.ssa.Register} is defined by exactly one instruction,
 * and every use is dominated by that definition (phi operands are checked at the end
 * of their incoming block instead).
 */
package io.github.kirc.core.ssa;
