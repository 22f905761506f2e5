package io.github.kirc.api.plugins;

import io.github.kirc.core.diag.Diagnostic;
import io.github.kirc.core.ssa.Module;

import java.util.List;

/**
 * A plugin which inspects a freshly lowered module and reports findings without modifying it.
 * <p>
 * Findings are collected into the compile result; they never stop a compile.
 */
public interface LintPass {
    String name();

    /**
     * Inspect a module.
     *
     * @param module The verified module, before SSA construction.
     * @return The findings, usually of {@link io.github.kirc.core.diag.Category#LINT category LINT}.
     */
    List<Diagnostic> lint(Module module);
}
