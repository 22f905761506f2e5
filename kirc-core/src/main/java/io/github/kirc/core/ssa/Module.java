package io.github.kirc.core.ssa;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A compilation unit: an arena of {@link Function}s indexed by id, plus global symbols.
 * <p>
 * Calls refer to functions by name, so call graphs (including recursive ones)
 * never nest functions inside one another.
 */
public final class Module extends ExtHolder {
    private final List<Function> functions = new ArrayList<>();
    private final Map<String, Integer> byName = new LinkedHashMap<>();
    private final Map<String, Global> globals = new LinkedHashMap<>();

    /**
     * Create a new function in this module.
     *
     * @param name      The function's name, unique in this module.
     * @param signature The signature.
     * @return The new function, with no blocks.
     */
    public Function newFunction(String name, Signature signature) {
        if (byName.containsKey(name)) {
            throw new IllegalArgumentException("duplicate function name " + name);
        }
        Function func = new Function(functions.size(), name, signature);
        func.attachExt(CommonExts.OWNING_MODULE, this);
        functions.add(func);
        byName.put(name, func.id);
        return func;
    }

    public Global addGlobal(Global global) {
        if (globals.containsKey(global.name)) {
            throw new IllegalArgumentException("duplicate global name " + global.name);
        }
        globals.put(global.name, global);
        return global;
    }

    @Nullable
    public Function getFunction(String name) {
        Integer id = byName.get(name);
        return id == null ? null : functions.get(id);
    }

    public Function getFunction(int id) {
        return functions.get(id);
    }

    /**
     * Get the functions of this module, in insertion (id) order.
     *
     * @return An unmodifiable view of the functions.
     */
    public List<Function> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    @Nullable
    public Global getGlobal(String name) {
        return globals.get(name);
    }

    public Collection<Global> getGlobals() {
        return Collections.unmodifiableCollection(globals.values());
    }

    public void freeze() {
        for (Function function : functions) {
            function.freeze();
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Global global : globals.values()) {
            sb.append(global).append('\n');
        }
        for (Function function : functions) {
            sb.append(function).append('\n');
        }
        return sb.toString();
    }
}
