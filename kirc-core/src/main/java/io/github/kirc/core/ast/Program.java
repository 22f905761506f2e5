package io.github.kirc.core.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A fully type-checked program, as handed over by the front end.
 */
public final class Program {
    public final List<GlobalDecl> globals;
    public final List<FunctionDecl> functions;

    public Program(List<GlobalDecl> globals, List<FunctionDecl> functions) {
        this.globals = Collections.unmodifiableList(new ArrayList<>(globals));
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
    }

    public static Program of(FunctionDecl... functions) {
        List<FunctionDecl> list = new ArrayList<>();
        Collections.addAll(list, functions);
        return new Program(Collections.emptyList(), list);
    }
}
