package io.github.kirc.core.ast;

import io.github.kirc.core.ssa.Type;
import org.jetbrains.annotations.Nullable;

/**
 * The resolved type of an AST expression, as produced by the front end's type checker.
 */
public enum AstType {
    UNIT(Type.VOID),
    /** The type of expressions that never produce a value, like {@code return}. */
    NEVER(Type.VOID),
    BOOL(Type.I1),
    I8(Type.I8),
    I16(Type.I16),
    I32(Type.I32),
    I64(Type.I64),
    F32(Type.F32),
    F64(Type.F64),
    PTR(Type.PTR),
    STRING(null),
    STRUCT(null),
    TUPLE(null),
    ;

    @Nullable
    private final Type irType;

    AstType(@Nullable Type irType) {
        this.irType = irType;
    }

    /**
     * Get the IR type values of this type are lowered to.
     *
     * @return The type, or null if the IR cannot represent it.
     */
    @Nullable
    public Type irType() {
        return irType;
    }

    public boolean hasValue() {
        return irType != null && irType != Type.VOID;
    }
}
