package io.github.kirc.core.ssa;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.Ext;
import io.github.kirc.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

/**
 * A virtual register. Identity is the object itself; the id is unique within the owning function.
 */
public final class Register extends ExtHolder implements Value {
    public final int id;
    public final Type type;
    @Nullable
    public final String name;

    Register(int id, Type type, @Nullable String name) {
        if (type == Type.VOID) throw new IllegalArgumentException("void register");
        this.id = id;
        this.type = type;
        this.name = name;
    }

    @Override
    public Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return name == null ? "%" + id : "%" + name + "." + id;
    }

    // exts
    private Insn assignedAt = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            return (T) assignedAt;
        }
        return super.getNullable(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = (Insn) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = null;
            return;
        }
        super.removeExt(ext);
    }
}
