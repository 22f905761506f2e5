package io.github.kirc.core.ssa;

import io.github.kirc.core.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A function of a {@link Module}: a signature and a list of blocks, the first being the entry.
 * <p>
 * A function with no blocks is an external declaration.
 */
public final class Function extends ExtHolder {
    public final int id;
    public final String name;
    public final Signature signature;
    /**
     * A hint that call sites of this function should be inlined regardless of its size.
     */
    public boolean inline;
    /**
     * Whether calls to this function are free of observable effects.
     */
    public boolean pure;

    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.attachExt(CommonExts.OWNING_FUNCTION, Function.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            if (elt.getNullable(CommonExts.OWNING_FUNCTION) == Function.this) {
                elt.removeExt(CommonExts.OWNING_FUNCTION);
            }
        }

        @Override
        protected void checkMutable() {
            Function.this.checkMutable();
        }
    }; // [0] is entry

    private int regCounter = 0;
    private boolean frozen = false;

    Function(int id, String name, Signature signature) {
        this.id = id;
        this.name = name;
        this.signature = signature;
    }

    public boolean isDeclaration() {
        return blocks.isEmpty();
    }

    public BasicBlock entry() {
        return blocks.get(0);
    }

    public BasicBlock newBb() {
        BasicBlock bb = new BasicBlock();
        blocks.add(bb);
        return bb;
    }

    public Register newReg(Type type, @Nullable String name) {
        checkMutable();
        return new Register(regCounter++, type, name);
    }

    public Register newReg(Type type) {
        return newReg(type, null);
    }

    /**
     * Get the number of registers ever allocated in this function.
     *
     * @return One more than the largest register id.
     */
    public int regCount() {
        return regCounter;
    }

    /**
     * Count the instructions of this function.
     *
     * @return The instruction count.
     */
    public int insnCount() {
        int count = 0;
        for (BasicBlock block : blocks) {
            count += block.getInsns().size();
        }
        return count;
    }

    /**
     * Forbid any further structural change to this function.
     * <p>
     * Called once registers have been allocated.
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    void checkMutable() {
        if (frozen) throw new IllegalStateException("function " + name + " is frozen");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(name).append(signature).append(" {\n");
        for (BasicBlock block : blocks) {
            sb.append(block);
        }
        sb.append("}");
        return sb.toString();
    }

    // exts
    private MetadataState metaState = new MetadataState();
    private Module owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        }
        if (ext == CommonExts.OWNING_MODULE) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        }
        if (ext == CommonExts.OWNING_MODULE) {
            owner = (Module) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = null;
            return;
        }
        if (ext == CommonExts.OWNING_MODULE) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
