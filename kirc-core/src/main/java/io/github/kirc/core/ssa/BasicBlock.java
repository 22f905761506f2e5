package io.github.kirc.core.ssa;

import io.github.kirc.core.ext.*;
import io.github.kirc.core.ops.Opcode;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A straight-line sequence of instructions ending in exactly one terminator.
 * <p>
 * A block's label is its index in the owning function.
 */
public final class BasicBlock extends ExtHolder {
    private final TrackedList<Insn> insns = new TrackedList<Insn>(new ArrayList<>()) {
        @Override
        protected void onAdded(Insn elt) {
            elt.attachExt(CommonExts.OWNING_BLOCK, BasicBlock.this);
        }

        @Override
        protected void onRemoved(Insn elt) {
            if (elt.getNullable(CommonExts.OWNING_BLOCK) == BasicBlock.this) {
                elt.removeExt(CommonExts.OWNING_BLOCK);
            }
        }

        @Override
        protected void checkMutable() {
            if (owner != null) owner.checkMutable();
        }
    };

    /**
     * Get the index of this block in its function, or -1 if it is detached.
     *
     * @return The label.
     */
    public int label() {
        return owner == null ? -1 : owner.blocks.indexOf(this);
    }

    public String toTargetString() {
        int label = label();
        return label < 0 ? String.format("bb@%08x", System.identityHashCode(this)) : "bb" + label;
    }

    public List<Insn> getInsns() {
        return insns;
    }

    public void addInsn(Insn insn) {
        insns.add(insn);
    }

    /**
     * Insert an instruction just before the terminator, or at the end if there is none yet.
     *
     * @param insn The instruction.
     */
    public void insertBeforeTerminator(Insn insn) {
        if (getTerminator() != null) {
            insns.add(insns.size() - 1, insn);
        } else {
            insns.add(insn);
        }
    }

    /**
     * Get the index of the first instruction that is not a phi.
     *
     * @return The index.
     */
    public int firstNonPhi() {
        int i = 0;
        while (i < insns.size() && insns.get(i).op == Opcode.PHI) i++;
        return i;
    }

    public List<Insn> getPhis() {
        return insns.subList(0, firstNonPhi());
    }

    @Nullable
    public Insn getTerminator() {
        if (insns.isEmpty()) return null;
        Insn last = insns.get(insns.size() - 1);
        return last.isTerminator() ? last : null;
    }

    /**
     * Get the successors of this block, read from its terminator.
     *
     * @return The successors, possibly with repeats.
     */
    public List<BasicBlock> successors() {
        Insn terminator = getTerminator();
        return terminator == null ? Collections.emptyList() : terminator.blocks;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append(":\n");
        for (Insn insn : insns) {
            sb.append("  ").append(insn).append('\n');
        }
        return sb.toString();
    }

    // exts
    private Function owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = (Function) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
