package io.github.kirc.core.ssa;

import io.github.kirc.core.ops.Opcode;
import org.jetbrains.annotations.Nullable;

/**
 * An instruction builder, which encapsulates a position in a function
 * where instructions are being inserted.
 */
public class IRBuilder {
    /**
     * The function being inserted into.
     */
    public final Function func;
    private BasicBlock bb;

    /**
     * Construct an instruction builder, inserting at the end of
     * a specific basic block.
     *
     * @param func The function.
     * @param bb   One of the function's basic blocks.
     */
    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    /**
     * Get the block this builder is inserting at the end of.
     *
     * @return The block.
     */
    public BasicBlock getBlock() {
        return bb;
    }

    /**
     * Set the block this builder should insert at the end of.
     *
     * @param bb The block.
     */
    public void setBlock(BasicBlock bb) {
        this.bb = bb;
    }

    /**
     * Whether the current block already ends in a terminator.
     *
     * @return Whether the current block is closed.
     */
    public boolean isTerminated() {
        return bb.getTerminator() != null;
    }

    /**
     * Insert an instruction with no result.
     *
     * @param insn The instruction.
     */
    public void insert(Insn insn) {
        if (insn.isTerminator()) throw new IllegalArgumentException("use insertCtrl for " + insn.op);
        bb.addInsn(insn);
    }

    /**
     * Assign the result of the instruction to a new register,
     * and insert it.
     *
     * @param insn The instruction.
     * @param name The name hint of the register, may be null.
     * @return The assigned register.
     */
    public Register insert(Insn insn, @Nullable String name) {
        Register reg = func.newReg(insn.type, name);
        insert(insn.assignTo(reg));
        return reg;
    }

    /**
     * Insert a terminator at the end of the current block.
     *
     * @param ctrl The instruction to insert.
     */
    public void insertCtrl(Insn ctrl) {
        if (!ctrl.isTerminator()) throw new IllegalArgumentException(ctrl.op + " is not a terminator");
        if (isTerminated()) throw new IllegalStateException(bb.toTargetString() + " is already terminated");
        bb.addInsn(ctrl);
    }

    public Register binary(Opcode op, Value lhs, Value rhs, @Nullable String name) {
        return insert(Insn.binary(op, lhs, rhs), name);
    }

    public Register binary(Opcode op, Value lhs, Value rhs) {
        return binary(op, lhs, rhs, null);
    }

    public Register param(Type type, int index, @Nullable String name) {
        return insert(Insn.param(type, index), name);
    }
}
