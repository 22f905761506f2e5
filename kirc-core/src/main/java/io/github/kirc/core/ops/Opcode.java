package io.github.kirc.core.ops;

import static io.github.kirc.core.ops.OpClass.*;

/**
 * The closed set of KIR opcodes.
 * <p>
 * Each opcode declares whether it terminates a block, whether it has side effects
 * (and so can never be removed just because its result is unused), whether two
 * instances with equal operands always compute the same value (and so may be merged),
 * and the typing rule the verifier checks it against.
 */
public enum Opcode {
    JUMP(CONTROL, true, true, false, TypingRule.NONE),
    JUMP_IF(CONTROL, true, true, false, TypingRule.BRANCH),
    SWITCH(CONTROL, true, true, false, TypingRule.SELECTOR),
    RET(CONTROL, true, true, false, TypingRule.RETURN),
    UNREACHABLE(CONTROL, true, true, false, TypingRule.NONE),

    ALLOCA(MEMORY, false, false, false, TypingRule.ALLOCATE),
    LOAD(MEMORY, false, false, false, TypingRule.READ),
    STORE(MEMORY, false, true, false, TypingRule.WRITE),
    MEMSET(MEMORY, false, true, false, TypingRule.FILL),
    MEMCPY(MEMORY, false, true, false, TypingRule.TRANSFER),
    PTR_ADD(MEMORY, false, false, true, TypingRule.OFFSET),

    ADD(ARITHMETIC, false, false, true, TypingRule.NUMERIC_BINARY),
    SUB(ARITHMETIC, false, false, true, TypingRule.NUMERIC_BINARY),
    MUL(ARITHMETIC, false, false, true, TypingRule.NUMERIC_BINARY),
    DIV(ARITHMETIC, false, false, true, TypingRule.NUMERIC_BINARY),
    REM(ARITHMETIC, false, false, true, TypingRule.NUMERIC_BINARY),
    NEG(ARITHMETIC, false, false, true, TypingRule.NUMERIC_UNARY),

    AND(BITWISE, false, false, true, TypingRule.INTEGER_BINARY),
    OR(BITWISE, false, false, true, TypingRule.INTEGER_BINARY),
    XOR(BITWISE, false, false, true, TypingRule.INTEGER_BINARY),
    SHL(BITWISE, false, false, true, TypingRule.INTEGER_BINARY),
    SHR(BITWISE, false, false, true, TypingRule.INTEGER_BINARY),
    USHR(BITWISE, false, false, true, TypingRule.INTEGER_BINARY),
    NOT(BITWISE, false, false, true, TypingRule.INTEGER_UNARY),

    EQ(COMPARISON, false, false, true, TypingRule.COMPARE),
    NE(COMPARISON, false, false, true, TypingRule.COMPARE),
    LT(COMPARISON, false, false, true, TypingRule.COMPARE),
    LE(COMPARISON, false, false, true, TypingRule.COMPARE),
    GT(COMPARISON, false, false, true, TypingRule.COMPARE),
    GE(COMPARISON, false, false, true, TypingRule.COMPARE),

    TRUNC(CAST, false, false, true, TypingRule.NARROW),
    SEXT(CAST, false, false, true, TypingRule.WIDEN),
    ZEXT(CAST, false, false, true, TypingRule.WIDEN),
    ITOF(CAST, false, false, true, TypingRule.INT_TO_FLOAT),
    FTOI(CAST, false, false, true, TypingRule.FLOAT_TO_INT),
    FCONV(CAST, false, false, true, TypingRule.FLOAT_TO_FLOAT),

    ATOMIC_LOAD(ATOMIC, false, true, false, TypingRule.ATOMIC_READ),
    ATOMIC_STORE(ATOMIC, false, true, false, TypingRule.ATOMIC_WRITE),
    ATOMIC_ADD(ATOMIC, false, true, false, TypingRule.ATOMIC_MODIFY),
    ATOMIC_CAS(ATOMIC, false, true, false, TypingRule.ATOMIC_EXCHANGE),

    INTRINSIC(OpClass.INTRINSIC, false, false, false, TypingRule.OPAQUE),

    CALL(MISC, false, true, false, TypingRule.CALL),
    PARAM(MISC, false, false, true, TypingRule.PARAM),
    COPY(MISC, false, false, true, TypingRule.IDENTITY),
    SPILL(MISC, false, true, false, TypingRule.STORE_SLOT),
    RELOAD(MISC, false, false, false, TypingRule.LOAD_SLOT),

    PHI(OpClass.PHI, false, false, false, TypingRule.MERGE),
    ;

    public final OpClass opClass;
    public final boolean terminator;
    public final boolean sideEffecting;
    public final boolean idempotent;
    public final TypingRule typing;

    Opcode(OpClass opClass, boolean terminator, boolean sideEffecting, boolean idempotent, TypingRule typing) {
        this.opClass = opClass;
        this.terminator = terminator;
        this.sideEffecting = sideEffecting;
        this.idempotent = idempotent;
        this.typing = typing;
    }

    /**
     * Whether {@code a op b == b op a}.
     *
     * @return Whether this opcode is commutative.
     */
    public boolean isCommutative() {
        switch (this) {
            case ADD:
            case MUL:
            case AND:
            case OR:
            case XOR:
            case EQ:
            case NE:
                return true;
            default:
                return false;
        }
    }

    public boolean isComparison() {
        return opClass == COMPARISON;
    }
}
