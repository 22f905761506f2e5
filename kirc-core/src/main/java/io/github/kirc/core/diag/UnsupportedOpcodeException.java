package io.github.kirc.core.diag;

import io.github.kirc.core.ops.Opcode;

/**
 * Thrown by a backend for an instruction it has no lowering for.
 */
public class UnsupportedOpcodeException extends KirException {
    private final Opcode opcode;

    public UnsupportedOpcodeException(String function, Opcode opcode, String target) {
        super(new Diagnostic(Category.UNSUPPORTED_OPCODE, Stage.BACKEND, function,
                String.format("%s has no lowering for target %s", opcode, target), null));
        this.opcode = opcode;
    }

    public Opcode getOpcode() {
        return opcode;
    }
}
