package io.github.kirc.core.backend;

import io.github.kirc.core.ssa.Signature;
import io.github.kirc.core.ssa.Type;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AbiTableTest {
    private final AbiTable abi = AbiTable.x86_64();

    @Test
    void classesTakeTheirOwnRegisters() {
        AbiTable.FunctionAbi layout = abi.layout(Signature.of(Type.F64, Type.I32, Type.F64, Type.PTR, Type.F32));

        assertThat(layout.args).containsExactly("rdi", "xmm0", "rsi", "xmm1");
        assertThat(layout.returnRegister).isEqualTo("xmm0");
        assertThat(layout.stackArgBytes).isZero();
    }

    @Test
    void overflowGoesToAnAlignedStack() {
        AbiTable.FunctionAbi layout = abi.layout(Signature.of(Type.VOID,
                Type.I64, Type.I64, Type.I64, Type.I64, Type.I64, Type.I64, Type.I64));

        assertThat(layout.args).hasSize(7).endsWith("[sp+0]");
        assertThat(layout.returnRegister).isNull();
        assertThat(layout.stackArgBytes).isEqualTo(16);
        assertThat(layout.toString()).isEqualTo("args [rdi, rsi, rdx, rcx, r8, r9, [sp+0]], ret void, stack 16, align 16");
    }

    @Test
    void everyStackSlotIsEightBytes() {
        AbiTable.FunctionAbi layout = abi.layout(Signature.of(Type.I32,
                Type.I8, Type.I8, Type.I8, Type.I8, Type.I8, Type.I8, Type.I8, Type.I8, Type.I8));

        assertThat(layout.args.subList(6, 9)).containsExactly("[sp+0]", "[sp+8]", "[sp+16]");
        assertThat(layout.stackArgBytes).isEqualTo(32);
        assertThat(layout.returnRegister).isEqualTo("rax");
    }
}
