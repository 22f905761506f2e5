package io.github.kirc.core.backend;

import io.github.kirc.core.Asts;
import io.github.kirc.core.ast.AstType;
import io.github.kirc.core.ast.Binding;
import io.github.kirc.core.ast.GlobalDecl;
import io.github.kirc.core.ast.Span;
import io.github.kirc.core.diag.Category;
import io.github.kirc.core.diag.UnsupportedOpcodeException;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.regalloc.TargetDesc;
import io.github.kirc.core.ssa.*;
import io.github.kirc.core.ssa.Module;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static io.github.kirc.core.Asts.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class TextualBridgeTest {
    private final TextualBridge bridge = new TextualBridge();

    @Test
    void functionsArePrintedWithTheirConvention() {
        String text = bridge.emit(AllocatedModule.ssa(Asts.toSsa(program(diamond()))));

        assertThat(text)
                .contains("; abi: args [rdi, rsi, rdx], ret rax, stack 0, align 16")
                .contains("define i32 @pick(i1 %arg0, i32 %arg1, i32 %arg2) {")
                .contains("bb0:")
                .contains("br i1 ")
                .contains(" = phi i32 [ ")
                .contains(" = add i32 ")
                .contains(" = mul i32 ")
                .contains("ret i32 ")
                .endsWith("}\n");
        assertThat(text).doesNotContain("alloca");
    }

    @Test
    void globalsAndDeclarationsComeFirst() {
        Binding x = local("x", AstType.I32);
        Module module = Asts.toSsa(program(
                Collections.singletonList(new GlobalDecl(Span.at(1, 1), "g", AstType.I32, 5L)),
                extern("ext", AstType.I32, local("y", AstType.I32)),
                fn("use", AstType.I32, body(AstType.I32, ret(call("ext", AstType.I32, ref(x)))), x)));

        String text = bridge.emit(AllocatedModule.ssa(module));

        assertThat(text).startsWith("@g = global i32 5\ndeclare i32 @ext(i32)\n");
        assertThat(text).contains("call i32 @ext(i32 %");
    }

    @Test
    void floatsArePrintedAsHexBits() {
        Module module = new Module();
        Function func = module.newFunction("half", Signature.of(Type.F64, Type.F64));
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Register v = ib.param(Type.F64, 0, "v");
        Register r = ib.binary(Opcode.MUL, v, Constant.f64(0.5), "r");
        ib.insertCtrl(Insn.ret(r));

        String text = bridge.emit(AllocatedModule.ssa(module));

        assertThat(text).contains("fmul double %v.0, 0x3FE0000000000000");
        assertThat(text).contains("ret double %r.1");
        assertThat(text).contains("ret xmm0");
    }

    @Test
    void allocatedModulesAreRejected() {
        Module module = Asts.toSsa(program(diamond()));
        AllocatedModule allocated = AllocatedModule.allocate(module, TargetDesc.x86_64());

        assertThatThrownBy(() -> bridge.emit(allocated)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void slotTrafficHasNoLowering() {
        Module module = new Module();
        Function func = module.newFunction("slots", Signature.of(Type.VOID));
        IRBuilder ib = new IRBuilder(func, func.newBb());
        ib.insert(Insn.spill(Constant.i32(1), 0));
        ib.insertCtrl(Insn.ret(null));

        UnsupportedOpcodeException e = catchThrowableOfType(() -> bridge.emit(AllocatedModule.ssa(module)),
                UnsupportedOpcodeException.class);

        assertThat(e).hasMessageContaining("SPILL has no lowering for target llvm-text");
        assertThat(e.getOpcode()).isEqualTo(Opcode.SPILL);
        assertThat(e.getDiagnostic().category).isEqualTo(Category.UNSUPPORTED_OPCODE);
    }
}
