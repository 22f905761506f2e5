package io.github.kirc.core.passes.opts;

import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.pipeline.PassManager;
import io.github.kirc.core.pipeline.PipelineConfig;
import io.github.kirc.core.ssa.*;
import io.github.kirc.core.ssa.Module;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class ConstantFoldingTest {
    private static PipelineConfig foldCopyDce() {
        return PipelineConfig.builder()
                .passes(Arrays.asList(ConstantFolding.INSTANCE, CopyPropagation.INSTANCE, EliminateDeadCode.INSTANCE))
                .verify(true)
                .build();
    }

    @Test
    void identitiesCollapseToTheParameter() {
        Module module = new Module();
        Function f = module.newFunction("f", Signature.of(Type.I32, Type.I32));
        IRBuilder ib = new IRBuilder(f, f.newBb());
        Register x = ib.param(Type.I32, 0, "x");
        Register a = ib.binary(Opcode.ADD, x, Constant.i32(0), "a");
        Register b = ib.binary(Opcode.MUL, a, Constant.i32(1), "b");
        ib.insertCtrl(Insn.ret(b));

        new PassManager(foldCopyDce()).run(module);

        assertThat(f.blocks).hasSize(1);
        assertThat(f.entry().getInsns()).hasSize(2);
        Insn ret = f.entry().getTerminator();
        assertThat(ret).isNotNull();
        assertThat(ret.op).isEqualTo(Opcode.RET);
        assertThat(ret.args).containsExactly(x);
    }

    @Test
    void constantBranchesAreResolved() {
        Module module = new Module();
        Function f = module.newFunction("f", Signature.of(Type.I32));
        BasicBlock entry = f.newBb();
        BasicBlock yes = f.newBb();
        BasicBlock no = f.newBb();
        IRBuilder ib = new IRBuilder(f, entry);
        Register cond = ib.binary(Opcode.LT, Constant.i32(2), Constant.i32(3));
        ib.insertCtrl(Insn.jumpIf(cond, yes, no));
        ib.setBlock(yes);
        ib.insertCtrl(Insn.ret(Constant.i32(1)));
        ib.setBlock(no);
        ib.insertCtrl(Insn.ret(Constant.i32(0)));

        new PassManager(foldCopyDce()).run(module);

        assertThat(f.blocks).hasSize(2);
        assertThat(f.entry().getTerminator().op).isEqualTo(Opcode.JUMP);
        assertThat(f.entry().successors()).containsExactly(yes);
    }

    @Test
    void divisionByZeroIsLeftToTrap() {
        Module module = new Module();
        Function f = module.newFunction("f", Signature.of(Type.I32));
        IRBuilder ib = new IRBuilder(f, f.newBb());
        Register q = ib.binary(Opcode.DIV, Constant.i32(1), Constant.i32(0));
        ib.insertCtrl(Insn.ret(q));

        new PassManager(foldCopyDce()).run(module);

        assertThat(f.entry().getInsns().get(0).op).isEqualTo(Opcode.DIV);
    }

    @Test
    void integerArithmeticWrapsToItsWidth() {
        Module module = new Module();
        Function f = module.newFunction("f", Signature.of(Type.I8));
        IRBuilder ib = new IRBuilder(f, f.newBb());
        Register sum = ib.binary(Opcode.ADD, Constant.of(Type.I8, 127), Constant.of(Type.I8, 1));
        ib.insertCtrl(Insn.ret(sum));

        new PassManager(foldCopyDce()).run(module);

        assertThat(f.entry().getTerminator().args).containsExactly(Constant.of(Type.I8, -128));
    }
}
