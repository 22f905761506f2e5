package io.github.kirc.core.passes.opts;

import io.github.kirc.core.Asts;
import io.github.kirc.core.SsaChecks;
import io.github.kirc.core.interp.Interpreter;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.passes.meta.Verify;
import io.github.kirc.core.ssa.*;
import io.github.kirc.core.ssa.Module;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static io.github.kirc.core.Asts.diamond;
import static io.github.kirc.core.Asts.program;
import static org.assertj.core.api.Assertions.assertThat;

class CopyPropagationTest {
    @Test
    void copyChainsAreContracted() {
        Module module = new Module();
        Function f = module.newFunction("f", Signature.of(Type.I32, Type.I32));
        IRBuilder ib = new IRBuilder(f, f.newBb());
        Register x = ib.param(Type.I32, 0, "x");
        Register a = ib.insert(Insn.copy(x), "a");
        Register b = ib.insert(Insn.copy(a), "b");
        Register sum = ib.binary(Opcode.ADD, b, a, "sum");
        ib.insertCtrl(Insn.ret(sum));

        assertThat(CopyPropagation.INSTANCE.run(f)).isTrue();
        Verify.INSTANCE.verifyFunction(f);

        assertThat(SsaChecks.countOps(f, Opcode.COPY)).isZero();
        assertThat(f.entry().getInsns().get(1).args).containsExactly(x, x);
        assertThat(CopyPropagation.INSTANCE.run(f)).isFalse();
    }

    @Test
    void selfReferentialPhisCollapseToTheirOtherOperand() {
        // entry: x = param; jump loop
        // loop:  p = phi [x, entry], [p, loop]; c = p < 10; br c, loop, exit
        // exit:  ret p
        Module module = new Module();
        Function f = module.newFunction("f", Signature.of(Type.I32, Type.I32));
        BasicBlock entry = f.newBb();
        BasicBlock loop = f.newBb();
        BasicBlock exit = f.newBb();
        IRBuilder ib = new IRBuilder(f, entry);
        Register x = ib.param(Type.I32, 0, "x");
        ib.insertCtrl(Insn.jump(loop));
        ib.setBlock(loop);
        Register p = f.newReg(Type.I32, "p");
        ib.insert(Insn.phi(Type.I32, Arrays.asList(entry, loop), Arrays.asList(x, p)).assignTo(p));
        Register c = ib.binary(Opcode.LT, p, Constant.i32(10), "c");
        ib.insertCtrl(Insn.jumpIf(c, loop, exit));
        ib.setBlock(exit);
        ib.insertCtrl(Insn.ret(p));

        assertThat(CopyPropagation.INSTANCE.run(f)).isTrue();
        Verify.INSTANCE.verifyFunction(f);

        assertThat(SsaChecks.countOps(f, Opcode.PHI)).isZero();
        assertThat(exit.getTerminator().args).containsExactly(x);
        assertThat(new Interpreter(module).call("f", Constant.i32(12))).isEqualTo(Constant.i32(12));
    }

    @Test
    void realMergesStay() {
        Module module = Asts.toSsa(program(diamond()));
        Function pick = module.getFunction("pick");

        assertThat(CopyPropagation.INSTANCE.run(pick)).isFalse();
        assertThat(SsaChecks.countOps(pick, Opcode.PHI)).isEqualTo(1);
    }
}
