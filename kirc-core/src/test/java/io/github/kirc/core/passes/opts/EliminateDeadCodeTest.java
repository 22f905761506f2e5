package io.github.kirc.core.passes.opts;

import io.github.kirc.core.Asts;
import io.github.kirc.core.SsaChecks;
import io.github.kirc.core.ast.AstType;
import io.github.kirc.core.ast.Binding;
import io.github.kirc.core.ast.Expr;
import io.github.kirc.core.ast.FunctionDecl;
import io.github.kirc.core.interp.Interpreter;
import io.github.kirc.core.interp.TrapException;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.pipeline.OptLevel;
import io.github.kirc.core.pipeline.PassManager;
import io.github.kirc.core.pipeline.PipelineConfig;
import io.github.kirc.core.ssa.*;
import io.github.kirc.core.ssa.Module;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static io.github.kirc.core.Asts.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class EliminateDeadCodeTest {
    @Test
    void unusedPureInstructionsAreRemoved() {
        Module module = new Module();
        module.newFunction("effect", Signature.of(Type.VOID, Type.I32));
        Function f = module.newFunction("f", Signature.of(Type.I32, Type.I32));
        IRBuilder ib = new IRBuilder(f, f.newBb());
        Register x = ib.param(Type.I32, 0, "x");
        Register dead = ib.binary(Opcode.MUL, x, x, "dead");
        ib.binary(Opcode.ADD, dead, Constant.i32(1), "deadToo");
        ib.insert(Insn.call(Type.VOID, "effect", Arrays.asList(x)));
        ib.binary(Opcode.DIV, Constant.i32(1), x, "mayTrap");
        ib.insertCtrl(Insn.ret(x));

        assertThat(EliminateDeadCode.INSTANCE.run(f)).isTrue();

        assertThat(SsaChecks.countOps(f, Opcode.MUL)).isZero();
        assertThat(SsaChecks.countOps(f, Opcode.ADD)).isZero();
        assertThat(SsaChecks.countOps(f, Opcode.CALL)).isEqualTo(1);
        assertThat(SsaChecks.countOps(f, Opcode.DIV)).isEqualTo(1);
    }

    @Test
    void deadPhiCyclesAreRemoved() {
        Module module = Asts.toSsa(program(sumTo(null)));
        Function sum = module.getFunction("sum");
        // keep the loop but stop returning the accumulator
        Insn ret = null;
        for (BasicBlock block : sum.blocks) {
            Insn terminator = block.getTerminator();
            if (terminator != null && terminator.op == Opcode.RET) ret = terminator;
        }
        assertThat(ret).isNotNull();
        ret.args.set(0, Constant.i32(0));

        EliminateDeadCode.INSTANCE.run(sum);

        int phis = 0;
        for (BasicBlock block : sum.blocks) phis += block.getPhis().size();
        assertThat(phis).as("only the induction variable is left").isEqualTo(1);
    }

    @Test
    void runningTwiceChangesNothing() {
        Module module = Asts.toSsa(program(diamond(), sumTo(null)));
        for (Function func : module.getFunctions()) {
            EliminateDeadCode.INSTANCE.run(func);
            String once = func.toString();
            assertThat(EliminateDeadCode.INSTANCE.run(func)).isFalse();
            assertThat(func.toString()).isEqualTo(once);
        }
    }

    /**
     * {@code fn main() -> i32 { callee(arg); return 1; }}
     */
    private static FunctionDecl discarding(String callee, int arg) {
        return fn("main", AstType.I32, body(AstType.I32,
                expr(call(callee, AstType.I32, i32(arg))),
                ret(i32(1))));
    }

    private static Module optimizeLess(FunctionDecl... functions) {
        Module module = Asts.toSsa(program(functions));
        new PassManager(PipelineConfig.forLevel(OptLevel.LESS)).run(module);
        return module;
    }

    @Test
    void unusedCallsThatMayTrapAreKept() {
        Binding x = local("x", AstType.I32);
        FunctionDecl div = fn("div", AstType.I32, body(AstType.I32,
                ret(bin(Expr.BinaryOp.DIV, i32(1), ref(x)))), x);
        Module module = optimizeLess(div, discarding("div", 0));

        assertThat(SsaChecks.countOps(module.getFunction("main"), Opcode.CALL)).isEqualTo(1);
        TrapException trap = catchThrowableOfType(() -> new Interpreter(module).call("main"), TrapException.class);
        assertThat(trap).isNotNull();
        assertThat(trap).hasMessage("trap in div: integer division by zero");
    }

    @Test
    void unusedCallsThatMayLoopAreKept() {
        Module module = optimizeLess(sumTo(null), discarding("sum", 3));

        assertThat(SsaChecks.countOps(module.getFunction("main"), Opcode.CALL)).isEqualTo(1);
        assertThat(new Interpreter(module).call("main")).isEqualTo(Constant.i32(1));
    }

    @Test
    void unusedCallsToPureFunctionsAreRemoved() {
        Binding x = local("x", AstType.I32);
        FunctionDecl twice = fn("twice", AstType.I32, body(AstType.I32,
                ret(bin(Expr.BinaryOp.MUL, ref(x), i32(2)))), x);
        Module module = optimizeLess(twice, discarding("twice", 5));

        assertThat(SsaChecks.countOps(module.getFunction("main"), Opcode.CALL)).isZero();
    }
}
