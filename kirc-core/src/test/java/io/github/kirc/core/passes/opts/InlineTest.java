package io.github.kirc.core.passes.opts;

import io.github.kirc.core.Asts;
import io.github.kirc.core.SsaChecks;
import io.github.kirc.core.ast.AstType;
import io.github.kirc.core.ast.Binding;
import io.github.kirc.core.ast.Expr;
import io.github.kirc.core.ast.FunctionDecl;
import io.github.kirc.core.interp.Interpreter;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.passes.meta.Verify;
import io.github.kirc.core.ssa.Constant;
import io.github.kirc.core.ssa.Function;
import io.github.kirc.core.ssa.Module;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;

import static io.github.kirc.core.Asts.*;
import static org.assertj.core.api.Assertions.assertThat;

class InlineTest {
    private static FunctionDecl unary(String name, Expr.BinaryOp op, long rhs, @Nullable String callee) {
        Binding x = local("x", AstType.I32);
        Expr inner = callee == null ? ref(x) : call(callee, AstType.I32, ref(x));
        return fn(name, AstType.I32, body(AstType.I32, ret(bin(op, inner, i32(rhs)))), x);
    }

    private static FunctionDecl twice() {
        Binding a = local("a", AstType.I32);
        return fn("twice", AstType.I32, body(AstType.I32,
                ret(call("inc", AstType.I32, call("inc", AstType.I32, ref(a))))), a);
    }

    /**
     * {@code fn name(n) { if n == 0 { return base; } return other(n - 1); }}
     */
    private static FunctionDecl parity(String name, long base, String other) {
        Binding n = local("n", AstType.I32);
        return fn(name, AstType.I32, body(AstType.I32,
                when(bin(Expr.BinaryOp.EQ, ref(n), i32(0)), ret(i32(base)), null),
                ret(call(other, AstType.I32, bin(Expr.BinaryOp.SUB, ref(n), i32(1))))), n);
    }

    @Test
    void smallCalleesAreInlined() {
        Module module = Asts.toSsa(program(unary("inc", Expr.BinaryOp.ADD, 1, null), twice()));
        Function twice = module.getFunction("twice");

        assertThat(new Inline(10, 4).run(twice)).isTrue();
        Verify.INSTANCE.verifyFunction(twice);

        assertThat(SsaChecks.countOps(twice, Opcode.CALL)).isZero();
        SsaChecks.assertDominance(twice);
        assertThat(new Interpreter(module).call("twice", Constant.i32(40))).isEqualTo(Constant.i32(42));
    }

    @Test
    void largeCalleesAreLeftAlone() {
        Module module = Asts.toSsa(program(unary("inc", Expr.BinaryOp.ADD, 1, null), twice()));
        Function twice = module.getFunction("twice");

        assertThat(new Inline(2, 4).run(twice)).isFalse();
        assertThat(SsaChecks.countOps(twice, Opcode.CALL)).isEqualTo(2);
    }

    @Test
    void inlineMarkedCalleesIgnoreTheThreshold() {
        Module module = Asts.toSsa(program(unary("inc", Expr.BinaryOp.ADD, 1, null), twice()));
        module.getFunction("inc").inline = true;
        Function twice = module.getFunction("twice");

        assertThat(new Inline(2, 4).run(twice)).isTrue();
        assertThat(SsaChecks.countOps(twice, Opcode.CALL)).isZero();
    }

    @Test
    void recursionIsNeverUnfoldedIntoItself() {
        Module module = Asts.toSsa(program(parity("even", 1, "odd"), parity("odd", 0, "even")));
        Function even = module.getFunction("even");

        assertThat(new Inline(100, 4).run(even)).isTrue();
        Verify.INSTANCE.verifyFunction(even);

        assertThat(SsaChecks.countOps(even, Opcode.CALL)).isEqualTo(1);
        Interpreter interp = new Interpreter(module);
        assertThat(interp.call("even", Constant.i32(4))).isEqualTo(Constant.i32(1));
        assertThat(interp.call("even", Constant.i32(7))).isEqualTo(Constant.i32(0));
    }

    @Test
    void inliningStopsAtTheDepthLimit() {
        Module module = Asts.toSsa(program(
                unary("c1", Expr.BinaryOp.ADD, 1, null),
                unary("c2", Expr.BinaryOp.MUL, 2, "c1"),
                unary("c3", Expr.BinaryOp.SUB, 3, "c2")));
        Function c3 = module.getFunction("c3");

        assertThat(new Inline(100, 1).run(c3)).isTrue();
        Verify.INSTANCE.verifyFunction(c3);

        assertThat(SsaChecks.countOps(c3, Opcode.CALL)).isEqualTo(1);
        assertThat(new Interpreter(module).call("c3", Constant.i32(5))).isEqualTo(Constant.i32(9));
    }
}
