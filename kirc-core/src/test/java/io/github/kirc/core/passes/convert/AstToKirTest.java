package io.github.kirc.core.passes.convert;

import io.github.kirc.core.Asts;
import io.github.kirc.core.SsaChecks;
import io.github.kirc.core.ast.*;
import io.github.kirc.core.diag.Category;
import io.github.kirc.core.diag.KirException;
import io.github.kirc.core.diag.Stage;
import io.github.kirc.core.interp.Interpreter;
import io.github.kirc.core.interp.TrapException;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.passes.meta.Verify;
import io.github.kirc.core.ssa.*;
import io.github.kirc.core.ssa.Module;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.kirc.core.Asts.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class AstToKirTest {
    private static final Span SPAN = Span.at(1, 1);

    private static Module lower(Program program) {
        Module module = AstToKir.INSTANCE.run(program);
        Verify.INSTANCE.run(module);
        return module;
    }

    /**
     * {@code fn guard(a) -> bool { return a != 0 && 10 / a > 2; }}, or with {@code ||} and {@code a == 0}.
     */
    private static FunctionDecl guarded(Expr.BinaryOp op) {
        Binding a = local("a", AstType.I32);
        Expr zeroTest = bin(op == Expr.BinaryOp.AND ? Expr.BinaryOp.NE : Expr.BinaryOp.EQ, ref(a), i32(0));
        Expr ratio = bin(Expr.BinaryOp.GT, bin(Expr.BinaryOp.DIV, i32(10), ref(a)), i32(2));
        return fn("guard", AstType.BOOL, body(AstType.BOOL, ret(bin(op, zeroTest, ratio))), a);
    }

    @Test
    void everyBindingLivesInAnEntryAlloca() {
        Module module = lower(program(diamond()));
        Function pick = module.getFunction("pick");

        assertThat(SsaChecks.countOps(pick, Opcode.ALLOCA)).isEqualTo(4);
        assertThat(SsaChecks.countOps(pick, Opcode.PARAM)).isEqualTo(3);
        assertThat(SsaChecks.countOps(pick, Opcode.PHI)).isZero();
        for (int i = 0; i < 4; i++) {
            assertThat(pick.entry().getInsns().get(i).op).isEqualTo(Opcode.ALLOCA);
        }
        for (BasicBlock block : pick.blocks.subList(1, pick.blocks.size())) {
            for (Insn insn : block.getInsns()) {
                assertThat(insn.op).isNotEqualTo(Opcode.ALLOCA);
            }
        }

        Interpreter interp = new Interpreter(module);
        assertThat(interp.call("pick", Constant.TRUE, Constant.i32(4), Constant.i32(9))).isEqualTo(Constant.i32(5));
        assertThat(interp.call("pick", Constant.FALSE, Constant.i32(4), Constant.i32(9))).isEqualTo(Constant.i32(18));
    }

    @Test
    void andShortCircuits() {
        Interpreter interp = new Interpreter(lower(program(guarded(Expr.BinaryOp.AND))));

        assertThat(interp.call("guard", Constant.i32(0))).isEqualTo(Constant.FALSE);
        assertThat(interp.call("guard", Constant.i32(3))).isEqualTo(Constant.TRUE);
        assertThat(interp.call("guard", Constant.i32(5))).isEqualTo(Constant.FALSE);
    }

    @Test
    void orShortCircuits() {
        Interpreter interp = new Interpreter(lower(program(guarded(Expr.BinaryOp.OR))));

        assertThat(interp.call("guard", Constant.i32(0))).isEqualTo(Constant.TRUE);
        assertThat(interp.call("guard", Constant.i32(3))).isEqualTo(Constant.TRUE);
        assertThat(interp.call("guard", Constant.i32(5))).isEqualTo(Constant.FALSE);
    }

    @Test
    void matchesBecomeASwitch() {
        Binding x = local("x", AstType.I32);
        Expr match = new Expr.Match(SPAN, AstType.I32, ref(x), Arrays.asList(
                new Expr.MatchArm(new long[]{1, 2}, i32(10)),
                new Expr.MatchArm(new long[]{3, 2}, i32(20))),
                i32(0));
        Module module = lower(program(fn("m", AstType.I32, body(AstType.I32, ret(match)), x)));
        Function m = module.getFunction("m");

        assertThat(SsaChecks.countOps(m, Opcode.SWITCH)).isEqualTo(1);
        Interpreter interp = new Interpreter(module);
        assertThat(interp.call("m", Constant.i32(1))).isEqualTo(Constant.i32(10));
        assertThat(interp.call("m", Constant.i32(2))).isEqualTo(Constant.i32(10));
        assertThat(interp.call("m", Constant.i32(3))).isEqualTo(Constant.i32(20));
        assertThat(interp.call("m", Constant.i32(7))).isEqualTo(Constant.i32(0));
    }

    @Test
    void labelledBreaksLeaveTheNamedLoop() {
        // fn first(n) { let found = 0; 'outer: for i in 1..n { for j in 1..n { if i * j == n { found = i; break 'outer; } } } return found; }
        Binding n = local("n", AstType.I32);
        Binding found = local("found", AstType.I32);
        Binding i = local("i", AstType.I32);
        Binding j = local("j", AstType.I32);
        Stmt inner = forRange(j, i32(1), ref(n), false,
                when(bin(Expr.BinaryOp.EQ, bin(Expr.BinaryOp.MUL, ref(i), ref(j)), ref(n)),
                        block(assign(found, ref(i)), new Stmt.Break(SPAN, "outer")),
                        null));
        Stmt outer = new Stmt.For(SPAN, "outer", i, i32(2), ref(n), false, inner);
        Module module = lower(program(fn("first", AstType.I32, body(AstType.I32,
                let(found, i32(0)), outer, ret(ref(found))), n)));

        Interpreter interp = new Interpreter(module);
        assertThat(interp.call("first", Constant.i32(15))).isEqualTo(Constant.i32(3));
        assertThat(interp.call("first", Constant.i32(13))).isEqualTo(Constant.i32(0));
    }

    @Test
    void continueSkipsToTheStep() {
        // fn odds(n) { let s = 0; for i in 0..n { if i % 2 == 0 { continue; } s = s + i; } return s; }
        Binding n = local("n", AstType.I32);
        Binding s = local("s", AstType.I32);
        Binding i = local("i", AstType.I32);
        Module module = Asts.toSsa(program(fn("odds", AstType.I32, body(AstType.I32,
                let(s, i32(0)),
                forRange(i, i32(0), ref(n), false, block(
                        when(bin(Expr.BinaryOp.EQ, bin(Expr.BinaryOp.REM, ref(i), i32(2)), i32(0)),
                                new Stmt.Continue(SPAN, null), null),
                        assign(s, bin(Expr.BinaryOp.ADD, ref(s), ref(i))))),
                ret(ref(s))), n)));

        assertThat(new Interpreter(module).call("odds", Constant.i32(10))).isEqualTo(Constant.i32(25));
    }

    /**
     * {@code fn count() -> i32 { let c = 0; for i in start..=end { c = c + 1; } return c; }}
     */
    private static FunctionDecl countInclusive(AstType type, long start, long end) {
        Binding c = local("c", AstType.I32);
        Binding i = local("i", type);
        return fn("count", AstType.I32, body(AstType.I32,
                let(c, i32(0)),
                forRange(i, new Expr.Literal(SPAN, type, start), new Expr.Literal(SPAN, type, end), true,
                        assign(c, bin(Expr.BinaryOp.ADD, ref(c), i32(1)))),
                ret(ref(c))));
    }

    @Test
    void inclusiveRangesEndingAtTheMaximumTerminate() {
        Interpreter bytes = new Interpreter(lower(program(countInclusive(AstType.I8, 120, Byte.MAX_VALUE))), 100_000);
        assertThat(bytes.call("count")).isEqualTo(Constant.i32(8));

        Interpreter ints = new Interpreter(lower(program(countInclusive(AstType.I32, Integer.MAX_VALUE - 2, Integer.MAX_VALUE))), 100_000);
        assertThat(ints.call("count")).isEqualTo(Constant.i32(3));
    }

    @Test
    void inclusiveRangesBelowTheMaximumKeepASingleExit() {
        Module module = lower(program(countInclusive(AstType.I32, 1, 4)));

        assertThat(SsaChecks.countOps(module.getFunction("count"), Opcode.JUMP_IF)).isEqualTo(1);
        assertThat(new Interpreter(module).call("count")).isEqualTo(Constant.i32(4));
    }

    @Test
    void infiniteLoopsExitThroughBreak() {
        // fn count(n) { let i = 0; loop { i = i + 1; if i >= n { break; } } return i; }
        Binding n = local("n", AstType.I32);
        Binding i = local("i", AstType.I32);
        Module module = Asts.toSsa(program(fn("count", AstType.I32, body(AstType.I32,
                let(i, i32(0)),
                new Stmt.Loop(SPAN, null, block(
                        assign(i, bin(Expr.BinaryOp.ADD, ref(i), i32(1))),
                        when(bin(Expr.BinaryOp.GE, ref(i), ref(n)), brk(), null))),
                ret(ref(i))), n)));

        assertThat(new Interpreter(module).call("count", Constant.i32(6))).isEqualTo(Constant.i32(6));
    }

    @Test
    void codeAfterReturnIsDropped() {
        Binding x = local("x", AstType.I32);
        Module module = lower(program(fn("early", AstType.I32, body(AstType.I32,
                let(x, i32(1)),
                ret(ref(x)),
                assign(x, i32(2)),
                ret(ref(x))))));
        Function early = module.getFunction("early");

        assertThat(early.blocks).hasSize(1);
        assertThat(SsaChecks.countOps(early, Opcode.RET)).isEqualTo(1);
    }

    @Test
    void fallingOffTheEndIsUnreachable() {
        Binding c = local("c", AstType.BOOL);
        Module module = lower(program(fn("partial", AstType.I32, body(AstType.I32,
                when(ref(c), ret(i32(1)), null)), c)));

        assertThat(SsaChecks.countOps(module.getFunction("partial"), Opcode.UNREACHABLE)).isEqualTo(1);
        assertThatThrownBy(() -> new Interpreter(module).call("partial", Constant.FALSE))
                .isInstanceOf(TrapException.class)
                .hasMessageContaining("missing return in partial");
    }

    @Test
    void unrepresentableTypesAreReportedWithTheirSpan() {
        Span where = Span.at(3, 7);
        FunctionDecl decl = new FunctionDecl(where, "greet", Collections.singletonList(local("s", AstType.STRING)),
                AstType.UNIT, body(AstType.UNIT));

        KirException e = catchThrowableOfType(() -> AstToKir.INSTANCE.run(program(decl)), KirException.class);

        assertThat(e.getDiagnostic().stage).isEqualTo(Stage.LOWERING);
        assertThat(e.getDiagnostic().category).isEqualTo(Category.INTERNAL);
        assertThat(e.getDiagnostic().function).isEqualTo("greet");
        assertThat(e.getDiagnostic().span).isSameAs(where);
        assertThat(e).hasMessageContaining("type STRING cannot be represented in the IR");
    }

    @Test
    void breakOutsideALoopIsAnError() {
        assertThatThrownBy(() -> AstToKir.INSTANCE.run(program(fn("bad", AstType.UNIT, body(AstType.UNIT, brk())))))
                .isInstanceOf(KirException.class)
                .hasMessageContaining("outside of a loop");
    }

    @Test
    void unknownCalleesAreAnError() {
        assertThatThrownBy(() -> AstToKir.INSTANCE.run(program(fn("bad", AstType.I32,
                body(AstType.I32, ret(call("nowhere", AstType.I32)))))))
                .isInstanceOf(KirException.class)
                .hasMessageContaining("call to unknown function nowhere");
    }

    @Test
    void voidFunctionsGetAnImplicitReturn() {
        Module module = lower(program(fn("nothing", AstType.UNIT, body(AstType.UNIT))));
        Insn ret = module.getFunction("nothing").entry().getTerminator();

        assertThat(ret.op).isEqualTo(Opcode.RET);
        assertThat(ret.args).isEmpty();
        assertThat(new Interpreter(module).call("nothing")).isNull();
    }
}
