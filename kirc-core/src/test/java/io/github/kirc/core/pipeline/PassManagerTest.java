package io.github.kirc.core.pipeline;

import io.github.kirc.core.Asts;
import io.github.kirc.core.SsaChecks;
import io.github.kirc.core.ast.*;
import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.interp.Interpreter;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.passes.opts.ConstantFolding;
import io.github.kirc.core.ssa.Constant;
import io.github.kirc.core.ssa.Function;
import io.github.kirc.core.ssa.Global;
import io.github.kirc.core.ssa.Module;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import static io.github.kirc.core.Asts.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PassManagerTest {
    /**
     * {@code fn steps(n) { let c = 0; while n != 1 { if n % 2 == 0 { n = n / 2; } else { n = 3 * n + 1; } c = c + 1; } return c; }}
     */
    private static FunctionDecl collatz() {
        Binding n = local("n", AstType.I32);
        Binding c = local("c", AstType.I32);
        return fn("steps", AstType.I32, body(AstType.I32,
                let(c, i32(0)),
                loopWhile(bin(Expr.BinaryOp.NE, ref(n), i32(1)), block(
                        when(bin(Expr.BinaryOp.EQ, bin(Expr.BinaryOp.REM, ref(n), i32(2)), i32(0)),
                                assign(n, bin(Expr.BinaryOp.DIV, ref(n), i32(2))),
                                assign(n, bin(Expr.BinaryOp.ADD, bin(Expr.BinaryOp.MUL, i32(3), ref(n)), i32(1)))),
                        assign(c, bin(Expr.BinaryOp.ADD, ref(c), i32(1))))),
                ret(ref(c))), n);
    }

    /**
     * {@code fn bump(x) { g = g + x; return g; } fn bumpTwice(x) { bump(x); return bump(x) * 2; }}
     */
    private static Program counter() {
        Binding x = local("x", AstType.I32);
        Binding y = local("y", AstType.I32);
        FunctionDecl bump = fn("bump", AstType.I32, body(AstType.I32,
                assignGlobal("g", AstType.I32, bin(Expr.BinaryOp.ADD, global("g", AstType.I32), ref(x))),
                ret(global("g", AstType.I32))), x);
        FunctionDecl bumpTwice = fn("bumpTwice", AstType.I32, body(AstType.I32,
                expr(call("bump", AstType.I32, ref(y))),
                ret(bin(Expr.BinaryOp.MUL, call("bump", AstType.I32, ref(y)), i32(2)))), y);
        return program(Collections.singletonList(new GlobalDecl(Span.at(1, 1), "g", AstType.I32, 5L)),
                bump, bumpTwice);
    }

    /**
     * {@code fn scale(x) -> f64 { let k = 0.5; return (x as f64) * k + 1.0; }}
     */
    private static FunctionDecl scale() {
        Binding x = local("x", AstType.I32);
        Binding k = local("k", AstType.F64);
        return fn("scale", AstType.F64, body(AstType.F64,
                let(k, f64(0.5)),
                ret(bin(Expr.BinaryOp.ADD,
                        bin(Expr.BinaryOp.MUL, cast(AstType.F64, ref(x)), ref(k)),
                        f64(1.0)))), x);
    }

    private static final List<Supplier<Program>> PROGRAMS = Arrays.asList(
            () -> program(sumTo(null)),
            () -> program(sumTo(4)),
            () -> program(diamond()),
            () -> program(collatz()),
            PassManagerTest::counter,
            () -> program(scale())
    );

    private static void assertSameBehaviour(Supplier<Program> source, PipelineConfig config) {
        Module reference = Asts.toSsa(source.get());
        Module optimized = Asts.toSsa(source.get());
        new PassManager(config).run(optimized);

        for (Function func : optimized.getFunctions()) {
            SsaChecks.assertDominance(func);
            SsaChecks.assertPhisWellFormed(func);
        }
        for (Function func : reference.getFunctions()) {
            for (int arg = 1; arg <= 9; arg += 2) {
                Constant[] args = argsFor(func, arg);
                Interpreter expected = new Interpreter(reference);
                Interpreter actual = new Interpreter(optimized);
                assertThat(actual.call(func.name, args))
                        .as("%s%s", func.name, Arrays.toString(args))
                        .isEqualTo(expected.call(func.name, args));
                for (Global global : reference.getGlobals()) {
                    assertThat(actual.readGlobal(global.name)).isEqualTo(expected.readGlobal(global.name));
                }
            }
        }
    }

    private static Constant[] argsFor(Function func, int seed) {
        Constant[] args = new Constant[func.signature.params.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = Constant.of(func.signature.params.get(i), seed + i);
        }
        return args;
    }

    @ParameterizedTest
    @EnumSource(OptLevel.class)
    void optimizationPreservesBehaviour(OptLevel level) {
        for (Supplier<Program> source : PROGRAMS) {
            assertSameBehaviour(source, PipelineConfig.forLevel(level));
        }
    }

    @Test
    void parallelRunsMatchSequentialOnes() {
        Module sequential = Asts.toSsa(program(sumTo(null), diamond(), collatz(), scale()));
        Module parallel = Asts.toSsa(program(sumTo(null), diamond(), collatz(), scale()));
        PassManager manager = new PassManager(PipelineConfig.defaults());

        OptimizationStats expected = manager.run(sequential);
        ExecutorService executor = Executors.newFixedThreadPool(3);
        OptimizationStats actual;
        try {
            actual = manager.run(parallel, executor);
        } finally {
            executor.shutdownNow();
        }

        assertThat(actual.get(OptimizationStats.Counter.INLINED_CALLS))
                .isEqualTo(expected.get(OptimizationStats.Counter.INLINED_CALLS));
        assertThat(actual.get(OptimizationStats.Counter.UNROLLED_LOOPS))
                .isEqualTo(expected.get(OptimizationStats.Counter.UNROLLED_LOOPS));
        for (Function func : sequential.getFunctions()) {
            Constant[] args = argsFor(func, 7);
            assertThat(new Interpreter(parallel).call(func.name, args))
                    .isEqualTo(new Interpreter(sequential).call(func.name, args));
        }
    }

    @Test
    void statsAreAggregatedOntoTheModule() {
        Module module = Asts.toSsa(program(sumTo(4), diamond()));

        OptimizationStats stats = new PassManager(PipelineConfig.defaults()).run(module);

        assertThat(module.getExtOrThrow(CommonExts.OPT_STATS)).isSameAs(stats);
        assertThat(stats.get(OptimizationStats.Counter.ROUNDS)).isGreaterThanOrEqualTo(2);
        assertThat(stats.get(OptimizationStats.Counter.UNROLLED_LOOPS)).isEqualTo(1);
        assertThat(stats.get(OptimizationStats.Counter.REMOVED_INSNS)).isPositive();
    }

    @Test
    void noneLeavesFunctionsAlone() {
        Module module = Asts.toSsa(program(sumTo(4)));
        String before = module.getFunction("sum").toString();

        OptimizationStats stats = new PassManager(PipelineConfig.forLevel(OptLevel.NONE)).run(module);

        assertThat(module.getFunction("sum").toString()).isEqualTo(before);
        assertThat(stats.get(OptimizationStats.Counter.ROUNDS)).isZero();
    }

    @Test
    void explicitPassListsOverrideTheLevel() {
        Module module = Asts.toSsa(program(sumTo(4)));
        PipelineConfig config = PipelineConfig.builder()
                .passes(Collections.singletonList(ConstantFolding.INSTANCE))
                .build();

        OptimizationStats stats = new PassManager(config).run(module);

        assertThat(stats.get(OptimizationStats.Counter.UNROLLED_LOOPS)).isZero();
        assertThat(SsaChecks.countOps(module.getFunction("sum"), Opcode.PHI)).isPositive();
    }

    @Test
    void cancellationStopsBetweenPasses() {
        Module module = Asts.toSsa(program(sumTo(null)));

        assertThatThrownBy(() -> new PassManager(PipelineConfig.defaults(), () -> true).run(module))
                .isInstanceOf(CancellationException.class)
                .hasMessageContaining("sum");
    }

    @Test
    void calleesAreOrderedBeforeCallers() {
        Module module = Asts.toSsa(counter());

        List<Function> order = PassManager.bottomUp(module);

        assertThat(order).extracting(f -> f.name).containsExactly("bump", "bumpTwice");
    }

    /**
     * {@code fn offset(x) { let k = 1; k = k + 1; ...; return x + k; } fn main(y) { return offset(y) * 2; }}
     * <p>
     * The body of {@code offset} only folds down to a single add after constant folding.
     */
    private static Program offsetThenDouble(int steps) {
        Binding x = local("x", AstType.I32);
        Binding k = local("k", AstType.I32);
        Binding y = local("y", AstType.I32);
        Stmt[] stmts = new Stmt[steps + 2];
        stmts[0] = let(k, i32(1));
        for (int i = 1; i <= steps; i++) {
            stmts[i] = assign(k, bin(Expr.BinaryOp.MUL, bin(Expr.BinaryOp.ADD, ref(k), i32(i)), i32(2)));
        }
        stmts[steps + 1] = ret(bin(Expr.BinaryOp.ADD, ref(x), ref(k)));
        FunctionDecl offset = fn("offset", AstType.I32, body(AstType.I32, stmts), x);
        FunctionDecl main = fn("main", AstType.I32, body(AstType.I32,
                ret(bin(Expr.BinaryOp.MUL, call("offset", AstType.I32, ref(y)), i32(2)))), y);
        return program(offset, main);
    }

    @Test
    void calleesThatShrinkAreInlinedInALaterRound() {
        Module reference = Asts.toSsa(offsetThenDouble(8));
        Module module = Asts.toSsa(offsetThenDouble(8));
        PipelineConfig config = PipelineConfig.defaults();
        assertThat(module.getFunction("offset").insnCount()).isGreaterThanOrEqualTo(config.inlineThreshold);

        OptimizationStats stats = new PassManager(config).run(module);

        assertThat(stats.get(OptimizationStats.Counter.INLINED_CALLS)).isEqualTo(1);
        assertThat(SsaChecks.countOps(module.getFunction("main"), Opcode.CALL)).isZero();
        assertThat(new Interpreter(module).call("main", Constant.i32(3)))
                .isEqualTo(new Interpreter(reference).call("main", Constant.i32(3)));
    }
}
