package io.github.kirc.jvm;

import io.github.kirc.core.ast.*;
import io.github.kirc.core.backend.AllocatedModule;
import io.github.kirc.core.diag.UnsupportedOpcodeException;
import io.github.kirc.core.interp.Interpreter;
import io.github.kirc.core.passes.convert.AstToKir;
import io.github.kirc.core.passes.meta.Verify;
import io.github.kirc.core.pipeline.PassManager;
import io.github.kirc.core.pipeline.Passes;
import io.github.kirc.core.pipeline.PipelineConfig;
import io.github.kirc.core.regalloc.TargetDesc;
import io.github.kirc.core.ssa.Constant;
import io.github.kirc.core.ssa.Function;
import io.github.kirc.core.ssa.Module;
import io.github.kirc.core.ssa.Type;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.util.CheckClassAdapter;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class JvmBackendTest {
    private static final Span SPAN = Span.at(1, 1);

    // AST shorthands

    private static Binding var(String name, AstType type) {
        return new Binding(name, type);
    }

    private static Expr lit(AstType type, Object value) {
        return new Expr.Literal(SPAN, type, value);
    }

    private static Expr ref(Binding binding) {
        return new Expr.VarRef(SPAN, binding);
    }

    private static Expr op(Expr.BinaryOp op, Expr lhs, Expr rhs) {
        boolean test = op.ordinal() >= Expr.BinaryOp.EQ.ordinal() && op.ordinal() <= Expr.BinaryOp.GE.ordinal();
        return new Expr.Binary(SPAN, test ? AstType.BOOL : lhs.type, op, lhs, rhs);
    }

    private static Stmt let(Binding binding, Expr init) {
        return new Stmt.Let(SPAN, binding, init);
    }

    private static Stmt set(Binding binding, Expr value) {
        return new Stmt.Assign(SPAN, ref(binding), value);
    }

    private static Stmt ret(Expr value) {
        return new Stmt.Return(SPAN, value);
    }

    private static FunctionDecl fn(String name, AstType ret, Binding[] params, Stmt... body) {
        return new FunctionDecl(SPAN, name, Arrays.asList(params), ret,
                new Expr.BlockExpr(SPAN, ret, Arrays.asList(body), null));
    }

    private static Binding[] params(Binding... params) {
        return params;
    }

    private static Program program(FunctionDecl... functions) {
        return new Program(Collections.emptyList(), Arrays.asList(functions));
    }

    // programs

    /**
     * {@code fn sum(n: i64) -> i64 { let s = 0; for i in 1..=n { s = s + i; } return s; }}
     */
    private static FunctionDecl sum() {
        Binding n = var("n", AstType.I64);
        Binding s = var("s", AstType.I64);
        Binding i = var("i", AstType.I64);
        return fn("sum", AstType.I64, params(n),
                let(s, lit(AstType.I64, 0L)),
                new Stmt.For(SPAN, null, i, lit(AstType.I64, 1L), ref(n), true,
                        set(s, op(Expr.BinaryOp.ADD, ref(s), ref(i)))),
                ret(ref(s)));
    }

    /**
     * {@code fn steps(n: i32) -> i32}, counting the steps of the Collatz sequence from n to 1.
     */
    private static FunctionDecl collatz() {
        Binding n = var("n", AstType.I32);
        Binding c = var("c", AstType.I32);
        return fn("steps", AstType.I32, params(n),
                let(c, lit(AstType.I32, 0L)),
                new Stmt.While(SPAN, null, op(Expr.BinaryOp.NE, ref(n), lit(AstType.I32, 1L)), new Stmt.Block(SPAN, Arrays.asList(
                        new Stmt.If(SPAN,
                                op(Expr.BinaryOp.EQ, op(Expr.BinaryOp.REM, ref(n), lit(AstType.I32, 2L)), lit(AstType.I32, 0L)),
                                set(n, op(Expr.BinaryOp.DIV, ref(n), lit(AstType.I32, 2L))),
                                set(n, op(Expr.BinaryOp.ADD,
                                        op(Expr.BinaryOp.MUL, lit(AstType.I32, 3L), ref(n)), lit(AstType.I32, 1L)))),
                        set(c, op(Expr.BinaryOp.ADD, ref(c), lit(AstType.I32, 1L)))))),
                ret(ref(c)));
    }

    /**
     * {@code fn poly(a, b, c, d: i32) -> i32 { return (a + b) * (c + d) + a * c - b * d + (a ^ d); }}
     */
    private static FunctionDecl poly() {
        Binding a = var("a", AstType.I32);
        Binding b = var("b", AstType.I32);
        Binding c = var("c", AstType.I32);
        Binding d = var("d", AstType.I32);
        Expr product = op(Expr.BinaryOp.MUL, op(Expr.BinaryOp.ADD, ref(a), ref(b)), op(Expr.BinaryOp.ADD, ref(c), ref(d)));
        Expr cross = op(Expr.BinaryOp.SUB, op(Expr.BinaryOp.MUL, ref(a), ref(c)), op(Expr.BinaryOp.MUL, ref(b), ref(d)));
        return fn("poly", AstType.I32, params(a, b, c, d),
                ret(op(Expr.BinaryOp.ADD, op(Expr.BinaryOp.ADD, product, cross), op(Expr.BinaryOp.BIT_XOR, ref(a), ref(d)))));
    }

    /**
     * {@code fn wrap(x: i32) -> i32 { return ((x << 28) >> 28) + x * 65536 * 65536; }}
     */
    private static FunctionDecl wrap() {
        Binding x = var("x", AstType.I32);
        Expr shifted = op(Expr.BinaryOp.SHR, op(Expr.BinaryOp.SHL, ref(x), lit(AstType.I32, 28L)), lit(AstType.I32, 28L));
        Expr overflow = op(Expr.BinaryOp.MUL, op(Expr.BinaryOp.MUL, ref(x), lit(AstType.I32, 65536L)), lit(AstType.I32, 65536L));
        return fn("wrap", AstType.I32, params(x), ret(op(Expr.BinaryOp.ADD, shifted, overflow)));
    }

    /**
     * {@code fn scale(x: i32) -> f64 { let k = 0.5; return (x as f64) * k + 1.0; }}
     */
    private static FunctionDecl scale() {
        Binding x = var("x", AstType.I32);
        Binding k = var("k", AstType.F64);
        return fn("scale", AstType.F64, params(x),
                let(k, lit(AstType.F64, 0.5)),
                ret(op(Expr.BinaryOp.ADD,
                        op(Expr.BinaryOp.MUL, new Expr.Cast(SPAN, AstType.F64, ref(x)), ref(k)),
                        lit(AstType.F64, 1.0))));
    }

    /**
     * {@code fn fact(n: i64) -> i64 { if n <= 1 { return 1; } return n * fact(n - 1); }}
     */
    private static FunctionDecl fact() {
        Binding n = var("n", AstType.I64);
        return fn("fact", AstType.I64, params(n),
                new Stmt.If(SPAN, op(Expr.BinaryOp.LE, ref(n), lit(AstType.I64, 1L)), ret(lit(AstType.I64, 1L)), null),
                ret(op(Expr.BinaryOp.MUL, ref(n), new Expr.Call(SPAN, AstType.I64, "fact",
                        Collections.singletonList(op(Expr.BinaryOp.SUB, ref(n), lit(AstType.I64, 1L)))))));
    }

    // compilation

    private static Module toSsa(Program program) {
        Module module = AstToKir.INSTANCE.run(program);
        for (Function func : module.getFunctions()) {
            if (!func.isDeclaration()) Passes.TO_SSA.run(func);
        }
        Verify.INSTANCE.runInPlace(module);
        return module;
    }

    private static AllocatedModule allocate(Program program, boolean optimize, TargetDesc target) {
        Module module = toSsa(program);
        if (optimize) new PassManager(PipelineConfig.defaults()).run(module);
        return AllocatedModule.allocate(module, target);
    }

    private static Object[] boxed(Function func, long[] args) {
        Object[] boxed = new Object[args.length];
        for (int i = 0; i < args.length; i++) {
            boxed[i] = func.signature.params.get(i).isFloat() ? (Object) (double) args[i] : (Object) args[i];
        }
        return boxed;
    }

    private static Constant[] constants(Function func, long[] args) {
        Constant[] constants = new Constant[args.length];
        for (int i = 0; i < args.length; i++) {
            constants[i] = Constant.of(func.signature.params.get(i), args[i]);
        }
        return constants;
    }

    private static Method method(Class<?> cls, Function func) throws NoSuchMethodException {
        Class<?>[] types = new Class<?>[func.signature.params.size()];
        for (int i = 0; i < types.length; i++) {
            types[i] = func.signature.params.get(i).isFloat() ? double.class : long.class;
        }
        return cls.getMethod(func.name, types);
    }

    private static void assertVerifies(JvmClass jvmClass) {
        StringWriter errors = new StringWriter();
        CheckClassAdapter.verify(new ClassReader(jvmClass.getBytes()), JvmBackendTest.class.getClassLoader(),
                false, new PrintWriter(errors));
        assertThat(errors.toString()).isEmpty();
    }

    /**
     * Compile a program for a target and check every function against the interpreter on each input.
     */
    private static void assertAgrees(Program source, TargetDesc target, boolean optimize, long[]... inputs) throws Exception {
        Module reference = toSsa(source);
        AllocatedModule allocated = allocate(source, optimize, target);
        JvmClass jvmClass = new JvmBackend("kirc.test.Agree", target).emit(allocated);
        assertVerifies(jvmClass);
        Class<?> cls = jvmClass.load();

        for (Function func : reference.getFunctions()) {
            Method method = method(cls, func);
            for (long[] input : inputs) {
                if (input.length != func.signature.params.size()) continue;
                Constant expected = new Interpreter(reference).call(func.name, constants(func, input));
                Object actual = method.invoke(null, boxed(func, input));
                if (func.signature.returnType.isFloat()) {
                    assertThat((Double) actual).as("%s%s", func.name, Arrays.toString(input))
                            .isEqualTo(expected.doubleValue());
                } else {
                    assertThat((Long) actual).as("%s%s", func.name, Arrays.toString(input))
                            .isEqualTo(expected.longValue());
                }
            }
        }
    }

    private static final long[][] ONE_ARG = {{1}, {2}, {7}, {15}, {27}, {-3}};
    private static final long[][] FOUR_ARGS = {{1, 2, 3, 4}, {-5, 7, 100000, 3}, {40000, 50000, -60000, 70000}};

    @Test
    void generatedCodeMatchesTheInterpreter() throws Exception {
        assertAgrees(program(wrap(), scale()), TargetDesc.x86_64(), false, ONE_ARG);
        assertAgrees(program(poly()), TargetDesc.x86_64(), false, FOUR_ARGS);
        assertAgrees(program(fact()), TargetDesc.x86_64(), false, new long[]{1}, new long[]{5}, new long[]{20});
    }

    @Test
    void loopsMatchTheInterpreter() throws Exception {
        assertAgrees(program(sum()), TargetDesc.x86_64(), false, new long[]{0}, new long[]{10}, new long[]{1000});
        assertAgrees(program(collatz()), TargetDesc.x86_64(), false, new long[]{1}, new long[]{6}, new long[]{27});
    }

    @Test
    void optimizedCodeMatchesTheInterpreter() throws Exception {
        assertAgrees(program(sum(), collatz(), poly(), wrap(), scale(), fact()), TargetDesc.x86_64(), true,
                new long[]{10}, new long[]{27}, new long[]{1, 2, 3, 4}, new long[]{-5, 7, 100000, 3});
    }

    @Test
    void spilledCodeMatchesTheInterpreter() throws Exception {
        TargetDesc tight = TargetDesc.withCounts(2, 2);
        AllocatedModule allocated = allocate(program(poly()), false, tight);
        assertThat(allocated.allocationOf(allocated.module.getFunction("poly")).spillCount()).isPositive();

        assertAgrees(program(poly()), tight, false, FOUR_ARGS);
        assertAgrees(program(sum(), collatz()), TargetDesc.withCounts(2, 1), false, new long[]{10}, new long[]{27});
    }

    @Test
    void integerDivisionByZeroThrows() throws Exception {
        Binding a = var("a", AstType.I32);
        Binding b = var("b", AstType.I32);
        Program program = program(fn("div", AstType.I32, params(a, b), ret(op(Expr.BinaryOp.DIV, ref(a), ref(b)))));
        Class<?> cls = new JvmBackend("kirc.test.Div").emit(allocate(program, false, TargetDesc.x86_64())).load();
        Method div = cls.getMethod("div", long.class, long.class);

        assertThat(div.invoke(null, -7L, 2L)).isEqualTo(-3L);
        assertThat(div.invoke(null, (long) Integer.MIN_VALUE, -1L)).isEqualTo((long) Integer.MIN_VALUE);
        Throwable thrown = catchThrowable(() -> div.invoke(null, 1L, 0L));
        assertThat(thrown).isInstanceOf(InvocationTargetException.class);
        assertThat(thrown.getCause()).isInstanceOf(ArithmeticException.class);
    }

    @Test
    void unreachableCodeThrows() throws Exception {
        Binding c = var("c", AstType.BOOL);
        Program program = program(fn("partial", AstType.I32, params(c),
                new Stmt.If(SPAN, ref(c), ret(lit(AstType.I32, 1L)), null)));
        Class<?> cls = new JvmBackend("kirc.test.Partial").emit(allocate(program, false, TargetDesc.x86_64())).load();
        Method partial = cls.getMethod("partial", long.class);

        assertThat(partial.invoke(null, 1L)).isEqualTo(1L);
        Throwable thrown = catchThrowable(() -> partial.invoke(null, 0L));
        assertThat(thrown.getCause())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("reached unreachable code in partial: missing return in partial");
    }

    @Test
    void declarationsBecomeThrowingStubs() throws Exception {
        Binding x = var("x", AstType.I32);
        FunctionDecl ext = new FunctionDecl(SPAN, "ext", Collections.singletonList(var("y", AstType.I32)), AstType.I32, null);
        FunctionDecl caller = fn("caller", AstType.I32, params(x),
                ret(new Expr.Call(SPAN, AstType.I32, "ext", Collections.singletonList(ref(x)))));
        JvmClass jvmClass = new JvmBackend("kirc.test.Stubs").emit(allocate(program(ext, caller), false, TargetDesc.x86_64()));
        assertVerifies(jvmClass);
        Method method = jvmClass.load().getMethod("caller", long.class);

        Throwable thrown = catchThrowable(() -> method.invoke(null, 1L));
        assertThat(thrown.getCause())
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessage("external function ext");
    }

    @Test
    void globalsHaveNoLowering() {
        Binding x = var("x", AstType.I32);
        FunctionDecl bump = fn("bump", AstType.I32, params(x),
                new Stmt.Assign(SPAN, new Expr.GlobalVar(SPAN, AstType.I32, "g"), ref(x)),
                ret(ref(x)));
        Program program = new Program(Collections.singletonList(new GlobalDecl(SPAN, "g", AstType.I32, 0L)),
                Collections.singletonList(bump));
        AllocatedModule allocated = allocate(program, false, TargetDesc.x86_64());

        assertThatThrownBy(() -> new JvmBackend("kirc.test.Globals").emit(allocated))
                .isInstanceOf(UnsupportedOpcodeException.class)
                .hasMessageContaining("for target jvm");
    }

    @Test
    void ssaModulesAreRejected() {
        AllocatedModule ssa = AllocatedModule.ssa(toSsa(program(sum())));

        assertThatThrownBy(() -> new JvmBackend("kirc.test.Ssa").emit(ssa))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void methodsUseWideJvmTypes() throws Exception {
        JvmClass jvmClass = new JvmBackend("kirc.test.Types").emit(allocate(program(scale(), sum()), false, TargetDesc.x86_64()));
        Class<?> cls = jvmClass.load();

        assertThat(cls.getName()).isEqualTo("kirc.test.Types");
        assertThat(cls.getMethod("scale", long.class).getReturnType()).isEqualTo(double.class);
        assertThat(cls.getMethod("sum", long.class).getReturnType()).isEqualTo(long.class);
        assertThat(JvmBackend.jvmType(Type.F32).getDescriptor()).isEqualTo("D");
        assertThat(JvmBackend.jvmType(Type.I1).getDescriptor()).isEqualTo("J");
        assertThat(JvmBackend.jvmType(Type.VOID).getDescriptor()).isEqualTo("V");
    }
}
