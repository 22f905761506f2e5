package io.github.kirc.core.passes.form;

import io.github.kirc.core.Asts;
import io.github.kirc.core.SsaChecks;
import io.github.kirc.core.ast.AstType;
import io.github.kirc.core.ast.Binding;
import io.github.kirc.core.ast.Expr;
import io.github.kirc.core.ast.Span;
import io.github.kirc.core.ast.Stmt;
import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.MetadataState;
import io.github.kirc.core.interp.Interpreter;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.passes.convert.AstToKir;
import io.github.kirc.core.ssa.*;
import io.github.kirc.core.ssa.Module;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.kirc.core.Asts.*;
import static org.assertj.core.api.Assertions.assertThat;

class Mem2RegTest {
    @Test
    void diamondGetsOnePhiInMerge() {
        Module module = Asts.toSsa(program(diamond()));
        Function pick = module.getFunction("pick");

        Insn phi = null;
        BasicBlock merge = null;
        for (BasicBlock block : pick.blocks) {
            for (Insn candidate : block.getPhis()) {
                assertThat(phi).as("only one phi").isNull();
                phi = candidate;
                merge = block;
            }
        }
        assertThat(phi).isNotNull();
        assertThat(phi.args).hasSize(2);

        List<BasicBlock> preds = merge.getExtOrThrow(CommonExts.PREDS);
        assertThat(phi.blocks).containsExactlyInAnyOrderElementsOf(preds);
        BasicBlock entry = pick.entry();
        assertThat(entry.successors()).containsExactlyInAnyOrderElementsOf(phi.blocks);

        assertThat(SsaChecks.countOps(pick, Opcode.ALLOCA)).isZero();
        assertThat(SsaChecks.countOps(pick, Opcode.LOAD)).isZero();
        assertThat(pick.getExtOrThrow(CommonExts.METADATA_STATE).isValid(MetadataState.SSA_FORM)).isTrue();
    }

    @Test
    void promotedCodeBehavesTheSame() {
        Interpreter before = new Interpreter(AstToKir.INSTANCE.run(program(diamond(), sumTo(null))));
        Interpreter after = new Interpreter(Asts.toSsa(program(diamond(), sumTo(null))));
        for (int n = 0; n < 6; n++) {
            assertThat(after.call("sum", Constant.i32(n))).isEqualTo(before.call("sum", Constant.i32(n)));
        }
        assertThat(after.call("pick", Constant.TRUE, Constant.i32(4), Constant.i32(9)))
                .isEqualTo(Constant.i32(5));
        assertThat(after.call("pick", Constant.FALSE, Constant.i32(4), Constant.i32(9)))
                .isEqualTo(Constant.i32(18));
    }

    @Test
    void definitionsDominateUses() {
        Binding x = local("x", AstType.I32);
        Binding n = local("n", AstType.I32);
        Binding i = local("i", AstType.I32);
        // nested loops and early exits
        Module module = Asts.toSsa(program(diamond(), sumTo(null), sumTo("sumToFour", 4),
                fn("nested", AstType.I32, body(AstType.I32,
                        let(x, i32(0)),
                        forRange(i, i32(0), ref(n), false, block(
                                loopWhile(bin(Expr.BinaryOp.LT, ref(x), ref(i)),
                                        assign(x, bin(Expr.BinaryOp.ADD, ref(x), i32(2)))),
                                when(bin(Expr.BinaryOp.GT, ref(x), i32(50)), brk(), null))),
                        ret(ref(x))), n)));

        for (Function func : module.getFunctions()) {
            SsaChecks.assertDominance(func);
            SsaChecks.assertPhisWellFormed(func);
        }
        assertThat(module.getFunctions()).hasSize(4);
        Interpreter interpreter = new Interpreter(module);
        assertThat(interpreter.call("nested", Constant.i32(10))).isEqualTo(Constant.i32(10));
        assertThat(interpreter.call("sumToFour")).isEqualTo(Constant.i32(10));
    }

    @Test
    void escapingSlotsStayInMemory() {
        Binding x = local("x", AstType.I32);
        Binding p = local("p", AstType.PTR);
        Expr deref = new Expr.Deref(Span.NONE, AstType.I32, ref(p));
        Module module = Asts.toSsa(program(fn("escape", AstType.I32, body(AstType.I32,
                let(x, i32(3)),
                let(p, new Expr.AddrOf(Span.NONE, x)),
                new Stmt.Assign(Span.NONE, deref, bin(Expr.BinaryOp.ADD, deref, i32(4))),
                ret(ref(x))))));

        Function escape = module.getFunction("escape");
        // the pointer itself is promoted, the slot it points to is not
        assertThat(SsaChecks.countOps(escape, Opcode.ALLOCA)).isEqualTo(1);
        assertThat(new Interpreter(module).call("escape")).isEqualTo(Constant.i32(7));
    }
}
