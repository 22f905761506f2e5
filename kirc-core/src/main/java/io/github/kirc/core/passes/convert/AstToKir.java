package io.github.kirc.core.passes.convert;

import io.github.kirc.core.ast.*;
import io.github.kirc.core.diag.KirException;
import io.github.kirc.core.diag.Stage;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.passes.IRPass;
import io.github.kirc.core.ssa.*;
import io.github.kirc.core.ssa.Module;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Lowers a typed {@link Program} into an unverified KIR {@link Module}.
 * <p>
 * Every parameter and mutable binding lives in an {@link Opcode#ALLOCA} slot at the top of
 * the entry block, read and written with loads and stores; value-producing control flow
 * merges through a temporary slot as well. Promoting slots to registers is left to
 * {@link io.github.kirc.core.passes.form.Mem2Reg}.
 * <p>
 * Code following a {@code return}, {@code break} or {@code continue} is lowered into a
 * fresh block nothing jumps to, and such blocks are dropped once the function is done.
 */
public class AstToKir implements IRPass<Program, Module> {
    /**
     * A singleton instance of this pass.
     */
    public static final AstToKir INSTANCE = new AstToKir();

    @Override
    public Module run(Program program) {
        Module module = new Module();
        for (GlobalDecl decl : program.globals) {
            Type type = valueType(decl.type, decl.span, null);
            Constant init = decl.initializer == null ? null : constantOf(type, decl.initializer, decl.span, null);
            module.addGlobal(new Global(decl.name, type, init));
        }

        Map<FunctionDecl, Function> functions = new LinkedHashMap<>();
        for (FunctionDecl decl : program.functions) {
            List<Type> params = new ArrayList<>();
            for (Binding param : decl.params) {
                params.add(valueType(param.type, decl.span, decl.name));
            }
            Type ret = returnType(decl.returnType, decl.span, decl.name);
            if (module.getFunction(decl.name) != null) {
                throw KirException.internal(Stage.LOWERING, decl.name, "function defined twice", decl.span);
            }
            Function func = module.newFunction(decl.name, new Signature(params, ret));
            func.inline = decl.inline;
            func.pure = decl.pure;
            functions.put(decl, func);
        }
        for (Map.Entry<FunctionDecl, Function> entry : functions.entrySet()) {
            if (entry.getKey().body != null) {
                new FunctionLowering(module, entry.getValue(), entry.getKey()).lower();
            }
        }
        return module;
    }

    private static Type valueType(AstType type, Span span, @Nullable String function) {
        Type irType = type.irType();
        if (irType == null || irType == Type.VOID) {
            throw KirException.internal(Stage.LOWERING, function,
                    String.format("type %s cannot be represented in the IR", type), span);
        }
        return irType;
    }

    private static Type returnType(AstType type, Span span, @Nullable String function) {
        if (type == AstType.UNIT || type == AstType.NEVER) return Type.VOID;
        return valueType(type, span, function);
    }

    private static Constant constantOf(Type type, Object value, Span span, @Nullable String function) {
        if (value instanceof Boolean && type == Type.I1) {
            return Constant.bool((Boolean) value);
        }
        if (value instanceof Number) {
            Number n = (Number) value;
            if (type.isFloat()) return Constant.ofFloat(type, n.doubleValue());
            if (!(value instanceof Double) && !(value instanceof Float)) return Constant.of(type, n.longValue());
        }
        throw KirException.internal(Stage.LOWERING, function,
                String.format("literal %s is not a %s", value, type), span);
    }

    private static class LoopTarget {
        @Nullable
        final String label;
        final BasicBlock breakTarget;
        final BasicBlock continueTarget;

        LoopTarget(@Nullable String label, BasicBlock breakTarget, BasicBlock continueTarget) {
            this.label = label;
            this.breakTarget = breakTarget;
            this.continueTarget = continueTarget;
        }
    }

    private static class FunctionLowering implements Expr.Visitor<Value>, Stmt.Visitor {
        final Module module;
        final Function func;
        final FunctionDecl decl;
        final BasicBlock entry;
        final IRBuilder ib;
        final Map<Binding, Register> slots = new HashMap<>();
        final Deque<LoopTarget> loops = new ArrayDeque<>();
        int allocaCount = 0;

        FunctionLowering(Module module, Function func, FunctionDecl decl) {
            this.module = module;
            this.func = func;
            this.decl = decl;
            entry = func.newBb();
            ib = new IRBuilder(func, entry);
        }

        KirException error(Span span, String format, Object... args) {
            return KirException.internal(Stage.LOWERING, func.name, String.format(format, args), span);
        }

        Type typeOf(AstType type, Span span) {
            return valueType(type, span, func.name);
        }

        void lower() {
            for (int i = 0; i < decl.params.size(); i++) {
                Binding param = decl.params.get(i);
                Type type = func.signature.params.get(i);
                Register slot = slotFor(param, decl.span);
                Register value = ib.param(type, i, param.name);
                ib.insert(Insn.store(slot, value));
            }

            Expr.BlockExpr body = Objects.requireNonNull(decl.body);
            Value tail = body.accept(this);
            if (!ib.isTerminated()) {
                if (func.signature.returnType == Type.VOID) {
                    ib.insertCtrl(Insn.ret(null));
                } else if (tail != null) {
                    ib.insertCtrl(Insn.ret(tail));
                } else {
                    ib.insertCtrl(Insn.unreachable("missing return in " + func.name));
                }
            }

            for (BasicBlock block : func.blocks) {
                if (block.getTerminator() == null) {
                    block.addInsn(Insn.unreachable("unreachable code"));
                }
            }
            dropUnreachable();
        }

        void dropUnreachable() {
            Set<BasicBlock> reached = new HashSet<>();
            Deque<BasicBlock> work = new ArrayDeque<>();
            reached.add(entry);
            work.push(entry);
            while (!work.isEmpty()) {
                for (BasicBlock succ : work.pop().successors()) {
                    if (reached.add(succ)) work.push(succ);
                }
            }
            func.blocks.removeIf(block -> !reached.contains(block));
        }

        Register slotFor(Binding binding, Span span) {
            Register slot = allocate(typeOf(binding.type, span), binding.name);
            slots.put(binding, slot);
            return slot;
        }

        Register allocate(Type type, @Nullable String name) {
            Register slot = func.newReg(Type.PTR, name);
            entry.getInsns().add(allocaCount++, Insn.alloca(type).assignTo(slot));
            return slot;
        }

        Register slotOf(Binding binding, Span span) {
            Register slot = slots.get(binding);
            if (slot == null) throw error(span, "binding %s is not in scope", binding);
            return slot;
        }

        Value load(Type type, Value ptr) {
            return ib.insert(Insn.load(type, ptr), null);
        }

        void jumpTo(BasicBlock target) {
            if (!ib.isTerminated()) ib.insertCtrl(Insn.jump(target));
        }

        void startBlock(BasicBlock block) {
            ib.setBlock(block);
        }

        void startScratch() {
            ib.setBlock(func.newBb());
        }

        Value valueOf(Expr expr) {
            Value value = expr.accept(this);
            if (value == null) throw error(expr.span, "expression of type %s has no value", expr.type);
            return value;
        }

        // expressions

        @Override
        public Value visitLiteral(Expr.Literal expr) {
            if (expr.type == AstType.UNIT) return null;
            return constantOf(typeOf(expr.type, expr.span), expr.value, expr.span, func.name);
        }

        @Override
        public Value visitVarRef(Expr.VarRef expr) {
            return load(typeOf(expr.type, expr.span), slotOf(expr.binding, expr.span));
        }

        @Override
        public Value visitGlobalVar(Expr.GlobalVar expr) {
            return load(typeOf(expr.type, expr.span), globalRef(expr.name, expr.span));
        }

        GlobalRef globalRef(String name, Span span) {
            Global global = module.getGlobal(name);
            if (global == null) throw error(span, "unknown global %s", name);
            return global.ref();
        }

        @Override
        public Value visitUnary(Expr.Unary expr) {
            Value operand = valueOf(expr.operand);
            switch (expr.op) {
                case NEG:
                    return ib.insert(Insn.unary(Opcode.NEG, operand), null);
                case NOT:
                    if (operand.getType() == Type.I1) {
                        return ib.binary(Opcode.XOR, operand, Constant.TRUE);
                    }
                    return ib.insert(Insn.unary(Opcode.NOT, operand), null);
                default:
                    throw new IllegalStateException("unhandled unary operator " + expr.op);
            }
        }

        @Override
        public Value visitBinary(Expr.Binary expr) {
            if (expr.op == Expr.BinaryOp.AND || expr.op == Expr.BinaryOp.OR) {
                return shortCircuit(expr);
            }
            Value lhs = valueOf(expr.lhs);
            Value rhs = valueOf(expr.rhs);
            return ib.binary(binaryOpcode(expr.op), lhs, rhs);
        }

        Opcode binaryOpcode(Expr.BinaryOp op) {
            switch (op) {
                // @formatter:off
                case ADD: return Opcode.ADD;
                case SUB: return Opcode.SUB;
                case MUL: return Opcode.MUL;
                case DIV: return Opcode.DIV;
                case REM: return Opcode.REM;
                case EQ: return Opcode.EQ;
                case NE: return Opcode.NE;
                case LT: return Opcode.LT;
                case LE: return Opcode.LE;
                case GT: return Opcode.GT;
                case GE: return Opcode.GE;
                case BIT_AND: return Opcode.AND;
                case BIT_OR: return Opcode.OR;
                case BIT_XOR: return Opcode.XOR;
                case SHL: return Opcode.SHL;
                case SHR: return Opcode.SHR;
                // @formatter:on
                default:
                    throw new IllegalStateException("unhandled binary operator " + op);
            }
        }

        Value shortCircuit(Expr.Binary expr) {
            boolean isAnd = expr.op == Expr.BinaryOp.AND;
            Register temp = allocate(Type.I1, null);
            Value lhs = valueOf(expr.lhs);
            ib.insert(Insn.store(temp, lhs));
            BasicBlock rhsBlock = func.newBb();
            BasicBlock merge = func.newBb();
            ib.insertCtrl(isAnd ? Insn.jumpIf(lhs, rhsBlock, merge) : Insn.jumpIf(lhs, merge, rhsBlock));

            startBlock(rhsBlock);
            Value rhs = valueOf(expr.rhs);
            ib.insert(Insn.store(temp, rhs));
            jumpTo(merge);

            startBlock(merge);
            return load(Type.I1, temp);
        }

        @Override
        public Value visitCast(Expr.Cast expr) {
            Value operand = valueOf(expr.operand);
            Type from = operand.getType();
            Type to = typeOf(expr.type, expr.span);
            if (from == to) return operand;
            if (to == Type.I1 && from.isInt()) {
                return ib.binary(Opcode.NE, operand, Constant.zero(from));
            }
            Opcode op;
            if (from.isInt() && to.isInt()) {
                if (to.bits > from.bits) {
                    op = from == Type.I1 ? Opcode.ZEXT : Opcode.SEXT;
                } else {
                    op = Opcode.TRUNC;
                }
            } else if (from.isInt() && to.isFloat()) {
                op = Opcode.ITOF;
            } else if (from.isFloat() && to.isInt()) {
                op = Opcode.FTOI;
            } else if (from.isFloat() && to.isFloat()) {
                op = Opcode.FCONV;
            } else {
                throw error(expr.span, "cannot cast %s to %s", from, to);
            }
            return ib.insert(Insn.cast(op, operand, to), null);
        }

        @Override
        public Value visitCall(Expr.Call expr) {
            Function callee = module.getFunction(expr.callee);
            if (callee == null) throw error(expr.span, "call to unknown function %s", expr.callee);
            List<Value> args = new ArrayList<>();
            for (Expr arg : expr.args) {
                args.add(valueOf(arg));
            }
            Type ret = callee.signature.returnType;
            Insn call = Insn.call(ret, callee.name, args);
            if (ret == Type.VOID) {
                ib.insert(call);
                return null;
            }
            return ib.insert(call, null);
        }

        @Override
        public Value visitIf(Expr.If expr) {
            Register temp = expr.type.hasValue() ? allocate(typeOf(expr.type, expr.span), null) : null;
            Value cond = valueOf(expr.cond);
            BasicBlock thenBlock = func.newBb();
            BasicBlock elseBlock = func.newBb();
            BasicBlock merge = func.newBb();
            ib.insertCtrl(Insn.jumpIf(cond, thenBlock, elseBlock));

            startBlock(thenBlock);
            storeBranch(temp, expr.then);
            jumpTo(merge);

            startBlock(elseBlock);
            if (expr.otherwise != null) {
                storeBranch(temp, expr.otherwise);
            }
            jumpTo(merge);

            startBlock(merge);
            return temp == null ? null : load(typeOf(expr.type, expr.span), temp);
        }

        void storeBranch(@Nullable Register temp, Expr branch) {
            Value value = branch.accept(this);
            if (temp != null && value != null && !ib.isTerminated()) {
                ib.insert(Insn.store(temp, value));
            }
        }

        @Override
        public Value visitMatch(Expr.Match expr) {
            Register temp = expr.type.hasValue() ? allocate(typeOf(expr.type, expr.span), null) : null;
            Value scrutinee = valueOf(expr.scrutinee);
            if (!scrutinee.getType().isInt()) {
                throw error(expr.span, "cannot match on %s", scrutinee.getType());
            }
            BasicBlock merge = func.newBb();
            Set<Long> seen = new HashSet<>();
            List<Long> cases = new ArrayList<>();
            List<BasicBlock> targets = new ArrayList<>();
            List<BasicBlock> armBlocks = new ArrayList<>();
            for (Expr.MatchArm arm : expr.arms) {
                BasicBlock armBlock = func.newBb();
                armBlocks.add(armBlock);
                for (long pattern : arm.patterns) {
                    // earlier arms shadow later ones
                    if (seen.add(scrutinee.getType().normalize(pattern))) {
                        cases.add(scrutinee.getType().normalize(pattern));
                        targets.add(armBlock);
                    }
                }
            }
            BasicBlock fallback = func.newBb();
            targets.add(fallback);
            long[] caseArray = new long[cases.size()];
            for (int i = 0; i < caseArray.length; i++) caseArray[i] = cases.get(i);
            ib.insertCtrl(Insn.switchOn(scrutinee, caseArray, targets));

            for (int i = 0; i < armBlocks.size(); i++) {
                startBlock(armBlocks.get(i));
                storeBranch(temp, expr.arms.get(i).body);
                jumpTo(merge);
            }
            startBlock(fallback);
            storeBranch(temp, expr.fallback);
            jumpTo(merge);

            startBlock(merge);
            return temp == null ? null : load(typeOf(expr.type, expr.span), temp);
        }

        @Override
        public Value visitBlock(Expr.BlockExpr expr) {
            for (Stmt stmt : expr.stmts) {
                stmt.accept(this);
            }
            return expr.tail == null ? null : expr.tail.accept(this);
        }

        @Override
        public Value visitAddrOf(Expr.AddrOf expr) {
            return slotOf(expr.binding, expr.span);
        }

        @Override
        public Value visitDeref(Expr.Deref expr) {
            Value ptr = valueOf(expr.pointer);
            return load(typeOf(expr.type, expr.span), ptr);
        }

        // statements

        @Override
        public void visitLet(Stmt.Let stmt) {
            Value init = stmt.init == null ? null : valueOf(stmt.init);
            Register slot = slotFor(stmt.binding, stmt.span);
            if (init != null) {
                ib.insert(Insn.store(slot, init));
            }
        }

        @Override
        public void visitAssign(Stmt.Assign stmt) {
            Value ptr;
            if (stmt.target instanceof Expr.VarRef) {
                ptr = slotOf(((Expr.VarRef) stmt.target).binding, stmt.span);
            } else if (stmt.target instanceof Expr.GlobalVar) {
                ptr = globalRef(((Expr.GlobalVar) stmt.target).name, stmt.span);
            } else if (stmt.target instanceof Expr.Deref) {
                ptr = valueOf(((Expr.Deref) stmt.target).pointer);
            } else {
                throw error(stmt.span, "cannot assign to %s", stmt.target.getClass().getSimpleName());
            }
            Value value = valueOf(stmt.value);
            ib.insert(Insn.store(ptr, value));
        }

        @Override
        public void visitExpr(Stmt.ExprStmt stmt) {
            stmt.expr.accept(this);
        }

        @Override
        public void visitReturn(Stmt.Return stmt) {
            Value value = stmt.value == null ? null : stmt.value.accept(this);
            if (ib.isTerminated()) return;
            ib.insertCtrl(Insn.ret(func.signature.returnType == Type.VOID ? null : value));
            startScratch();
        }

        @Override
        public void visitWhile(Stmt.While stmt) {
            BasicBlock header = func.newBb();
            BasicBlock body = func.newBb();
            BasicBlock exit = func.newBb();
            jumpTo(header);

            startBlock(header);
            Value cond = valueOf(stmt.cond);
            ib.insertCtrl(Insn.jumpIf(cond, body, exit));

            startBlock(body);
            loops.push(new LoopTarget(stmt.label, exit, header));
            stmt.body.accept(this);
            loops.pop();
            jumpTo(header);

            startBlock(exit);
        }

        @Override
        public void visitFor(Stmt.For stmt) {
            Value start = valueOf(stmt.start);
            Value end = valueOf(stmt.end);
            Type type = start.getType();
            if (!type.isInt()) throw error(stmt.span, "cannot iterate over %s", type);
            Register slot = slotFor(stmt.var, stmt.span);
            ib.insert(Insn.store(slot, start));

            BasicBlock header = func.newBb();
            BasicBlock body = func.newBb();
            BasicBlock step = func.newBb();
            BasicBlock exit = func.newBb();
            jumpTo(header);

            startBlock(header);
            Value i = load(type, slot);
            Value cond = ib.binary(stmt.inclusive ? Opcode.LE : Opcode.LT, i, end);
            ib.insertCtrl(Insn.jumpIf(cond, body, exit));

            startBlock(body);
            loops.push(new LoopTarget(stmt.label, exit, step));
            stmt.body.accept(this);
            loops.pop();
            jumpTo(step);

            startBlock(step);
            Value current = load(type, slot);
            if (mayReachMax(stmt, end, type)) {
                // stepping past the type's maximum would wrap around and never fail the header check
                BasicBlock advance = func.newBb();
                ib.insertCtrl(Insn.jumpIf(ib.binary(Opcode.EQ, current, end), exit, advance));
                startBlock(advance);
            }
            ib.insert(Insn.store(slot, ib.binary(Opcode.ADD, current, Constant.of(type, 1))));
            ib.insertCtrl(Insn.jump(header));

            startBlock(exit);
        }

        private boolean mayReachMax(Stmt.For stmt, Value end, Type type) {
            if (!stmt.inclusive) return false;
            long max = type.normalize(type.mask() >>> 1);
            return !(end instanceof Constant) || ((Constant) end).longValue() == max;
        }

        @Override
        public void visitLoop(Stmt.Loop stmt) {
            BasicBlock body = func.newBb();
            BasicBlock exit = func.newBb();
            jumpTo(body);

            startBlock(body);
            loops.push(new LoopTarget(stmt.label, exit, body));
            stmt.body.accept(this);
            loops.pop();
            jumpTo(body);

            startBlock(exit);
        }

        LoopTarget findLoop(@Nullable String label, Span span) {
            for (LoopTarget loop : loops) {
                if (label == null || label.equals(loop.label)) return loop;
            }
            throw error(span, label == null ? "break or continue outside of a loop" : "no loop labelled " + label);
        }

        @Override
        public void visitBreak(Stmt.Break stmt) {
            LoopTarget loop = findLoop(stmt.label, stmt.span);
            jumpTo(loop.breakTarget);
            startScratch();
        }

        @Override
        public void visitContinue(Stmt.Continue stmt) {
            LoopTarget loop = findLoop(stmt.label, stmt.span);
            jumpTo(loop.continueTarget);
            startScratch();
        }

        @Override
        public void visitIf(Stmt.If stmt) {
            Value cond = valueOf(stmt.cond);
            BasicBlock thenBlock = func.newBb();
            BasicBlock merge = func.newBb();
            BasicBlock elseBlock = stmt.otherwise == null ? merge : func.newBb();
            ib.insertCtrl(Insn.jumpIf(cond, thenBlock, elseBlock));

            startBlock(thenBlock);
            stmt.then.accept(this);
            jumpTo(merge);

            if (stmt.otherwise != null) {
                startBlock(elseBlock);
                stmt.otherwise.accept(this);
                jumpTo(merge);
            }

            startBlock(merge);
        }

        @Override
        public void visitBlock(Stmt.Block stmt) {
            for (Stmt inner : stmt.stmts) {
                inner.accept(this);
            }
        }
    }
}
