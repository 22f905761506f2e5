package io.github.kirc.core.passes.meta;

import io.github.kirc.core.diag.MalformedIrException;
import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ops.Intrinsics;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.passes.InPlaceIRPass;
import io.github.kirc.core.ssa.*;
import io.github.kirc.core.ssa.Module;

import java.util.*;

/**
 * Checks the structural invariants of a module, throwing a {@link MalformedIrException}
 * for the first one found violated.
 * <p>
 * Checks run in order: module-level names and call targets, then for each function its
 * block structure, its CFG edges, its phis, single definition and dominance of registers,
 * and finally the typing rule of every instruction.
 * <p>
 * The only state this touches is the cached predecessor and dominator analyses,
 * which are recomputed from scratch.
 * <p>
 * Only functions that have not had their phis lowered are valid input, since lowering
 * phis assigns the same register once per predecessor.
 */
public class Verify implements InPlaceIRPass<Module> {
    /**
     * A singleton instance of this pass.
     */
    public static final Verify INSTANCE = new Verify();

    @Override
    public void runInPlace(Module module) {
        Set<String> names = new HashSet<>();
        for (Function func : module.getFunctions()) {
            if (!names.add(func.name)) {
                throw new MalformedIrException(func.name, "duplicate function name");
            }
        }
        for (Function func : module.getFunctions()) {
            verifyFunction(module, func);
        }
    }

    /**
     * Verify a single function of its owning module.
     *
     * @param func The function.
     */
    public void verifyFunction(Function func) {
        verifyFunction(func.getExtOrThrow(CommonExts.OWNING_MODULE), func);
    }

    private void verifyFunction(Module module, Function func) {
        if (func.isDeclaration()) return;
        new FunctionVerifier(module, func).run();
    }

    private static class FunctionVerifier {
        final Module module;
        final Function func;
        final Map<Register, Insn> defs = new HashMap<>();
        final Map<Insn, Integer> positions = new HashMap<>();

        FunctionVerifier(Module module, Function func) {
            this.module = module;
            this.func = func;
        }

        MalformedIrException fail(String format, Object... args) {
            return new MalformedIrException(func.name, String.format(format, args));
        }

        void run() {
            checkBlocks();
            checkEdges();

            ComputePreds.INSTANCE.run(func);
            ComputeDoms.INSTANCE.run(func);

            checkPhis();
            checkDefinitions();
            checkDominance();
            for (BasicBlock block : func.blocks) {
                for (Insn insn : block.getInsns()) {
                    checkTyping(insn);
                }
            }
        }

        void checkBlocks() {
            for (BasicBlock block : func.blocks) {
                if (block.getNullable(CommonExts.OWNING_FUNCTION) != func) {
                    throw fail("block %s is not owned by this function", block.toTargetString());
                }
                List<Insn> insns = block.getInsns();
                if (insns.isEmpty()) {
                    throw fail("block %s is empty", block.toTargetString());
                }
                boolean pastPhis = false;
                for (int i = 0; i < insns.size(); i++) {
                    Insn insn = insns.get(i);
                    if (insn.getNullable(CommonExts.OWNING_BLOCK) != block) {
                        throw fail("instruction %s in %s is not owned by its block", insn, block.toTargetString());
                    }
                    boolean last = i == insns.size() - 1;
                    if (insn.isTerminator() && !last) {
                        throw fail("terminator %s in the middle of %s", insn, block.toTargetString());
                    }
                    if (last && !insn.isTerminator()) {
                        throw fail("block %s is missing a terminator", block.toTargetString());
                    }
                    if (insn.op == Opcode.PHI) {
                        if (pastPhis) {
                            throw fail("phi %s after non-phi instructions in %s", insn, block.toTargetString());
                        }
                    } else {
                        pastPhis = true;
                    }
                    positions.put(insn, i);
                }
            }
        }

        void checkEdges() {
            for (BasicBlock block : func.blocks) {
                for (Insn insn : block.getInsns()) {
                    for (BasicBlock target : insn.blocks) {
                        if (target.getNullable(CommonExts.OWNING_FUNCTION) != func) {
                            throw fail("%s in %s refers to dangling block %s",
                                    insn.op, block.toTargetString(), target.toTargetString());
                        }
                    }
                }
            }
        }

        void checkPhis() {
            BasicBlock entry = func.entry();
            if (!entry.getExtOrThrow(CommonExts.PREDS).isEmpty()) {
                throw fail("entry block has predecessors %s", labels(entry.getExtOrThrow(CommonExts.PREDS)));
            }
            for (BasicBlock block : func.blocks) {
                List<BasicBlock> preds = block.getExtOrThrow(CommonExts.PREDS);
                for (Insn phi : block.getPhis()) {
                    if (phi.args.size() != phi.blocks.size()) {
                        throw fail("phi %s has %d operands for %d incoming blocks",
                                phi, phi.args.size(), phi.blocks.size());
                    }
                    if (phi.blocks.size() != preds.size()) {
                        throw fail("phi %s in %s has %d operands but the block has %d predecessors",
                                phi, block.toTargetString(), phi.blocks.size(), preds.size());
                    }
                    Set<BasicBlock> seen = new HashSet<>();
                    for (BasicBlock incoming : phi.blocks) {
                        if (!seen.add(incoming)) {
                            throw fail("phi %s names predecessor %s twice", phi, incoming.toTargetString());
                        }
                        if (!preds.contains(incoming)) {
                            throw fail("phi %s names %s, which is not a predecessor of %s",
                                    phi, incoming.toTargetString(), block.toTargetString());
                        }
                    }
                }
            }
        }

        void checkDefinitions() {
            for (BasicBlock block : func.blocks) {
                for (Insn insn : block.getInsns()) {
                    Register result = insn.getResult();
                    if (result == null) continue;
                    Insn prev = defs.put(result, insn);
                    if (prev != null) {
                        throw fail("register %s is defined twice, by %s and %s", result, prev, insn);
                    }
                }
            }
        }

        void checkDominance() {
            for (BasicBlock block : func.blocks) {
                if (!ComputeDoms.isReachable(block)) continue;
                for (Insn insn : block.getInsns()) {
                    for (int i = 0; i < insn.args.size(); i++) {
                        Value arg = insn.args.get(i);
                        if (!(arg instanceof Register)) continue;
                        Insn def = defs.get(arg);
                        if (def == null) {
                            throw fail("register %s used by %s is never defined", arg, insn);
                        }
                        if (insn.op == Opcode.PHI) {
                            BasicBlock pred = insn.blocks.get(i);
                            if (ComputeDoms.isReachable(pred) && !dominatesEnd(def, pred)) {
                                throw fail("phi operand %s does not dominate the end of %s",
                                        arg, pred.toTargetString());
                            }
                        } else if (!dominatesUse(def, insn, block)) {
                            throw fail("definition of %s does not dominate its use in %s", arg, insn);
                        }
                    }
                }
            }
        }

        boolean dominatesEnd(Insn def, BasicBlock block) {
            return ComputeDoms.dominates(def.getExtOrThrow(CommonExts.OWNING_BLOCK), block);
        }

        boolean dominatesUse(Insn def, Insn use, BasicBlock useBlock) {
            BasicBlock defBlock = def.getExtOrThrow(CommonExts.OWNING_BLOCK);
            if (defBlock == useBlock) {
                return positions.get(def) < positions.get(use);
            }
            return ComputeDoms.dominates(defBlock, useBlock);
        }

        void checkTyping(Insn insn) {
            Register result = insn.getResult();
            if (result != null && result.type != insn.type) {
                throw fail("%s assigns %s to a register of type %s", insn, insn.type, result.type);
            }
            if (insn.type == Type.VOID && result != null) {
                throw fail("void instruction %s has a result", insn);
            }
            for (Value arg : insn.args) {
                if (arg.getType() == Type.VOID) {
                    throw fail("%s has a void operand", insn);
                }
                if (arg instanceof GlobalRef && module.getGlobal(((GlobalRef) arg).name) == null) {
                    throw fail("%s refers to unknown global %s", insn, arg);
                }
            }
            if (!insn.isTerminator() && !insn.blocks.isEmpty() && insn.op != Opcode.PHI) {
                throw fail("non-terminator %s has block operands", insn);
            }

            List<Value> args = insn.args;
            Type t = insn.type;
            switch (insn.op.typing) {
                case NONE:
                    expectArity(insn, 0);
                    expectType(insn, t == Type.VOID);
                    expectBlocks(insn, insn.op == Opcode.JUMP ? 1 : 0);
                    break;
                case BRANCH:
                    expectArity(insn, 1);
                    expectType(insn, args.get(0).getType() == Type.I1);
                    expectBlocks(insn, 2);
                    break;
                case SELECTOR: {
                    expectArity(insn, 1);
                    expectType(insn, args.get(0).getType().isInt());
                    if (!(insn.imm instanceof long[])) throw fail("%s has no case values", insn);
                    long[] cases = (long[]) insn.imm;
                    expectBlocks(insn, cases.length + 1);
                    Set<Long> seen = new HashSet<>();
                    for (long c : cases) {
                        if (!seen.add(c)) throw fail("%s has duplicate case %d", insn, c);
                    }
                    break;
                }
                case RETURN: {
                    Type ret = func.signature.returnType;
                    if (ret == Type.VOID) {
                        expectArity(insn, 0);
                    } else {
                        expectArity(insn, 1);
                        if (args.get(0).getType() != ret) {
                            throw fail("%s returns %s from a function returning %s", insn, args.get(0).getType(), ret);
                        }
                    }
                    break;
                }
                case ALLOCATE:
                    expectArity(insn, 0);
                    expectType(insn, t == Type.PTR
                            && insn.imm instanceof Type && insn.imm != Type.VOID);
                    break;
                case READ:
                    expectArity(insn, 1);
                    expectType(insn, args.get(0).getType() == Type.PTR && t != Type.VOID);
                    break;
                case WRITE:
                    expectArity(insn, 2);
                    expectType(insn, args.get(0).getType() == Type.PTR && t == Type.VOID);
                    break;
                case FILL:
                    expectOperands(insn, Type.VOID, Type.PTR, Type.I8, Type.I64);
                    break;
                case TRANSFER:
                    expectOperands(insn, Type.VOID, Type.PTR, Type.PTR, Type.I64);
                    break;
                case OFFSET:
                    expectOperands(insn, Type.PTR, Type.PTR, Type.I64);
                    break;
                case NUMERIC_BINARY:
                    expectOperands(insn, t, t, t);
                    expectType(insn, t.isNumeric());
                    break;
                case NUMERIC_UNARY:
                    expectOperands(insn, t, t);
                    expectType(insn, t.isNumeric());
                    break;
                case INTEGER_BINARY:
                    expectOperands(insn, t, t, t);
                    expectType(insn, t.isInt());
                    break;
                case INTEGER_UNARY:
                    expectOperands(insn, t, t);
                    expectType(insn, t.isInt());
                    break;
                case COMPARE: {
                    expectArity(insn, 2);
                    Type operand = args.get(0).getType();
                    expectType(insn, t == Type.I1 && args.get(1).getType() == operand
                            && (operand.isNumeric() || operand == Type.PTR));
                    break;
                }
                case NARROW:
                    expectArity(insn, 1);
                    expectType(insn, t.isInt() && args.get(0).getType().isInt() && t.bits < args.get(0).getType().bits);
                    break;
                case WIDEN:
                    expectArity(insn, 1);
                    expectType(insn, t.isInt() && args.get(0).getType().isInt() && t.bits > args.get(0).getType().bits);
                    break;
                case INT_TO_FLOAT:
                    expectArity(insn, 1);
                    expectType(insn, t.isFloat() && args.get(0).getType().isInt());
                    break;
                case FLOAT_TO_INT:
                    expectArity(insn, 1);
                    expectType(insn, t.isInt() && args.get(0).getType().isFloat());
                    break;
                case FLOAT_TO_FLOAT:
                    expectArity(insn, 1);
                    expectType(insn, t.isFloat() && args.get(0).getType().isFloat() && t != args.get(0).getType());
                    break;
                case ATOMIC_READ:
                    expectOperands(insn, t, Type.PTR);
                    expectType(insn, t.isInt());
                    break;
                case ATOMIC_WRITE:
                    expectArity(insn, 2);
                    expectType(insn, t == Type.VOID && args.get(0).getType() == Type.PTR
                            && args.get(1).getType().isInt());
                    break;
                case ATOMIC_MODIFY:
                    expectOperands(insn, t, Type.PTR, t);
                    expectType(insn, t.isInt());
                    break;
                case ATOMIC_EXCHANGE:
                    expectOperands(insn, t, Type.PTR, t, t);
                    expectType(insn, t.isInt());
                    break;
                case OPAQUE: {
                    if (!(insn.imm instanceof String)) throw fail("%s has no intrinsic name", insn);
                    Type[] types = new Type[args.size()];
                    for (int i = 0; i < types.length; i++) types[i] = args.get(i).getType();
                    expectType(insn, Intrinsics.typeChecks((String) insn.imm, t, types));
                    break;
                }
                case CALL:
                    checkCall(insn);
                    break;
                case PARAM: {
                    expectArity(insn, 0);
                    if (!(insn.imm instanceof Integer)) throw fail("%s has no parameter index", insn);
                    int index = (Integer) insn.imm;
                    List<Type> params = func.signature.params;
                    if (index < 0 || index >= params.size()) {
                        throw fail("%s reads parameter %d of %d", insn, index, params.size());
                    }
                    expectType(insn, params.get(index) == t);
                    break;
                }
                case IDENTITY:
                    expectOperands(insn, t, t);
                    break;
                case STORE_SLOT:
                    expectArity(insn, 1);
                    expectType(insn, t == Type.VOID);
                    break;
                case LOAD_SLOT:
                    expectArity(insn, 0);
                    expectType(insn, t != Type.VOID);
                    break;
                case MERGE:
                    for (Value arg : args) {
                        if (arg.getType() != t) {
                            throw fail("phi %s of type %s has an operand of type %s", insn, t, arg.getType());
                        }
                    }
                    break;
                default:
                    throw new IllegalStateException("unhandled typing rule " + insn.op.typing);
            }
        }

        void checkCall(Insn insn) {
            if (!(insn.imm instanceof String)) throw fail("%s has no callee", insn);
            Function callee = module.getFunction((String) insn.imm);
            if (callee == null) {
                throw fail("call to unknown function %s", insn.imm);
            }
            List<Type> params = callee.signature.params;
            if (params.size() != insn.args.size()) {
                throw fail("call to %s passes %d arguments, expected %d",
                        callee.name, insn.args.size(), params.size());
            }
            for (int i = 0; i < params.size(); i++) {
                if (insn.args.get(i).getType() != params.get(i)) {
                    throw fail("argument %d of call to %s is %s, expected %s",
                            i, callee.name, insn.args.get(i).getType(), params.get(i));
                }
            }
            if (callee.signature.returnType != insn.type) {
                throw fail("call to %s produces %s, but %s returns %s",
                        callee.name, insn.type, callee.name, callee.signature.returnType);
            }
        }

        void expectArity(Insn insn, int arity) {
            if (insn.args.size() != arity) {
                throw fail("%s has %d operands, expected %d", insn, insn.args.size(), arity);
            }
        }

        void expectBlocks(Insn insn, int count) {
            if (insn.blocks.size() != count) {
                throw fail("%s has %d targets, expected %d", insn, insn.blocks.size(), count);
            }
        }

        void expectOperands(Insn insn, Type result, Type... operands) {
            expectArity(insn, operands.length);
            if (insn.type != result) {
                throw fail("%s has type %s, expected %s", insn, insn.type, result);
            }
            for (int i = 0; i < operands.length; i++) {
                if (insn.args.get(i).getType() != operands[i]) {
                    throw fail("operand %d of %s is %s, expected %s", i, insn, insn.args.get(i).getType(), operands[i]);
                }
            }
        }

        void expectType(Insn insn, boolean ok) {
            if (!ok) {
                throw fail("%s violates the typing rule %s", insn, insn.op.typing);
            }
        }

        String labels(List<BasicBlock> blocks) {
            StringJoiner sj = new StringJoiner(", ", "[", "]");
            for (BasicBlock block : blocks) sj.add(block.toTargetString());
            return sj.toString();
        }
    }
}
