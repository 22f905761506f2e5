package io.github.kirc.core.ssa;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ops.Opcode;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Copies the body of a callee into a caller in place of one call site.
 * <p>
 * The call's block is split at the call; the callee's blocks are copied with fresh
 * registers, its parameters replaced by the call's arguments, and each return
 * jumps to the continuation block, where a phi merges the returned values if there is
 * more than one return.
 */
public class Inliner {
    private final Map<Register, Value> valueMap = new HashMap<>();
    private final Map<BasicBlock, BasicBlock> blockMap = new HashMap<>();
    private final Map<BasicBlock, Value> returnValues = new LinkedHashMap<>();
    private final Function caller;

    public Inliner(Function caller) {
        this.caller = caller;
    }

    /**
     * Inline {@code callee} at {@code call}, which must be a {@link Opcode#CALL} in {@link #caller}.
     *
     * @param call   The call site.
     * @param callee The function being called.
     * @return The continuation block, where execution resumes after the inlined body.
     */
    public BasicBlock inline(Insn call, Function callee) {
        BasicBlock callBlock = call.getExtOrThrow(CommonExts.OWNING_BLOCK);
        if (callee.isDeclaration()) throw new IllegalArgumentException("cannot inline declaration " + callee.name);

        Set<Integer> chain = new HashSet<>(call.getExt(CommonExts.INLINE_CHAIN).orElse(Collections.emptySet()));
        chain.add(callee.id);

        List<Insn> insns = callBlock.getInsns();
        int callIdx = insns.indexOf(call);
        BasicBlock cont = new BasicBlock();
        caller.blocks.add(caller.blocks.indexOf(callBlock) + 1, cont);
        List<Insn> tail = new ArrayList<>(insns.subList(callIdx + 1, insns.size()));
        insns.subList(callIdx, insns.size()).clear();
        for (Insn insn : tail) {
            cont.addInsn(insn);
        }
        for (BasicBlock succ : new LinkedHashSet<>(cont.successors())) {
            for (Insn phi : succ.getPhis()) {
                Collections.replaceAll(phi.blocks, callBlock, cont);
            }
        }

        for (int i = 0; i < call.args.size(); i++) {
            bindParam(callee, i, call.args.get(i));
        }

        int insertAt = caller.blocks.indexOf(cont);
        for (BasicBlock calleeBb : callee.blocks) {
            BasicBlock copy = refreshBb(calleeBb);
            caller.blocks.add(insertAt++, copy);
            for (Insn insn : calleeBb.getInsns()) {
                if (insn.op == Opcode.PARAM) continue;
                if (insn.op == Opcode.RET) {
                    returnValues.put(copy, insn.args.isEmpty() ? null : refresh(insn.args.get(0)));
                    copy.addInsn(Insn.jump(cont));
                    continue;
                }
                Insn cloned = new Insn(insn.op, insn.type, refreshAll(insn.args), refreshBbs(insn.blocks), cloneImm(insn.imm));
                Register result = insn.getResult();
                if (result != null) {
                    cloned.assignTo((Register) refresh(result));
                }
                if (insn.op == Opcode.CALL) {
                    Set<Integer> clonedChain = new HashSet<>(chain);
                    insn.getExt(CommonExts.INLINE_CHAIN).ifPresent(clonedChain::addAll);
                    cloned.attachExt(CommonExts.INLINE_CHAIN, clonedChain);
                }
                copy.addInsn(cloned);
            }
        }
        callBlock.addInsn(Insn.jump(blockMap.get(callee.entry())));

        Register result = call.getResult();
        if (result != null) {
            Value replacement;
            if (returnValues.isEmpty()) {
                replacement = Undef.of(result.type);
            } else if (returnValues.size() == 1) {
                replacement = returnValues.values().iterator().next();
            } else {
                cont.getInsns().add(0, Insn.phi(result.type,
                        new ArrayList<>(returnValues.keySet()),
                        new ArrayList<>(returnValues.values())).assignTo(result));
                replacement = null;
            }
            if (replacement != null) {
                call.assignTo(null);
                IRUtils.replaceAllUses(caller, result, replacement);
            }
        }
        caller.getExtOrThrow(CommonExts.METADATA_STATE).graphChanged();
        return cont;
    }

    private void bindParam(Function callee, int index, Value arg) {
        for (BasicBlock block : callee.blocks) {
            for (Insn insn : block.getInsns()) {
                if (insn.op == Opcode.PARAM && insn.getParamIndex() == index && insn.getResult() != null) {
                    valueMap.put(insn.getResult(), arg);
                }
            }
        }
    }

    @Nullable
    private static Object cloneImm(@Nullable Object imm) {
        return imm instanceof long[] ? ((long[]) imm).clone() : imm;
    }

    private BasicBlock refreshBb(BasicBlock block) {
        return blockMap.computeIfAbsent(block, $ -> new BasicBlock());
    }

    private List<BasicBlock> refreshBbs(List<BasicBlock> blocks) {
        List<BasicBlock> ret = new ArrayList<>(blocks.size());
        for (BasicBlock block : blocks) {
            ret.add(refreshBb(block));
        }
        return ret;
    }

    private Value refresh(Value value) {
        if (!(value instanceof Register)) return value;
        Register reg = (Register) value;
        return valueMap.computeIfAbsent(reg, old -> caller.newReg(old.type, old.name));
    }

    private List<Value> refreshAll(List<Value> values) {
        List<Value> ret = new ArrayList<>(values.size());
        for (Value value : values) {
            ret.add(refresh(value));
        }
        return ret;
    }
}
