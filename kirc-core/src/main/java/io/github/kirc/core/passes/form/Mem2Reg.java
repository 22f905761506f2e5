package io.github.kirc.core.passes.form;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.Ext;
import io.github.kirc.core.ext.MetadataState;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.passes.InPlaceIRPass;
import io.github.kirc.core.passes.meta.ComputeDoms;
import io.github.kirc.core.ssa.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Promotes stack slots whose address never escapes into SSA registers.
 * <p>
 * An {@link Opcode#ALLOCA} is promoted when its result only ever appears as the address
 * operand of non-volatile {@link Opcode#LOAD}s and {@link Opcode#STORE}s of its allocated type.
 * Phis are placed on the iterated dominance frontier of the blocks storing to it, then the
 * dominator tree is walked depth-first, replacing each load with the value reaching it.
 * Loads no store reaches read {@link Undef}.
 * <p>
 * Phi operands follow the order of {@link CommonExts#PREDS}, so the result is deterministic.
 */
public class Mem2Reg implements InPlaceIRPass<Function> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Mem2Reg.class);

    /**
     * A singleton instance of this pass.
     */
    public static final Mem2Reg INSTANCE = new Mem2Reg();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS, MetadataState.DOMS, MetadataState.DOM_FRONTIER);

        Map<Register, Insn> candidates = findCandidates(func);
        if (candidates.isEmpty()) {
            ms.validate(MetadataState.SSA_FORM);
            return;
        }

        class BlockData {
            final Map<Register, Insn> phis = new LinkedHashMap<>();
        }
        Ext<BlockData> bdExt = Ext.create(BlockData.class, "blockData");
        for (BasicBlock block : func.blocks) {
            block.attachExt(bdExt, new BlockData());
        }

        Map<Register, Set<BasicBlock>> storedIn = new HashMap<>();
        for (BasicBlock block : func.blocks) {
            if (!ComputeDoms.isReachable(block)) continue;
            for (Insn insn : block.getInsns()) {
                if (insn.op == Opcode.STORE && candidates.containsKey(insn.args.get(0))) {
                    storedIn.computeIfAbsent((Register) insn.args.get(0), $ -> new LinkedHashSet<>()).add(block);
                }
            }
        }

        for (Register slot : candidates.keySet()) {
            Type type = candidates.get(slot).getAllocatedType();
            Deque<BasicBlock> workList = new ArrayDeque<>(storedIn.getOrDefault(slot, Collections.emptySet()));
            while (!workList.isEmpty()) {
                BasicBlock next = workList.pop();
                for (BasicBlock fBlock : next.getExtOrThrow(CommonExts.DOM_FRONTIER)) {
                    Map<Register, Insn> phis = fBlock.getExtOrThrow(bdExt).phis;
                    if (phis.containsKey(slot)) continue;
                    List<BasicBlock> preds = fBlock.getExtOrThrow(CommonExts.PREDS);
                    List<Value> placeholders = new ArrayList<>(Collections.nCopies(preds.size(), Undef.of(type)));
                    Insn phi = Insn.phi(type, new ArrayList<>(preds), placeholders)
                            .assignTo(func.newReg(type, slot.name));
                    phis.put(slot, phi);
                    workList.push(fBlock);
                }
            }
        }
        for (BasicBlock block : func.blocks) {
            block.getInsns().addAll(0, block.getExtOrThrow(bdExt).phis.values());
        }

        Map<Register, Value> replacements = new HashMap<>();

        class Renamer {
            final Map<Register, List<Value>> valueStacks = new HashMap<>();

            Value top(Register slot) {
                List<Value> stack = valueStacks.get(slot);
                if (stack != null && !stack.isEmpty()) {
                    return stack.get(stack.size() - 1);
                }
                return Undef.of(candidates.get(slot).getAllocatedType());
            }

            void push(Register slot, Value value, Map<Register, Integer> pushed) {
                List<Value> stack = valueStacks.computeIfAbsent(slot, $ -> new ArrayList<>());
                pushed.putIfAbsent(slot, stack.size());
                stack.add(value);
            }

            void dfs(BasicBlock block) {
                Map<Register, Integer> pushed = new HashMap<>();
                BlockData data = block.getExtOrThrow(bdExt);
                for (Map.Entry<Register, Insn> entry : data.phis.entrySet()) {
                    push(entry.getKey(), entry.getValue().getResult(), pushed);
                }

                ListIterator<Insn> iter = block.getInsns().listIterator();
                while (iter.hasNext()) {
                    Insn insn = iter.next();
                    if (insn.op == Opcode.LOAD && candidates.containsKey(insn.args.get(0))) {
                        Register result = insn.getResult();
                        if (result != null) {
                            replacements.put(result, top((Register) insn.args.get(0)));
                        }
                        iter.remove();
                    } else if (insn.op == Opcode.STORE && candidates.containsKey(insn.args.get(0))) {
                        push((Register) insn.args.get(0), IRUtils.resolve(insn.args.get(1), replacements), pushed);
                        iter.remove();
                    } else if (insn.op == Opcode.ALLOCA && candidates.containsKey(insn.getResult())) {
                        iter.remove();
                    }
                }

                for (BasicBlock succ : new LinkedHashSet<>(block.successors())) {
                    for (Map.Entry<Register, Insn> entry : succ.getExtOrThrow(bdExt).phis.entrySet()) {
                        Insn phi = entry.getValue();
                        int index = phi.blocks.indexOf(block);
                        phi.args.set(index, top(entry.getKey()));
                    }
                }

                for (BasicBlock child : block.getExtOrThrow(CommonExts.DOM_CHILDREN)) {
                    dfs(child);
                }

                for (Map.Entry<Register, Integer> entry : pushed.entrySet()) {
                    List<Value> stack = valueStacks.get(entry.getKey());
                    stack.subList(entry.getValue(), stack.size()).clear();
                }
            }
        }
        new Renamer().dfs(func.entry());

        // promoted accesses in blocks the walk never reached
        for (BasicBlock block : func.blocks) {
            block.removeExt(bdExt);
            if (ComputeDoms.isReachable(block)) continue;
            Iterator<Insn> iter = block.getInsns().iterator();
            while (iter.hasNext()) {
                Insn insn = iter.next();
                if (insn.op == Opcode.LOAD && candidates.containsKey(insn.args.get(0))) {
                    if (insn.getResult() != null) {
                        replacements.put(insn.getResult(), Undef.of(insn.type));
                    }
                    iter.remove();
                } else if ((insn.op == Opcode.STORE && candidates.containsKey(insn.args.get(0)))
                        || (insn.op == Opcode.ALLOCA && candidates.containsKey(insn.getResult()))) {
                    iter.remove();
                }
            }
        }
        IRUtils.substitute(func, replacements);

        LOGGER.debug("promoted {} stack slots of {}", candidates.size(), func.name);
        ms.varsChanged();
        ms.validate(MetadataState.SSA_FORM);
    }

    /**
     * Find the allocas whose address is only ever used to load or store a value of the allocated type.
     *
     * @param func The function.
     * @return The promotable allocas, by result.
     */
    static Map<Register, Insn> findCandidates(Function func) {
        Map<Register, Insn> candidates = new LinkedHashMap<>();
        for (BasicBlock block : func.blocks) {
            for (Insn insn : block.getInsns()) {
                if (insn.op == Opcode.ALLOCA && insn.getResult() != null) {
                    candidates.put(insn.getResult(), insn);
                }
            }
        }
        for (BasicBlock block : func.blocks) {
            for (Insn insn : block.getInsns()) {
                for (int i = 0; i < insn.args.size(); i++) {
                    Value arg = insn.args.get(i);
                    Insn alloca = candidates.get(arg);
                    if (alloca == null) continue;
                    if (!isPromotableAccess(insn, i, alloca.getAllocatedType())) {
                        candidates.remove(arg);
                    }
                }
            }
        }
        return candidates;
    }

    private static boolean isPromotableAccess(Insn insn, int index, Type allocated) {
        if (index != 0 || insn.isVolatile()) return false;
        if (insn.op == Opcode.LOAD) return insn.type == allocated;
        if (insn.op == Opcode.STORE) return insn.args.get(1).getType() == allocated;
        return false;
    }
}
