package io.github.kirc.core.passes.opts;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.MetadataState;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.pipeline.FunctionPass;
import io.github.kirc.core.ssa.*;

import java.util.*;

/**
 * A pass which merges a block ending in an unconditional jump with its target,
 * where the block is the target's only predecessor.
 */
public class CollapseJumps implements FunctionPass {
    /**
     * A singleton instance of this pass.
     */
    public static final CollapseJumps INSTANCE = new CollapseJumps();

    @Override
    public Boolean run(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS);

        BasicBlock entry = func.entry();
        Map<BasicBlock, BasicBlock> killed = new HashMap<>();
        Map<Register, Value> replacements = new HashMap<>();
        for (BasicBlock block : func.blocks) {
            if (killed.containsKey(block)) continue;
            while (true) {
                Insn terminator = block.getTerminator();
                if (terminator == null || terminator.op != Opcode.JUMP) break;
                BasicBlock target = terminator.blocks.get(0);
                if (target == block || target == entry) break;
                if (target.getExtOrThrow(CommonExts.PREDS).size() != 1) break;

                // a single predecessor leaves every phi with exactly one operand
                List<Insn> insns = new ArrayList<>(target.getInsns());
                target.getInsns().clear();
                List<Insn> blockInsns = block.getInsns();
                blockInsns.remove(blockInsns.size() - 1);
                for (Insn insn : insns) {
                    if (insn.op == Opcode.PHI) {
                        Register result = insn.getResult();
                        if (result != null) replacements.put(result, insn.args.get(0));
                        insn.assignTo(null);
                        continue;
                    }
                    blockInsns.add(insn);
                }

                killed.put(target, block);
            }
        }
        if (killed.isEmpty()) return false;

        func.blocks.removeAll(killed.keySet());
        for (BasicBlock block : func.blocks) {
            for (Insn phi : block.getPhis()) {
                ListIterator<BasicBlock> li = phi.blocks.listIterator();
                while (li.hasNext()) {
                    BasicBlock bb = li.next();
                    while (killed.containsKey(bb)) {
                        bb = killed.get(bb);
                    }
                    li.set(bb);
                }
            }
        }
        IRUtils.substitute(func, replacements);

        ms.graphChanged();
        return true;
    }
}
