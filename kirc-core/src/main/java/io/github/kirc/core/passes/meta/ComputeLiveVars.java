package io.github.kirc.core.passes.meta;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.CommonExts.LiveData;
import io.github.kirc.core.ext.MetadataState;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.passes.InPlaceIRPass;
import io.github.kirc.core.ssa.*;

import java.util.*;

/**
 * Computes the {@link CommonExts#LIVE_DATA} for each block.
 * <p>
 * A phi operand is treated as used at the end of its incoming block, not in the phi's block.
 */
public class ComputeLiveVars implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeLiveVars INSTANCE = new ComputeLiveVars();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS);

        for (BasicBlock block : func.blocks) {
            block.attachExt(CommonExts.LIVE_DATA, new LiveData());
        }
        for (BasicBlock block : func.blocks) {
            LiveData data = block.getExtOrThrow(CommonExts.LIVE_DATA);
            Set<Register> used = data.gen;
            Set<Register> assigned = data.kill;

            for (Insn insn : block.getInsns()) {
                if (insn.op == Opcode.PHI) {
                    for (int i = 0; i < insn.args.size(); i++) {
                        Value arg = insn.args.get(i);
                        if (arg instanceof Register) {
                            LiveData predData = insn.blocks.get(i).getNullable(CommonExts.LIVE_DATA);
                            // the operand is live out of the predecessor
                            if (predData != null) predData.liveOut.add((Register) arg);
                        }
                    }
                } else {
                    for (Value arg : insn.args) {
                        if (arg instanceof Register && !assigned.contains(arg)) used.add((Register) arg);
                    }
                }
                if (insn.getResult() != null) assigned.add(insn.getResult());
            }
        }
        for (BasicBlock block : func.blocks) {
            LiveData data = block.getExtOrThrow(CommonExts.LIVE_DATA);
            data.liveIn.addAll(data.gen);
            for (Register reg : data.liveOut) {
                if (!data.kill.contains(reg)) data.liveIn.add(reg);
            }
        }

        Set<BasicBlock> workQueue = new LinkedHashSet<>();
        for (ListIterator<BasicBlock> li = func.blocks.listIterator(func.blocks.size()); li.hasPrevious(); ) {
            workQueue.add(li.previous());
        }
        while (!workQueue.isEmpty()) {
            Iterator<BasicBlock> iterator = workQueue.iterator();
            BasicBlock next = iterator.next();
            iterator.remove();
            LiveData data = next.getExtOrThrow(CommonExts.LIVE_DATA);
            boolean changed = false;
            for (BasicBlock succ : new LinkedHashSet<>(next.successors())) {
                LiveData succData = succ.getNullable(CommonExts.LIVE_DATA);
                if (succData == null) continue;
                for (Register regIn : succData.liveIn) {
                    if (data.liveOut.add(regIn) && !data.kill.contains(regIn)) {
                        data.liveIn.add(regIn);
                        changed = true;
                    }
                }
            }
            if (changed) {
                workQueue.addAll(next.getExtOrThrow(CommonExts.PREDS));
            }
        }

        ms.validate(MetadataState.LIVE_DATA);
    }
}
