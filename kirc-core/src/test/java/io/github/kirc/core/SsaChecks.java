package io.github.kirc.core;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.MetadataState;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.passes.meta.ComputeDoms;
import io.github.kirc.core.ssa.*;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Assertions over the structural properties of SSA functions.
 */
public final class SsaChecks {
    private SsaChecks() {
    }

    /**
     * Every register operand is dominated by its unique definition, or for a phi,
     * the definition dominates the end of the incoming block.
     *
     * @param func The function.
     */
    public static void assertDominance(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS, MetadataState.DOMS);

        Map<Register, BasicBlock> defBlock = new HashMap<>();
        Map<Register, Integer> defIndex = new HashMap<>();
        for (BasicBlock block : func.blocks) {
            List<Insn> insns = block.getInsns();
            for (int i = 0; i < insns.size(); i++) {
                Register result = insns.get(i).getResult();
                if (result == null) continue;
                assertThat(defBlock.put(result, block)).as("second definition of %s", result).isNull();
                defIndex.put(result, i);
            }
        }

        for (BasicBlock block : func.blocks) {
            List<Insn> insns = block.getInsns();
            for (int i = 0; i < insns.size(); i++) {
                Insn insn = insns.get(i);
                for (int j = 0; j < insn.args.size(); j++) {
                    Value arg = insn.args.get(j);
                    if (!(arg instanceof Register)) continue;
                    BasicBlock def = defBlock.get(arg);
                    assertThat(def).as("definition of %s", arg).isNotNull();
                    if (insn.op == Opcode.PHI) {
                        assertThat(ComputeDoms.dominates(def, insn.blocks.get(j)))
                                .as("%s dominates the edge into %s", arg, insn)
                                .isTrue();
                    } else if (def == block) {
                        assertThat(defIndex.get(arg)).as("%s defined before %s", arg, insn).isLessThan(i);
                    } else {
                        assertThat(ComputeDoms.dominates(def, block))
                                .as("%s dominates %s", arg, insn)
                                .isTrue();
                    }
                }
            }
        }
    }

    /**
     * Every phi names each predecessor of its block exactly once.
     *
     * @param func The function.
     */
    public static void assertPhisWellFormed(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS);
        for (BasicBlock block : func.blocks) {
            List<BasicBlock> preds = block.getExtOrThrow(CommonExts.PREDS);
            for (Insn phi : block.getPhis()) {
                assertThat(phi.args).hasSameSizeAs(phi.blocks);
                assertThat(new HashSet<>(phi.blocks)).hasSize(phi.blocks.size());
                assertThat(phi.blocks).containsExactlyInAnyOrderElementsOf(new HashSet<>(preds));
            }
        }
    }

    public static int countOps(Function func, Opcode op) {
        int count = 0;
        for (BasicBlock block : func.blocks) {
            for (Insn insn : block.getInsns()) {
                if (insn.op == op) count++;
            }
        }
        return count;
    }
}
