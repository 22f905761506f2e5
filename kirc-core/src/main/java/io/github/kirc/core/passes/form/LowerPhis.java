package io.github.kirc.core.passes.form;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.MetadataState;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.passes.InPlaceIRPass;
import io.github.kirc.core.ssa.*;

import java.util.List;

/**
 * A pass which lowers {@link Opcode#PHI phi} nodes into copies.
 * <p>
 * Each phi gets a fresh temporary register. Every predecessor copies its incoming value
 * into the temporary just before its terminator, and the phi itself becomes a copy
 * out of the temporary. Since all temporaries are written before any phi result is,
 * phis reading each other's results stay correct, and no edge has to be split.
 * <p>
 * The input should be in SSA form, but the output will not be.
 * This is the first step of register allocation.
 */
public class LowerPhis implements InPlaceIRPass<Function> {
    /**
     * An instance of this pass.
     */
    public static final LowerPhis INSTANCE = new LowerPhis();

    @Override
    public void runInPlace(Function func) {
        for (BasicBlock block : func.blocks) {
            List<Insn> insns = block.getInsns();
            for (int idx = 0; idx < insns.size(); idx++) {
                Insn phi = insns.get(idx);
                if (phi.op != Opcode.PHI) {
                    break;
                }
                Register dest = phi.getResult();
                Register temp = func.newReg(phi.type, dest == null ? null : dest.name);
                List<BasicBlock> preds = phi.blocks;
                List<Value> values = phi.args;
                for (int i = 0; i < preds.size(); i++) {
                    // a self loop puts the copy after us, which leaves idx valid
                    preds.get(i).insertBeforeTerminator(Insn.copy(values.get(i)).assignTo(temp));
                }
                phi.assignTo(null);
                insns.set(idx, Insn.copy(temp).assignTo(dest));
            }
        }

        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.invalidate(MetadataState.SSA_FORM);
        ms.varsChanged();
    }
}
