package io.github.kirc.core.passes.opts;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.CommonExts.Loop;
import io.github.kirc.core.ext.MetadataState;
import io.github.kirc.core.ops.Folding;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.passes.meta.ComputeLoops;
import io.github.kirc.core.pipeline.FunctionPass;
import io.github.kirc.core.pipeline.OptimizationStats;
import io.github.kirc.core.ssa.*;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A pass which fully unrolls innermost counted loops.
 * <p>
 * A loop qualifies when its header has exactly two predecessors (a preheader and a single
 * latch), the header's conditional branch is the only way out of the loop, and that branch
 * compares an induction phi against a constant, where the phi starts at a constant and is
 * stepped by a constant {@link Opcode#ADD} or {@link Opcode#SUB} on the back edge.
 * The trip count is found by evaluating the induction variable until the condition fails;
 * loops running more than the trip count cap, or which would unroll to more instructions
 * than the size cap, are left intact.
 * <p>
 * The loop's blocks are copied once per iteration, with the induction phi replaced by its
 * constant value in that iteration, followed by a final copy of the header which jumps to
 * the exit. The original blocks, including the loop-control phi and the back edge, are removed.
 */
public class UnrollLoops implements FunctionPass {
    private static final Logger LOGGER = LoggerFactory.getLogger(UnrollLoops.class);

    private final int tripCap;
    private final int sizeCap;

    /**
     * Construct a loop unrolling pass.
     *
     * @param tripCap The largest trip count to unroll.
     * @param sizeCap The largest number of instructions a loop may unroll to.
     */
    public UnrollLoops(int tripCap, int sizeCap) {
        this.tripCap = tripCap;
        this.sizeCap = sizeCap;
    }

    @Override
    public Boolean run(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        Set<BasicBlock> refused = new HashSet<>();
        int unrolled = 0;
        boolean progress = true;
        while (progress) {
            progress = false;
            ms.ensureValid(func, MetadataState.PREDS, MetadataState.DOMS, MetadataState.LOOPS);
            List<Loop> loops = func.getExtOrThrow(CommonExts.LOOPS);
            for (Loop loop : loops) {
                if (refused.contains(loop.header)) continue;
                if (!ComputeLoops.isInnermost(loop, loops)) continue;
                CountedLoop counted = analyze(func, loop);
                if (counted == null) {
                    refused.add(loop.header);
                    continue;
                }
                counted.unroll();
                ms.graphChanged();
                unrolled++;
                progress = true;
                break;
            }
        }
        if (unrolled == 0) return false;
        OptimizationStats.of(func).add(OptimizationStats.Counter.UNROLLED_LOOPS, unrolled);
        return true;
    }

    private void refuse(Function func, Loop loop, String reason) {
        LOGGER.debug("not unrolling the loop at {} in {}: {}", loop.header.toTargetString(), func.name, reason);
    }

    @Nullable
    private CountedLoop analyze(Function func, Loop loop) {
        BasicBlock header = loop.header;
        List<BasicBlock> preds = header.getExtOrThrow(CommonExts.PREDS);
        if (loop.latches.size() != 1 || preds.size() != 2) {
            refuse(func, loop, "it does not have a single preheader and latch");
            return null;
        }
        BasicBlock latch = loop.latches.get(0);
        BasicBlock preheader = preds.get(0) == latch ? preds.get(1) : preds.get(0);

        int size = 0;
        for (BasicBlock block : loop.body) {
            for (Insn insn : block.getInsns()) {
                if (insn.op == Opcode.ALLOCA) {
                    refuse(func, loop, "it allocates");
                    return null;
                }
            }
            if (block == header) continue;
            for (BasicBlock succ : block.successors()) {
                if (!loop.contains(succ)) {
                    refuse(func, loop, "it has an exit besides its header");
                    return null;
                }
            }
            size += block.getInsns().size();
        }

        Insn branch = header.getTerminator();
        if (branch == null || branch.op != Opcode.JUMP_IF) {
            refuse(func, loop, "its header does not end in a conditional branch");
            return null;
        }
        boolean stayOnTrue = loop.contains(branch.blocks.get(0));
        if (stayOnTrue == loop.contains(branch.blocks.get(1))) {
            refuse(func, loop, "its header branch does not leave the loop");
            return null;
        }
        BasicBlock exit = branch.blocks.get(stayOnTrue ? 1 : 0);
        BasicBlock inside = branch.blocks.get(stayOnTrue ? 0 : 1);

        if (!(branch.args.get(0) instanceof Register)) return null;
        Insn cmp = ((Register) branch.args.get(0)).getNullable(CommonExts.ASSIGNED_AT);
        if (cmp == null || !cmp.op.isComparison() || cmp.getNullable(CommonExts.OWNING_BLOCK) != header) {
            refuse(func, loop, "its exit condition is not a comparison in the header");
            return null;
        }
        boolean phiOnLeft = cmp.args.get(1) instanceof Constant;
        Value phiSide = cmp.args.get(phiOnLeft ? 0 : 1);
        Value boundSide = cmp.args.get(phiOnLeft ? 1 : 0);
        if (!(boundSide instanceof Constant) || !(phiSide instanceof Register)) {
            refuse(func, loop, "its exit condition is not against a constant bound");
            return null;
        }
        Insn phi = ((Register) phiSide).getNullable(CommonExts.ASSIGNED_AT);
        if (phi == null || phi.op != Opcode.PHI || phi.getNullable(CommonExts.OWNING_BLOCK) != header
                || !phi.type.isInt()) {
            refuse(func, loop, "its exit condition does not test a header phi");
            return null;
        }
        Value init = phi.args.get(phi.blocks.indexOf(preheader));
        Value next = phi.args.get(phi.blocks.indexOf(latch));
        if (!(init instanceof Constant) || !(next instanceof Register)) {
            refuse(func, loop, "the induction variable does not start at a constant");
            return null;
        }
        Insn stepInsn = ((Register) next).getNullable(CommonExts.ASSIGNED_AT);
        Constant step = stepInsn == null ? null : stepOf(stepInsn, phi.getResult());
        if (step == null || !loop.contains(stepInsn.getExtOrThrow(CommonExts.OWNING_BLOCK))) {
            refuse(func, loop, "the induction variable is not stepped by a constant");
            return null;
        }

        List<Constant> values = new ArrayList<>();
        Constant value = (Constant) init;
        Constant bound = (Constant) boundSide;
        while (true) {
            boolean cond = phiOnLeft
                    ? Folding.compare(cmp.op, value, bound)
                    : Folding.compare(cmp.op, bound, value);
            if (cond != stayOnTrue) break;
            if (values.size() >= tripCap) {
                refuse(func, loop, String.format("its trip count exceeds %d", tripCap));
                return null;
            }
            values.add(value);
            value = Folding.binary(stepInsn.op, phi.type, value, step);
            if (value == null) return null;
        }
        int headerSize = header.getInsns().size();
        if ((long) values.size() * (size + headerSize) + headerSize > sizeCap) {
            refuse(func, loop, String.format("it would unroll to more than %d instructions", sizeCap));
            return null;
        }

        return new CountedLoop(func, loop, preheader, latch, exit, inside, phi, values);
    }

    @Nullable
    private static Constant stepOf(Insn insn, @Nullable Register phi) {
        if (insn.op == Opcode.ADD) {
            if (insn.args.get(0) == phi && insn.args.get(1) instanceof Constant) return (Constant) insn.args.get(1);
            if (insn.args.get(1) == phi && insn.args.get(0) instanceof Constant) return (Constant) insn.args.get(0);
        } else if (insn.op == Opcode.SUB) {
            if (insn.args.get(0) == phi && insn.args.get(1) instanceof Constant) return (Constant) insn.args.get(1);
        }
        return null;
    }

    private static class CountedLoop {
        final Function func;
        final Loop loop;
        final BasicBlock preheader;
        final BasicBlock latch;
        final BasicBlock exit;
        final BasicBlock inside;
        final Insn inductionPhi;
        final List<Constant> values;
        final List<BasicBlock> blocks = new ArrayList<>();

        CountedLoop(Function func, Loop loop, BasicBlock preheader, BasicBlock latch,
                    BasicBlock exit, BasicBlock inside, Insn inductionPhi, List<Constant> values) {
            this.func = func;
            this.loop = loop;
            this.preheader = preheader;
            this.latch = latch;
            this.exit = exit;
            this.inside = inside;
            this.inductionPhi = inductionPhi;
            this.values = values;
            for (BasicBlock block : func.blocks) {
                if (loop.contains(block)) this.blocks.add(block);
            }
        }

        void unroll() {
            BasicBlock header = loop.header;
            int n = values.size();
            List<Map<BasicBlock, BasicBlock>> blockMaps = new ArrayList<>();
            for (int k = 0; k < n; k++) {
                Map<BasicBlock, BasicBlock> blockMap = new HashMap<>();
                for (BasicBlock block : blocks) {
                    blockMap.put(block, new BasicBlock());
                }
                blockMaps.add(blockMap);
            }
            BasicBlock last = new BasicBlock();

            List<BasicBlock> emitted = new ArrayList<>();
            Map<Value, Value> prevValues = null;
            for (int k = 0; k < n; k++) {
                Map<BasicBlock, BasicBlock> blockMap = blockMaps.get(k);
                BasicBlock nextHeader = k + 1 < n ? blockMaps.get(k + 1).get(header) : last;
                Map<Value, Value> valueMap = headerValues(prevValues);
                valueMap.put(inductionPhi.getResult(), values.get(k));
                freshRegisters(valueMap);

                for (BasicBlock block : blocks) {
                    BasicBlock copy = blockMap.get(block);
                    emitted.add(copy);
                    for (Insn insn : block.getInsns()) {
                        if (block == header && insn.op == Opcode.PHI) continue;
                        if (block == header && insn.isTerminator()) {
                            copy.addInsn(Insn.jump(target(inside, blockMap, nextHeader)));
                            continue;
                        }
                        Insn cloned = clone(insn, valueMap);
                        if (insn.op == Opcode.PHI) {
                            for (int i = 0; i < cloned.blocks.size(); i++) {
                                cloned.blocks.set(i, blockMap.getOrDefault(insn.blocks.get(i), insn.blocks.get(i)));
                            }
                        } else if (insn.isTerminator()) {
                            for (int i = 0; i < cloned.blocks.size(); i++) {
                                cloned.blocks.set(i, target(insn.blocks.get(i), blockMap, nextHeader));
                            }
                        }
                        copy.addInsn(cloned);
                    }
                }
                prevValues = valueMap;
            }

            Map<Value, Value> finalValues = headerValues(prevValues);
            freshHeaderRegisters(finalValues);
            for (Insn insn : header.getInsns()) {
                if (insn.op == Opcode.PHI) continue;
                if (insn.isTerminator()) {
                    last.addInsn(Insn.jump(exit));
                    continue;
                }
                last.addInsn(clone(insn, finalValues));
            }
            emitted.add(last);

            BasicBlock firstHeader = n == 0 ? last : blockMaps.get(0).get(header);
            Insn preTerm = Objects.requireNonNull(preheader.getTerminator());
            Collections.replaceAll(preTerm.blocks, header, firstHeader);
            for (Insn exitPhi : exit.getPhis()) {
                Collections.replaceAll(exitPhi.blocks, header, last);
            }

            int at = func.blocks.indexOf(header);
            func.blocks.removeAll(blocks);
            func.blocks.addAll(Math.min(at, func.blocks.size()), emitted);

            Map<Register, Value> outside = new HashMap<>();
            for (Insn insn : header.getInsns()) {
                Register result = insn.getResult();
                if (result != null) outside.put(result, finalValues.get(result));
            }
            IRUtils.substitute(func, outside);
        }

        BasicBlock target(BasicBlock original, Map<BasicBlock, BasicBlock> blockMap, BasicBlock nextHeader) {
            if (original == loop.header) return nextHeader;
            BasicBlock mapped = blockMap.get(original);
            return mapped == null ? original : mapped;
        }

        /**
         * The values of the header phis on entry to an iteration.
         */
        Map<Value, Value> headerValues(@Nullable Map<Value, Value> prevValues) {
            Map<Value, Value> valueMap = new HashMap<>();
            for (Insn phi : loop.header.getPhis()) {
                Value incoming;
                if (prevValues == null) {
                    incoming = phi.args.get(phi.blocks.indexOf(preheader));
                } else {
                    Value fromLatch = phi.args.get(phi.blocks.indexOf(latch));
                    incoming = prevValues.getOrDefault(fromLatch, fromLatch);
                }
                valueMap.put(phi.getResult(), incoming);
            }
            return valueMap;
        }

        void freshRegisters(Map<Value, Value> valueMap) {
            for (BasicBlock block : blocks) {
                for (Insn insn : block.getInsns()) {
                    Register result = insn.getResult();
                    if (result != null && !valueMap.containsKey(result)) {
                        valueMap.put(result, func.newReg(result.type, result.name));
                    }
                }
            }
        }

        void freshHeaderRegisters(Map<Value, Value> valueMap) {
            for (Insn insn : loop.header.getInsns()) {
                Register result = insn.getResult();
                if (result != null && !valueMap.containsKey(result)) {
                    valueMap.put(result, func.newReg(result.type, result.name));
                }
            }
        }

        Insn clone(Insn insn, Map<Value, Value> valueMap) {
            List<Value> args = new ArrayList<>(insn.args.size());
            for (Value arg : insn.args) {
                args.add(valueMap.getOrDefault(arg, arg));
            }
            Object imm = insn.imm instanceof long[] ? ((long[]) insn.imm).clone() : insn.imm;
            Insn cloned = new Insn(insn.op, insn.type, args, insn.blocks, imm);
            Register result = insn.getResult();
            if (result != null) {
                cloned.assignTo((Register) valueMap.get(result));
            }
            insn.getExt(CommonExts.INLINE_CHAIN).ifPresent(chain -> cloned.attachExt(CommonExts.INLINE_CHAIN, chain));
            return cloned;
        }
    }
}
