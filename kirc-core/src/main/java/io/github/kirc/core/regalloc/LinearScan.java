package io.github.kirc.core.regalloc;

import io.github.kirc.core.diag.AllocationExhaustedException;
import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.CommonExts.LiveData;
import io.github.kirc.core.ext.MetadataState;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.passes.IRPass;
import io.github.kirc.core.passes.form.LowerPhis;
import io.github.kirc.core.ssa.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A pass which allocates registers using a linear scan algorithm.
 * <p>
 * Phis are {@link LowerPhis lowered} first if any remain, so the output IR is not in SSA form.
 * Instructions are numbered in block order, each with a position where its operands are read
 * and a later one where its result is written, so a result may take the register of an operand
 * that dies there. Each register's live interval spans its definitions, its uses and every block
 * boundary it is live across. Intervals are swept by start; when no register of the class is free,
 * whichever of the active intervals and the new one ends furthest away is spilled.
 * <p>
 * A spilled register is rewritten out of the function: each definition writes a scratch
 * register which is then {@link Opcode#SPILL spilled} to its slot, and each use
 * {@link Opcode#RELOAD reloads} the slot into a scratch register just before the instruction.
 * The function is frozen once allocated.
 */
public class LinearScan implements IRPass<Function, Allocation> {
    private static final Logger LOGGER = LoggerFactory.getLogger(LinearScan.class);

    private final TargetDesc target;

    public LinearScan(TargetDesc target) {
        this.target = target;
    }

    public TargetDesc getTarget() {
        return target;
    }

    @Override
    public Allocation run(Function func) {
        if (hasPhis(func)) {
            LowerPhis.INSTANCE.runInPlace(func);
        }
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS, MetadataState.LIVE_DATA);

        List<LiveInterval> intervals = computeIntervals(func);
        Map<Register, Location> locations = new HashMap<>();
        int slots = scan(intervals, locations);
        rewriteSpills(func, locations);

        ms.varsChanged();
        func.freeze();
        Allocation allocation = new Allocation(func, target, locations, intervals, slots);
        func.attachExt(CommonExts.ALLOCATION, allocation);
        LOGGER.debug("allocated {} registers of {} for {}, {} spilled",
                intervals.size(), func.name, target, slots);
        return allocation;
    }

    private static boolean hasPhis(Function func) {
        for (BasicBlock block : func.blocks) {
            if (!block.getPhis().isEmpty()) return true;
        }
        return false;
    }

    /**
     * Compute the live interval of every register of a function, sorted by start.
     * Liveness must be valid.
     *
     * @param func The function.
     * @return The intervals.
     */
    public static List<LiveInterval> computeIntervals(Function func) {
        Map<Register, int[]> bounds = new LinkedHashMap<>();
        Map<Register, List<Integer>> uses = new HashMap<>();
        int index = 0;
        for (BasicBlock block : func.blocks) {
            int blockStart = LiveInterval.readPos(index);
            for (Insn insn : block.getInsns()) {
                int read = LiveInterval.readPos(index);
                for (Value arg : insn.args) {
                    if (arg instanceof Register) {
                        extend(bounds, (Register) arg, read);
                        uses.computeIfAbsent((Register) arg, $ -> new ArrayList<>()).add(read);
                    }
                }
                Register result = insn.getResult();
                if (result != null) extend(bounds, result, LiveInterval.writePos(index));
                index++;
            }
            int blockEnd = LiveInterval.writePos(index - 1);
            LiveData live = block.getExtOrThrow(CommonExts.LIVE_DATA);
            for (Register reg : live.liveIn) {
                extend(bounds, reg, blockStart);
            }
            for (Register reg : live.liveOut) {
                // live across the block, and around any back edge leaving it
                extend(bounds, reg, blockEnd);
            }
        }

        List<LiveInterval> intervals = new ArrayList<>();
        for (Map.Entry<Register, int[]> entry : bounds.entrySet()) {
            List<Integer> regUses = new ArrayList<>(uses.getOrDefault(entry.getKey(), Collections.emptyList()));
            Collections.sort(regUses);
            int[] range = entry.getValue();
            intervals.add(new LiveInterval(entry.getKey(), range[0], range[1], regUses));
        }
        intervals.sort(Comparator.<LiveInterval>comparingInt(i -> i.start)
                .thenComparingInt(i -> i.register.id));
        return intervals;
    }

    private static void extend(Map<Register, int[]> bounds, Register reg, int pos) {
        int[] range = bounds.get(reg);
        if (range == null) {
            bounds.put(reg, new int[]{pos, pos});
        } else {
            range[0] = Math.min(range[0], pos);
            range[1] = Math.max(range[1], pos);
        }
    }

    private int scan(List<LiveInterval> intervals, Map<Register, Location> locations) {
        Map<RegClass, TreeSet<Integer>> free = new EnumMap<>(RegClass.class);
        for (RegClass cls : RegClass.values()) {
            TreeSet<Integer> regs = new TreeSet<>();
            for (int i = 0; i < target.count(cls); i++) {
                regs.add(i);
            }
            free.put(cls, regs);
        }

        TreeSet<LiveInterval> active = new TreeSet<>(Comparator.<LiveInterval>comparingInt(i -> i.end)
                .thenComparingInt(i -> i.register.id));
        int slots = 0;
        for (LiveInterval cur : intervals) {
            // expire old intervals
            Iterator<LiveInterval> it = active.iterator();
            while (it.hasNext()) {
                LiveInterval last = it.next();
                if (last.end >= cur.start) {
                    break;
                }
                it.remove();
                PhysReg reg = (PhysReg) Objects.requireNonNull(last.location);
                free.get(reg.regClass).add(reg.index);
            }

            TreeSet<Integer> classFree = free.get(cur.regClass);
            if (!classFree.isEmpty()) {
                cur.location = physReg(cur.regClass, classFree.pollFirst());
                active.add(cur);
                continue;
            }

            LiveInterval victim = null;
            for (LiveInterval candidate : active.descendingSet()) {
                if (candidate.regClass == cur.regClass) {
                    victim = candidate;
                    break;
                }
            }
            if (victim != null && victim.end > cur.end) {
                cur.location = victim.location;
                active.remove(victim);
                active.add(cur);
                victim.location = new StackSlot(victim.regClass, slots++);
                LOGGER.trace("spilled {} in favour of {}", victim.register, cur.register);
            } else {
                cur.location = new StackSlot(cur.regClass, slots++);
            }
        }

        for (LiveInterval interval : intervals) {
            locations.put(interval.register, Objects.requireNonNull(interval.location));
        }
        return slots;
    }

    private PhysReg physReg(RegClass cls, int index) {
        return new PhysReg(cls, index, target.registers(cls).get(index), false);
    }

    private PhysReg scratchReg(Function func, Insn insn, RegClass cls, int index) {
        List<String> scratch = target.scratch(cls);
        if (index >= scratch.size()) {
            throw new AllocationExhaustedException(func.name, String.format(
                    "%s needs more spilled %s operands than the %d scratch registers of %s",
                    insn.op, cls, scratch.size(), target));
        }
        return new PhysReg(cls, target.count(cls) + index, scratch.get(index), true);
    }

    private void rewriteSpills(Function func, Map<Register, Location> locations) {
        for (BasicBlock block : func.blocks) {
            List<Insn> insns = block.getInsns();
            for (int idx = 0; idx < insns.size(); idx++) {
                Insn insn = insns.get(idx);
                Map<Register, Register> reloaded = new HashMap<>();
                int[] used = new int[RegClass.values().length];
                for (int i = 0; i < insn.args.size(); i++) {
                    Value arg = insn.args.get(i);
                    if (!(arg instanceof Register)) continue;
                    Location loc = locations.get(arg);
                    if (!(loc instanceof StackSlot)) continue;
                    Register temp = reloaded.get(arg);
                    if (temp == null) {
                        Register reg = (Register) arg;
                        RegClass cls = reg.type.regClass();
                        temp = func.newReg(reg.type, reg.name);
                        locations.put(temp, scratchReg(func, insn, cls, used[cls.ordinal()]++));
                        insns.add(idx++, Insn.reload(reg.type, ((StackSlot) loc).index).assignTo(temp));
                        reloaded.put(reg, temp);
                    }
                    insn.args.set(i, temp);
                }

                Register result = insn.getResult();
                if (result == null) continue;
                Location loc = locations.get(result);
                if (!(loc instanceof StackSlot)) continue;
                Register temp = func.newReg(result.type, result.name);
                locations.put(temp, scratchReg(func, insn, result.type.regClass(), 0));
                insn.assignTo(temp);
                insns.add(++idx, Insn.spill(temp, ((StackSlot) loc).index));
            }
        }
    }
}
