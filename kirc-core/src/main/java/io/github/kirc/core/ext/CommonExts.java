package io.github.kirc.core.ext;

import io.github.kirc.core.pipeline.OptimizationStats;
import io.github.kirc.core.regalloc.Allocation;
import io.github.kirc.core.ssa.*;
import io.github.kirc.core.ssa.Module;

import java.util.*;

public class CommonExts {
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    public static final Ext<BasicBlock> IDOM = Ext.create(BasicBlock.class, "IDOM");
    public static final Ext<List<BasicBlock>> DOM_CHILDREN = Ext.create(List.class, "DOM_CHILDREN");
    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");
    public static final Ext<Set<BasicBlock>> DOM_FRONTIER = Ext.create(Set.class, "DOM_FRONTIER");
    /**
     * Preorder index of a block in the dominator tree walk, absent for unreachable blocks.
     */
    public static final Ext<Integer> DOM_PREORDER = Ext.create(Integer.class, "DOM_PREORDER");
    public static final Ext<Integer> DOM_SUBTREE_END = Ext.create(Integer.class, "DOM_SUBTREE_END");

    public static final Ext<List<Loop>> LOOPS = Ext.create(List.class, "LOOPS");

    public static final Ext<Insn> ASSIGNED_AT = Ext.create(Insn.class, "ASSIGNED_AT");

    public static final Ext<Module> OWNING_MODULE = Ext.create(Module.class, "OWNING_MODULE");
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");

    public static final Ext<LiveData> LIVE_DATA = Ext.create(LiveData.class, "LIVE_DATA");

    /**
     * The ids of the functions an inlined call site was copied through.
     */
    public static final Ext<Set<Integer>> INLINE_CHAIN = Ext.create(Set.class, "INLINE_CHAIN");

    public static final Ext<OptimizationStats> OPT_STATS = Ext.create(OptimizationStats.class, "OPT_STATS");
    public static final Ext<Allocation> ALLOCATION = Ext.create(Allocation.class, "ALLOCATION");

    public static class LiveData {
        public final Set<Register>
                gen = new HashSet<>(),
                kill = new HashSet<>(),
                liveIn = new LinkedHashSet<>(),
                liveOut = new LinkedHashSet<>();
    }

    /**
     * A natural loop: a header, the blocks of its body (header included) and its back edge sources.
     */
    public static class Loop {
        public final BasicBlock header;
        public final Set<BasicBlock> body = new LinkedHashSet<>();
        public final List<BasicBlock> latches = new ArrayList<>();

        public Loop(BasicBlock header) {
            this.header = header;
        }

        public boolean contains(BasicBlock block) {
            return body.contains(block);
        }
    }
}
