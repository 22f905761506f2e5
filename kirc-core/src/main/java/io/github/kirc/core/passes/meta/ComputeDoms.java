package io.github.kirc.core.passes.meta;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ext.MetadataState;
import io.github.kirc.core.passes.InPlaceIRPass;
import io.github.kirc.core.ssa.BasicBlock;
import io.github.kirc.core.ssa.Function;

import java.util.*;

/**
 * Computes {@link CommonExts#IDOM} and {@link CommonExts#DOM_CHILDREN} for each reachable block,
 * and a preorder numbering of the dominator tree for constant-time dominance queries.
 * <p>
 * Unreachable blocks get no dominator information.
 */
/*
 Thomas Lengauer and Robert Endre Tarjan. A fast algorithm for finding dominators in a flow-graph.
 ACM Transactions on Programming Languages and Systems, 1(1):121-141, July 1979.
 (the "simple" variant, with path compression but without balanced linking)
*/
public class ComputeDoms implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    @Override
    public void runInPlace(Function func) {
        List<BasicBlock> blocks = func.blocks;
        int size = blocks.size();
        Map<BasicBlock, Integer> index = new HashMap<>();
        for (int i = 0; i < size; i++) {
            BasicBlock block = blocks.get(i);
            index.put(block, i + 1);
            block.removeExt(CommonExts.IDOM);
            block.removeExt(CommonExts.DOM_PREORDER);
            block.removeExt(CommonExts.DOM_SUBTREE_END);
            block.attachExt(CommonExts.DOM_CHILDREN, new ArrayList<>());
        }

        class Runner {
            int n = 0;
            final int[][] succ = new int[size + 1][];
            final int[] dom = new int[size + 1];
            final int[] parent = new int[size + 1];
            final int[] ancestor = new int[size + 1];
            final int[] vertex = new int[size + 1];
            final int[] label = new int[size + 1];
            final int[] semi = new int[size + 1];
            @SuppressWarnings("unchecked")
            final List<Integer>[] pred = new List[size + 1];
            @SuppressWarnings("unchecked")
            final List<Integer>[] bucket = new List[size + 1];

            void dfs(int v) {
                semi[v] = ++n;
                vertex[n] = label[v] = v;
                ancestor[v] = 0;
                for (int w : succ[v]) {
                    if (semi[w] == 0) {
                        parent[w] = v;
                        dfs(w);
                    }
                    pred[w].add(v);
                }
            }

            void compress(int v) {
                if (ancestor[ancestor[v]] != 0) {
                    compress(ancestor[v]);
                    if (semi[label[ancestor[v]]] < semi[label[v]]) {
                        label[v] = label[ancestor[v]];
                    }
                    ancestor[v] = ancestor[ancestor[v]];
                }
            }

            int eval(int v) {
                if (ancestor[v] == 0) return v;
                compress(v);
                return label[v];
            }

            void run() {
                for (int v = 1; v <= size; v++) {
                    BasicBlock block = blocks.get(v - 1);
                    List<Integer> targets = new ArrayList<>();
                    for (BasicBlock target : new LinkedHashSet<>(block.successors())) {
                        Integer t = index.get(target);
                        if (t != null) targets.add(t);
                    }
                    succ[v] = new int[targets.size()];
                    for (int j = 0; j < succ[v].length; j++) {
                        succ[v][j] = targets.get(j);
                    }
                    pred[v] = new ArrayList<>();
                    bucket[v] = new ArrayList<>();
                }
                dfs(1);
                for (int i = n; i >= 2; i--) {
                    int w = vertex[i];
                    for (int v : pred[w]) {
                        int u = eval(v);
                        if (semi[u] < semi[w]) {
                            semi[w] = semi[u];
                        }
                    }
                    bucket[vertex[semi[w]]].add(w);
                    ancestor[w] = parent[w];
                    for (int v : bucket[parent[w]]) {
                        int u = eval(v);
                        dom[v] = semi[u] < semi[v] ? u : parent[w];
                    }
                    bucket[parent[w]].clear();
                }
                for (int i = 2; i <= n; i++) {
                    int w = vertex[i];
                    if (dom[w] != vertex[semi[w]]) {
                        dom[w] = dom[dom[w]];
                    }
                }

                for (int i = 2; i <= n; i++) {
                    int w = vertex[i];
                    BasicBlock block = blocks.get(w - 1);
                    BasicBlock idom = blocks.get(dom[w] - 1);
                    block.attachExt(CommonExts.IDOM, idom);
                }
            }
        }
        if (size > 0) {
            new Runner().run();
        }

        for (BasicBlock block : blocks) {
            BasicBlock idom = block.getNullable(CommonExts.IDOM);
            if (idom != null) {
                idom.getExtOrThrow(CommonExts.DOM_CHILDREN).add(block);
            }
        }
        if (size > 0) {
            numberTree(blocks.get(0));
        }

        func.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.DOMS);
    }

    private static void numberTree(BasicBlock root) {
        int counter = 0;
        Deque<BasicBlock> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            BasicBlock block = stack.pop();
            if (block.getNullable(CommonExts.DOM_PREORDER) != null) {
                block.attachExt(CommonExts.DOM_SUBTREE_END, counter - 1);
                continue;
            }
            block.attachExt(CommonExts.DOM_PREORDER, counter++);
            stack.push(block);
            List<BasicBlock> children = block.getExtOrThrow(CommonExts.DOM_CHILDREN);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    /**
     * Whether {@code a} dominates {@code b}. Requires valid {@link MetadataState#DOMS}.
     *
     * @param a The potential dominator.
     * @param b The block.
     * @return Whether every path from the entry to {@code b} goes through {@code a}.
     */
    public static boolean dominates(BasicBlock a, BasicBlock b) {
        Integer aPre = a.getNullable(CommonExts.DOM_PREORDER);
        Integer bPre = b.getNullable(CommonExts.DOM_PREORDER);
        if (aPre == null || bPre == null) return false;
        return aPre <= bPre && bPre <= a.getExtOrThrow(CommonExts.DOM_SUBTREE_END);
    }

    /**
     * Whether a block is reachable from the entry. Requires valid {@link MetadataState#DOMS}.
     *
     * @param block The block.
     * @return Whether the block is reachable.
     */
    public static boolean isReachable(BasicBlock block) {
        return block.getNullable(CommonExts.DOM_PREORDER) != null;
    }
}
