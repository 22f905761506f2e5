package io.github.kirc.core.passes.meta;

import io.github.kirc.core.ext.CommonExts;
import io.github.kirc.core.ops.Opcode;
import io.github.kirc.core.passes.InPlaceIRPass;
import io.github.kirc.core.ssa.BasicBlock;
import io.github.kirc.core.ssa.Function;
import io.github.kirc.core.ssa.Insn;
import io.github.kirc.core.ssa.Module;
import io.github.kirc.core.ssa.Register;

import java.util.*;

/**
 * Marks defined functions {@link Function#pure pure} when nothing they execute has an
 * observable effect, iterating until no more functions can be marked.
 * <p>
 * A call to a pure function may be deleted, so a function is only pure if every call to it
 * returns: it may not trap, load from memory it did not allocate, or contain a loop.
 * Functions reachable only through a recursive cycle are never marked for the same reason.
 */
public class InferPurity implements InPlaceIRPass<Module> {
    /**
     * A singleton instance of this pass.
     */
    public static final InferPurity INSTANCE = new InferPurity();

    @Override
    public void runInPlace(Module module) {
        boolean changed;
        do {
            changed = false;
            for (Function func : module.getFunctions()) {
                if (func.pure || func.isDeclaration()) continue;
                if (isPure(func)) {
                    func.pure = true;
                    changed = true;
                }
            }
        } while (changed);
    }

    private static boolean isPure(Function func) {
        if (hasCycle(func)) return false;
        for (BasicBlock block : func.blocks) {
            for (Insn insn : block.getInsns()) {
                if (insn.mayTrap()) return false;
                switch (insn.op) {
                    case JUMP:
                    case JUMP_IF:
                    case SWITCH:
                    case RET:
                        continue;
                    case LOAD:
                    case STORE:
                        // the function's own stack slots are always in bounds and invisible to callers
                        if (isLocalSlot(insn)) continue;
                        return false;
                    case UNREACHABLE:
                        return false;
                    default:
                        if (insn.hasSideEffects()) return false;
                }
            }
        }
        return true;
    }

    private static boolean isLocalSlot(Insn access) {
        if (!(access.args.get(0) instanceof Register)) return false;
        Insn def = ((Register) access.args.get(0)).getNullable(CommonExts.ASSIGNED_AT);
        return def != null && def.op == Opcode.ALLOCA;
    }

    private static boolean hasCycle(Function func) {
        Set<BasicBlock> done = new HashSet<>();
        Set<BasicBlock> onPath = new HashSet<>();
        Deque<Iterator<BasicBlock>> stack = new ArrayDeque<>();
        Deque<BasicBlock> path = new ArrayDeque<>();
        BasicBlock entry = func.entry();
        onPath.add(entry);
        path.push(entry);
        stack.push(entry.successors().iterator());
        while (!stack.isEmpty()) {
            Iterator<BasicBlock> it = stack.peek();
            if (!it.hasNext()) {
                stack.pop();
                BasicBlock finished = path.pop();
                onPath.remove(finished);
                done.add(finished);
                continue;
            }
            BasicBlock succ = it.next();
            if (onPath.contains(succ)) return true;
            if (done.contains(succ)) continue;
            onPath.add(succ);
            path.push(succ);
            stack.push(succ.successors().iterator());
        }
        return false;
    }
}
