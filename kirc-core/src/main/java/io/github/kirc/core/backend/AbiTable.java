package io.github.kirc.core.backend;

import io.github.kirc.core.ssa.RegClass;
import io.github.kirc.core.ssa.Signature;
import io.github.kirc.core.ssa.Type;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A calling convention: where arguments and return values of each register class are passed.
 * <p>
 * Arguments take the registers of their class in order; once those run out they are passed
 * on the stack in eight-byte slots, the whole argument area padded to the stack alignment.
 */
public final class AbiTable {
    private final Map<RegClass, List<String>> argRegisters;
    private final Map<RegClass, String> returnRegisters;
    public final int stackAlignment;

    public AbiTable(Map<RegClass, List<String>> argRegisters, Map<RegClass, String> returnRegisters, int stackAlignment) {
        this.argRegisters = new EnumMap<>(argRegisters);
        this.returnRegisters = new EnumMap<>(returnRegisters);
        this.stackAlignment = stackAlignment;
    }

    /**
     * The reference convention: integers in {@code rdi, rsi, rdx, rcx, r8, r9},
     * floats in {@code xmm0} to {@code xmm7}, returns in {@code rax} or {@code xmm0},
     * and a 16-byte aligned stack.
     *
     * @return The table.
     */
    public static AbiTable x86_64() {
        Map<RegClass, List<String>> args = new EnumMap<>(RegClass.class);
        args.put(RegClass.INT, Arrays.asList("rdi", "rsi", "rdx", "rcx", "r8", "r9"));
        args.put(RegClass.FLOAT, Arrays.asList("xmm0", "xmm1", "xmm2", "xmm3", "xmm4", "xmm5", "xmm6", "xmm7"));
        Map<RegClass, String> rets = new EnumMap<>(RegClass.class);
        rets.put(RegClass.INT, "rax");
        rets.put(RegClass.FLOAT, "xmm0");
        return new AbiTable(args, rets, 16);
    }

    /**
     * Lay out the arguments and return value of a signature.
     *
     * @param signature The signature.
     * @return The layout.
     */
    public FunctionAbi layout(Signature signature) {
        Map<RegClass, Integer> used = new EnumMap<>(RegClass.class);
        List<String> args = new ArrayList<>();
        int stack = 0;
        for (Type param : signature.params) {
            RegClass cls = param.regClass();
            int index = used.getOrDefault(cls, 0);
            List<String> regs = argRegisters.getOrDefault(cls, Collections.emptyList());
            if (index < regs.size()) {
                args.add(regs.get(index));
                used.put(cls, index + 1);
            } else {
                args.add("[sp+" + stack + "]");
                stack += 8;
            }
        }
        int padded = (stack + stackAlignment - 1) / stackAlignment * stackAlignment;
        String ret = signature.returnType == Type.VOID ? null : returnRegisters.get(signature.returnType.regClass());
        return new FunctionAbi(args, ret, padded, stackAlignment);
    }

    /**
     * The calling convention of one signature.
     */
    public static final class FunctionAbi {
        /**
         * Where each argument is passed: a register name or a stack offset.
         */
        public final List<String> args;
        @Nullable
        public final String returnRegister;
        public final int stackArgBytes;
        public final int stackAlignment;

        FunctionAbi(List<String> args, @Nullable String returnRegister, int stackArgBytes, int stackAlignment) {
            this.args = Collections.unmodifiableList(args);
            this.returnRegister = returnRegister;
            this.stackArgBytes = stackArgBytes;
            this.stackAlignment = stackAlignment;
        }

        @Override
        public String toString() {
            return String.format("args [%s], ret %s, stack %d, align %d",
                    String.join(", ", args),
                    returnRegister == null ? "void" : returnRegister,
                    stackArgBytes,
                    stackAlignment);
        }
    }
}
