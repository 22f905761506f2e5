package io.github.kirc.core.regalloc;

import io.github.kirc.core.ssa.RegClass;

import java.util.*;

/**
 * A description of the physical registers of a target, per {@link RegClass}.
 * <p>
 * Each class has a list of allocatable registers, handed out by the allocator,
 * and a list of scratch registers, which are never handed out but hold spilled
 * values for the duration of a single instruction.
 */
public final class TargetDesc {
    public final String name;
    private final Map<RegClass, List<String>> allocatable;
    private final Map<RegClass, List<String>> scratch;

    public TargetDesc(String name,
                      Map<RegClass, List<String>> allocatable,
                      Map<RegClass, List<String>> scratch) {
        this.name = name;
        this.allocatable = copy(allocatable);
        this.scratch = copy(scratch);
    }

    private static Map<RegClass, List<String>> copy(Map<RegClass, List<String>> map) {
        Map<RegClass, List<String>> copied = new EnumMap<>(RegClass.class);
        for (RegClass cls : RegClass.values()) {
            List<String> names = map.get(cls);
            copied.put(cls, names == null
                    ? Collections.emptyList()
                    : Collections.unmodifiableList(new ArrayList<>(names)));
        }
        return copied;
    }

    /**
     * The reference x86-64 description: fourteen integer and fourteen vector registers
     * are allocatable, with two of each reserved as scratch.
     *
     * @return The description.
     */
    public static TargetDesc x86_64() {
        Map<RegClass, List<String>> allocatable = new EnumMap<>(RegClass.class);
        Map<RegClass, List<String>> scratch = new EnumMap<>(RegClass.class);
        allocatable.put(RegClass.INT, Arrays.asList(
                "rax", "rbx", "rcx", "rdx", "rsi", "rdi", "r8", "r9",
                "r12", "r13", "r14", "r15"));
        scratch.put(RegClass.INT, Arrays.asList("r10", "r11"));
        List<String> xmm = new ArrayList<>();
        for (int i = 0; i < 14; i++) {
            xmm.add("xmm" + i);
        }
        allocatable.put(RegClass.FLOAT, xmm);
        scratch.put(RegClass.FLOAT, Arrays.asList("xmm14", "xmm15"));
        return new TargetDesc("x86_64", allocatable, scratch);
    }

    /**
     * A synthetic description with the given number of allocatable registers per class,
     * and two scratch registers per class.
     *
     * @param ints   The number of allocatable integer registers.
     * @param floats The number of allocatable float registers.
     * @return The description.
     */
    public static TargetDesc withCounts(int ints, int floats) {
        return withCounts(ints, floats, 2);
    }

    /**
     * A synthetic description with the given number of allocatable and scratch registers per class.
     *
     * @param ints    The number of allocatable integer registers.
     * @param floats  The number of allocatable float registers.
     * @param scratch The number of scratch registers of each class.
     * @return The description.
     */
    public static TargetDesc withCounts(int ints, int floats, int scratch) {
        Map<RegClass, List<String>> allocatable = new EnumMap<>(RegClass.class);
        Map<RegClass, List<String>> scratchMap = new EnumMap<>(RegClass.class);
        allocatable.put(RegClass.INT, names("r", 0, ints));
        allocatable.put(RegClass.FLOAT, names("f", 0, floats));
        scratchMap.put(RegClass.INT, names("r", ints, scratch));
        scratchMap.put(RegClass.FLOAT, names("f", floats, scratch));
        return new TargetDesc(String.format("synthetic(%d,%d)", ints, floats), allocatable, scratchMap);
    }

    private static List<String> names(String prefix, int from, int count) {
        List<String> names = new ArrayList<>(count);
        for (int i = from; i < from + count; i++) {
            names.add(prefix + i);
        }
        return names;
    }

    public List<String> registers(RegClass cls) {
        return allocatable.get(cls);
    }

    public List<String> scratch(RegClass cls) {
        return scratch.get(cls);
    }

    public int count(RegClass cls) {
        return allocatable.get(cls).size();
    }

    @Override
    public String toString() {
        return name;
    }
}
