package io.github.kirc.core.ext;

import io.github.kirc.core.passes.IRPass;
import io.github.kirc.core.passes.meta.*;
import io.github.kirc.core.ssa.Function;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Tracks which derived analyses of a {@link Function} are currently up to date.
 * <p>
 * Passes that read an analysis call {@link #ensureValid(Object, ComputableMetaKind[])},
 * and passes that mutate the function call {@link #graphChanged()} or {@link #varsChanged()}.
 */
public class MetadataState {
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        public final int id = COUNTER.getAndIncrement();
        public final String name;

        private MetaKind(String name) {
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            return this == o;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(id);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static class ComputableMetaKind<T> extends MetaKind {
        private final Supplier<IRPass<T, T>> pass;

        private ComputableMetaKind(String name, Supplier<IRPass<T, T>> pass) {
            super(name);
            this.pass = pass;
        }

        void computeFor(T t) {
            IRPass<T, T> p = pass.get();
            if (!p.isInPlace()) throw new IllegalArgumentException(name + " is not computed in place");
            p.run(t);
        }
    }

    /**
     * Set once promotion has run and the function is in SSA form; cleared when phis are lowered.
     */
    public static final MetaKind SSA_FORM = new MetaKind("SSA_FORM");

    public static final ComputableMetaKind<Function>
            PREDS = new ComputableMetaKind<>("PREDS", () -> ComputePreds.INSTANCE),
            DOMS = new ComputableMetaKind<>("DOMS", () -> ComputeDoms.INSTANCE),
            DOM_FRONTIER = new ComputableMetaKind<>("DOM_FRONTIER", () -> ComputeDomFrontier.INSTANCE),
            LOOPS = new ComputableMetaKind<>("LOOPS", () -> ComputeLoops.INSTANCE),
            LIVE_DATA = new ComputableMetaKind<>("LIVE_DATA", () -> ComputeLiveVars.INSTANCE);

    private final BitSet validSet = new BitSet();

    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T>... kinds) {
        for (ComputableMetaKind<T> kind : kinds) {
            if (!isValid(kind)) {
                kind.computeFor(t);
                validate(kind);
            }
        }
    }

    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, true);
        }
    }

    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, false);
        }
    }

    public void graphChanged() {
        invalidate(PREDS, DOMS, DOM_FRONTIER, LOOPS);
        varsChanged();
    }

    public void varsChanged() {
        invalidate(LIVE_DATA);
    }
}
