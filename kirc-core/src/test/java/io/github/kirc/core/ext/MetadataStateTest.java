package io.github.kirc.core.ext;

import io.github.kirc.core.Asts;
import io.github.kirc.core.ssa.Function;
import io.github.kirc.core.ssa.Module;
import org.junit.jupiter.api.Test;

import static io.github.kirc.core.Asts.*;
import static org.assertj.core.api.Assertions.assertThat;

class MetadataStateTest {
    private static Function sum() {
        Module module = Asts.toSsa(program(sumTo(null)));
        return module.getFunction("sum");
    }

    @Test
    void changingVariablesOnlyInvalidatesLiveness() {
        Function func = sum();
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS, MetadataState.DOMS, MetadataState.LIVE_DATA);

        ms.varsChanged();

        assertThat(ms.isValid(MetadataState.LIVE_DATA)).isFalse();
        assertThat(ms.isValid(MetadataState.PREDS)).isTrue();
        assertThat(ms.isValid(MetadataState.DOMS)).isTrue();
    }

    @Test
    void changingTheGraphInvalidatesEveryAnalysis() {
        Function func = sum();
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS, MetadataState.DOMS, MetadataState.LOOPS, MetadataState.LIVE_DATA);

        ms.graphChanged();

        assertThat(ms.isValid(MetadataState.PREDS)).isFalse();
        assertThat(ms.isValid(MetadataState.DOMS)).isFalse();
        assertThat(ms.isValid(MetadataState.LOOPS)).isFalse();
        assertThat(ms.isValid(MetadataState.LIVE_DATA)).isFalse();

        ms.ensureValid(func, MetadataState.LIVE_DATA);
        assertThat(ms.isValid(MetadataState.LIVE_DATA)).isTrue();
        assertThat(func.entry().getNullable(CommonExts.LIVE_DATA)).isNotNull();
    }
}
