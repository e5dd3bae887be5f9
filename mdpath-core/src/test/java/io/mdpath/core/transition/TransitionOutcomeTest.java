package io.mdpath.core.transition;

import static org.assertj.core.api.Assertions.assertThat;

import io.mdpath.core.state.TumorSize;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class TransitionOutcomeTest {

    @Test
    void shouldCompareSizeBuckets() {
        assertThat(TransitionOutcome.of(TumorSize.LARGE, TumorSize.SMALL)).isEqualTo(TransitionOutcome.SHRANK);
        assertThat(TransitionOutcome.of(TumorSize.MEDIUM, TumorSize.MEDIUM))
                .isEqualTo(TransitionOutcome.UNCHANGED);
        assertThat(TransitionOutcome.of(TumorSize.SMALL, TumorSize.MEDIUM)).isEqualTo(TransitionOutcome.GREW);
    }

    @Test
    void shouldUseFixedLowercaseLabels() {
        assertThat(Arrays.stream(TransitionOutcome.values()).map(TransitionOutcome::label))
                .containsExactly("shrank", "unchanged", "grew");
    }
}
