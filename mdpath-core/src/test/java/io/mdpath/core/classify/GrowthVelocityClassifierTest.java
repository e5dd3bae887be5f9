package io.mdpath.core.classify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.mdpath.core.MdpathConfig;
import io.mdpath.core.state.GrowthVelocity;
import org.junit.jupiter.api.Test;

class GrowthVelocityClassifierTest {

    private final GrowthVelocityClassifier classifier =
            GrowthVelocityClassifier.from(new MdpathConfig());

    @Test
    void shouldAnnualizeGrowth() {
        assertThat(GrowthVelocityClassifier.ratePerYear(3.0, 3.5, 6.0)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shouldClassifyByAnnualRate() {
        // 0.1 cm over 12 months
        assertThat(classifier.classify(3.0, 3.1, 12.0)).isEqualTo(GrowthVelocity.STABLE);
        // 0.2 cm/yr sits on the slow boundary
        assertThat(classifier.classify(3.0, 3.2, 12.0)).isEqualTo(GrowthVelocity.SLOW_GROWTH);
        assertThat(classifier.classify(3.0, 3.9, 12.0)).isEqualTo(GrowthVelocity.SLOW_GROWTH);
        assertThat(classifier.classify(3.0, 3.5, 6.0)).isEqualTo(GrowthVelocity.FAST_GROWTH);
    }

    @Test
    void shouldTreatShrinkageAsStable() {
        assertThat(classifier.classify(4.0, 2.0, 3.0)).isEqualTo(GrowthVelocity.STABLE);
        assertThat(classifier.classify(4.0, 4.0, 3.0)).isEqualTo(GrowthVelocity.STABLE);
    }

    @Test
    void shouldRejectNonPositiveInterval() {
        assertThatThrownBy(() -> GrowthVelocityClassifier.ratePerYear(1.0, 2.0, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectInvertedThresholds() {
        assertThatThrownBy(() -> new GrowthVelocityClassifier(1.0, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
