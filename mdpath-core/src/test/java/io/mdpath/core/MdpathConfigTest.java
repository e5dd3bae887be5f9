package io.mdpath.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Properties;
import org.junit.jupiter.api.Test;

class MdpathConfigTest {

    @Test
    void shouldProvideDocumentedDefaults() {
        MdpathConfig config = new MdpathConfig();

        assertThat(config.getThreadPoolSize()).isEqualTo(4);
        assertThat(config.isParallelAggregation()).isFalse();
        assertThat(config.isSortVisits()).isTrue();
        assertThat(config.getEarlyPhaseWindowMonths()).isEqualTo(6.0);
        assertThat(config.getGtrShrinkFactor()).isEqualTo(0.5);
        assertThat(config.getStrShrinkFactor()).isEqualTo(0.7);
        assertThat(config.getPostSurgeryCapFactor()).isEqualTo(0.9);
        assertThat(config.getSlowGrowthCmPerYear()).isEqualTo(0.2);
        assertThat(config.getFastGrowthCmPerYear()).isEqualTo(1.0);
        assertThat(config.getMinVelocityIntervalMonths()).isEqualTo(3.0);
        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    void shouldReadPrefixedProperties() {
        // Given
        Properties properties = new Properties();
        properties.setProperty("mdpath.threadPoolSize", "8");
        properties.setProperty("mdpath.parallelAggregation", "true");
        properties.setProperty("mdpath.earlyPhaseWindowMonths", " 3.5 ");
        properties.setProperty("unrelated.key", "ignored");

        // When
        MdpathConfig config = MdpathConfig.fromProperties(properties);

        // Then
        assertThat(config.getThreadPoolSize()).isEqualTo(8);
        assertThat(config.isParallelAggregation()).isTrue();
        assertThat(config.getEarlyPhaseWindowMonths()).isEqualTo(3.5);
        assertThat(config.getGtrShrinkFactor()).isEqualTo(0.5);
    }

    @Test
    void shouldRejectMalformedNumber() {
        Properties properties = new Properties();
        properties.setProperty("mdpath.gtrShrinkFactor", "half");

        assertThatThrownBy(() -> MdpathConfig.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mdpath.gtrShrinkFactor");
    }

    @Test
    void shouldRejectInconsistentThresholds() {
        MdpathConfig config =
                MdpathConfig.builder().slowGrowthCmPerYear(1.0).fastGrowthCmPerYear(0.5).build();

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("slow < fast");
    }

    @Test
    void shouldRejectShrinkFactorOutsideUnitInterval() {
        MdpathConfig config = MdpathConfig.builder().strShrinkFactor(1.5).build();

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("strShrinkFactor");
    }

    @Test
    void shouldRejectNonPositiveThreadPool() {
        MdpathConfig config = MdpathConfig.builder().threadPoolSize(0).build();

        assertThatThrownBy(config::validate).isInstanceOf(IllegalStateException.class);
    }
}
