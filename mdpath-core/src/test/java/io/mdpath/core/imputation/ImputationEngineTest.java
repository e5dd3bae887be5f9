package io.mdpath.core.imputation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.mdpath.core.MdpathConfig;
import io.mdpath.core.exception.InvalidIntervalException;
import io.mdpath.core.exception.MissingBaselineException;
import io.mdpath.core.state.GrowthVelocity;
import io.mdpath.core.state.SymptomStatus;
import io.mdpath.core.state.TumorSize;
import io.mdpath.core.stratification.TumorGrade;
import io.mdpath.core.validation.ValidationWarning;
import io.mdpath.core.validation.WarningType;
import io.mdpath.core.visit.RawVisit;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ImputationEngine")
class ImputationEngineTest {

    private final ImputationEngine engine = new ImputationEngine(new MdpathConfig());

    private static RawVisit.Builder at(double months) {
        return RawVisit.builder().monthsSinceDiagnosis(months);
    }

    @Test
    void shouldRejectTimelineWithoutBaselineMeasurement() {
        // Given
        List<RawVisit> visits = List.of(at(0).build(), at(6).tumorSizeCm(3.0).build());

        // When/Then
        assertThatThrownBy(() -> engine.impute("p1", visits))
                .isInstanceOf(MissingBaselineException.class)
                .hasMessageContaining("p1");
    }

    @Test
    void shouldReturnEmptyResultForEmptyTimeline() throws Exception {
        ImputationResult result = engine.impute("p1", List.of());

        assertThat(result.visits()).isEmpty();
        assertThat(result.isTruncated()).isFalse();
    }

    @Nested
    @DisplayName("tumor size")
    class Size {

        @Test
        void shouldCarryLastSizeForwardWhenMeasurementMissing() throws Exception {
            // Given
            List<RawVisit> visits = List.of(at(0).tumorSizeCm(3.4).build(), at(6).build());

            // When
            ImputationResult result = engine.impute("p1", visits);

            // Then
            ImputedVisit second = result.visits().get(1);
            assertThat(second.sizeCm()).isEqualTo(3.4);
            assertThat(second.sizeImputed()).isTrue();
            assertThat(second.size()).isEqualTo(TumorSize.MEDIUM);
            assertThat(result.visits().get(0).sizeImputed()).isFalse();
        }

        @Test
        void shouldShrinkUnmeasuredSizeAfterGrossTotalResection() throws Exception {
            List<RawVisit> visits =
                    List.of(
                            at(0).tumorSizeCm(4.0).build(),
                            at(6).surgeryPerformed(true).surgeryType("gross total").build());

            ImputedVisit postop = engine.impute("p1", visits).visits().get(1);

            assertThat(postop.sizeCm()).isCloseTo(2.0, within(1e-9));
            assertThat(postop.size()).isEqualTo(TumorSize.SMALL);
        }

        @Test
        void shouldShrinkLessAfterSubtotalResection() throws Exception {
            List<RawVisit> visits =
                    List.of(
                            at(0).tumorSizeCm(4.0).build(),
                            at(6).surgeryPerformed(true).surgeryType("subtotal").build());

            ImputedVisit postop = engine.impute("p1", visits).visits().get(1);

            assertThat(postop.sizeCm()).isCloseTo(2.8, within(1e-9));
        }

        @Test
        void shouldCapPostSurgeryMeasurementLargerThanPreSurgerySize() throws Exception {
            // Given
            List<RawVisit> visits =
                    List.of(
                            at(0).tumorSizeCm(4.0).build(),
                            at(6).surgeryPerformed(true).build(),
                            at(9).tumorSizeCm(4.5).build());

            // When
            ImputationResult result = engine.impute("p1", visits);

            // Then: first measurement after surgery is capped relative to 4.0 cm
            assertThat(result.visits().get(2).sizeCm()).isCloseTo(3.6, within(1e-9));
            assertThat(result.warnings())
                    .singleElement()
                    .satisfies(
                            w -> {
                                assertThat(w.type())
                                        .isEqualTo(WarningType.CONTRADICTORY_POST_SURGERY_SIZE);
                                assertThat(w.visitIndex()).isEqualTo(2);
                            });
        }

        @Test
        void shouldKeepPlausiblePostSurgeryMeasurement() throws Exception {
            List<RawVisit> visits =
                    List.of(
                            at(0).tumorSizeCm(4.0).build(),
                            at(6).surgeryPerformed(true).tumorSizeCm(1.0).build());

            ImputationResult result = engine.impute("p1", visits);

            assertThat(result.visits().get(1).sizeCm()).isEqualTo(1.0);
            assertThat(result.warnings()).isEmpty();
        }
    }

    @Test
    void shouldCarrySymptomsForwardWhenTextMissing() throws Exception {
        List<RawVisit> visits =
                List.of(
                        at(0).tumorSizeCm(3.0).symptomsText("headaches").build(),
                        at(6).tumorSizeCm(3.0).build(),
                        at(12).tumorSizeCm(3.0).symptomsText("asymptomatic").build());

        List<ImputedVisit> imputed = engine.impute("p1", visits).visits();

        assertThat(imputed)
                .extracting(ImputedVisit::symptoms)
                .containsExactly(SymptomStatus.PRESENT, SymptomStatus.PRESENT, SymptomStatus.NONE);
    }

    @Test
    void shouldDefaultGradeUntilPathologyConfirmsIt() throws Exception {
        // Given
        List<RawVisit> visits =
                List.of(
                        at(0).tumorSizeCm(3.0).build(),
                        at(6).tumorSizeCm(3.0).gradeFromPathology("WHO grade II").build(),
                        at(12).tumorSizeCm(3.0).build());

        // When
        List<ImputedVisit> imputed = engine.impute("p1", visits).visits();

        // Then
        assertThat(imputed)
                .extracting(ImputedVisit::grade)
                .containsExactly(TumorGrade.GRADE_1, TumorGrade.GRADE_2, TumorGrade.GRADE_2);
        assertThat(imputed)
                .extracting(ImputedVisit::gradeAssumed)
                .containsExactly(true, false, false);
    }

    @Nested
    @DisplayName("growth velocity")
    class Velocity {

        @Test
        void shouldComputeVelocityFromConsecutiveSizes() throws Exception {
            List<RawVisit> visits =
                    List.of(
                            at(0).tumorSizeCm(3.0).build(),
                            at(12).tumorSizeCm(3.5).build(),
                            at(18).tumorSizeCm(4.5).build());

            List<ImputedVisit> imputed = engine.impute("p1", visits).visits();

            assertThat(imputed)
                    .extracting(ImputedVisit::velocity)
                    .containsExactly(
                            GrowthVelocity.STABLE,
                            GrowthVelocity.SLOW_GROWTH,
                            GrowthVelocity.FAST_GROWTH);
        }

        @Test
        void shouldCarryVelocityAcrossShortInterval() throws Exception {
            // Given
            List<RawVisit> visits =
                    List.of(
                            at(0).tumorSizeCm(3.0).build(),
                            at(12).tumorSizeCm(3.5).build(),
                            at(14).tumorSizeCm(4.5).build());

            // When
            ImputationResult result = engine.impute("p1", visits);

            // Then
            assertThat(result.visits().get(2).velocity()).isEqualTo(GrowthVelocity.SLOW_GROWTH);
            assertThat(result.warnings())
                    .extracting(ValidationWarning::type)
                    .containsExactly(WarningType.SHORT_VELOCITY_INTERVAL);
        }

        @Test
        void shouldResetVelocityAroundSurgery() throws Exception {
            List<RawVisit> visits =
                    List.of(
                            at(0).tumorSizeCm(3.0).build(),
                            at(6).tumorSizeCm(1.0).surgeryPerformed(true).build(),
                            at(12).tumorSizeCm(2.0).build(),
                            at(24).tumorSizeCm(3.5).build());

            List<ImputedVisit> imputed = engine.impute("p1", visits).visits();

            assertThat(imputed)
                    .extracting(ImputedVisit::velocity)
                    .containsExactly(
                            GrowthVelocity.STABLE,
                            GrowthVelocity.STABLE,
                            GrowthVelocity.STABLE,
                            GrowthVelocity.FAST_GROWTH);
        }

        @Test
        void shouldTruncateTimelineAtNonPositiveInterval() throws Exception {
            // Given
            List<RawVisit> visits =
                    List.of(
                            at(0).tumorSizeCm(3.0).build(),
                            at(6).tumorSizeCm(3.0).build(),
                            at(6).tumorSizeCm(3.1).build(),
                            at(12).tumorSizeCm(3.2).build());

            // When
            ImputationResult result = engine.impute("p1", visits);

            // Then
            assertThat(result.isTruncated()).isTrue();
            assertThat(result.visits()).hasSize(2);
            assertThat(result.failure()).isInstanceOf(InvalidIntervalException.class);
            assertThat(result.failure().getVisitIndex()).isEqualTo(2);
            assertThat(((InvalidIntervalException) result.failure()).getIntervalMonths()).isZero();
        }
    }
}
