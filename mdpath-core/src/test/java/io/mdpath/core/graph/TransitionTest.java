package io.mdpath.core.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.mdpath.core.action.Action;
import io.mdpath.core.state.GrowthVelocity;
import io.mdpath.core.state.StateId;
import io.mdpath.core.state.SymptomStatus;
import io.mdpath.core.state.TreatmentPhase;
import io.mdpath.core.state.TumorSize;
import io.mdpath.core.stratification.AgeBucket;
import io.mdpath.core.stratification.Gender;
import io.mdpath.core.stratification.StratificationKey;
import io.mdpath.core.stratification.TumorGrade;
import io.mdpath.core.stratification.TumorLocation;
import io.mdpath.core.transition.RawTransition;
import io.mdpath.core.transition.TransitionOutcome;
import java.util.List;
import org.junit.jupiter.api.Test;

class TransitionTest {

    private static final StratificationKey KEY =
            new StratificationKey(
                    AgeBucket.AT_LEAST_65, Gender.F, TumorGrade.GRADE_1, TumorLocation.OTHER);
    private static final StateId FROM =
            new StateId(TumorSize.MEDIUM, SymptomStatus.NONE, GrowthVelocity.STABLE, TreatmentPhase.NAIVE);
    private static final StateId TO =
            new StateId(
                    TumorSize.LARGE, SymptomStatus.PRESENT, GrowthVelocity.FAST_GROWTH, TreatmentPhase.NAIVE);

    private static RawTransition raw(String patientId, double elapsed, boolean assumed) {
        return new RawTransition(
                patientId,
                KEY,
                FROM,
                Action.OBSERVE_MEDIUM,
                KEY,
                TO,
                elapsed,
                List.of(),
                TransitionOutcome.GREW,
                assumed,
                0);
    }

    @Test
    void shouldAccumulateCountsAndStatistics() {
        // Given
        RawTransition first = raw("p1", 4.0, true);
        Transition edge = new Transition(KEY, first.edgeKey());

        // When
        edge.add(first);
        edge.add(raw("p2", 8.0, false));
        edge.add(raw("p1", 6.0, false));

        // Then
        assertThat(edge.getCount()).isEqualTo(3);
        assertThat(edge.getPatientIds()).containsExactly("p1", "p2");
        assertThat(edge.getAssumedGradeCount()).isEqualTo(1);
        assertThat(edge.getElapsedSamples()).containsExactly(4.0, 6.0, 8.0);
        assertThat(edge.getMeanElapsedMonths()).isCloseTo(6.0, within(1e-9));
        assertThat(edge.getStdElapsedMonths()).isCloseTo(Math.sqrt(8.0 / 3.0), within(1e-9));
        assertThat(edge.getOutcomeCounts()).containsEntry(TransitionOutcome.GREW, 3);
        assertThat(edge.isCrossGraph()).isFalse();
    }

    @Test
    void shouldReportZeroSpreadForSingleSample() {
        RawTransition only = raw("p1", 4.0, false);
        Transition edge = new Transition(KEY, only.edgeKey());
        edge.add(only);

        assertThat(edge.getStdElapsedMonths()).isZero();
    }

    @Test
    void shouldMergeIntoEqualEdgeRegardlessOfOrder() {
        // Given
        RawTransition a = raw("p1", 4.0, false);
        RawTransition b = raw("p2", 9.0, true);
        Transition left = new Transition(KEY, a.edgeKey());
        left.add(a);
        Transition right = new Transition(KEY, a.edgeKey());
        right.add(b);

        // When
        Transition leftFirst = new Transition(KEY, a.edgeKey());
        leftFirst.mergeFrom(left);
        leftFirst.mergeFrom(right);
        Transition rightFirst = new Transition(KEY, a.edgeKey());
        rightFirst.mergeFrom(right);
        rightFirst.mergeFrom(left);

        // Then
        assertThat(leftFirst).isEqualTo(rightFirst);
        assertThat(leftFirst.getCount()).isEqualTo(2);
    }

    @Test
    void shouldRejectRawTransitionForDifferentEdge() {
        Transition edge = new Transition(KEY, raw("p1", 4.0, false).edgeKey());
        RawTransition other =
                new RawTransition(
                        "p1",
                        KEY,
                        FROM,
                        Action.OBSERVE_LONG,
                        KEY,
                        TO,
                        12.0,
                        List.of(),
                        TransitionOutcome.GREW,
                        false,
                        0);

        assertThatThrownBy(() -> edge.add(other)).isInstanceOf(IllegalArgumentException.class);
    }
}
