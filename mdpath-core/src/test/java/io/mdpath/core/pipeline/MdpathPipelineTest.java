package io.mdpath.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import io.mdpath.core.MdpathConfig;
import io.mdpath.core.MdpathFactory;
import io.mdpath.core.action.Action;
import io.mdpath.core.graph.MdpGraph;
import io.mdpath.core.graph.Transition;
import io.mdpath.core.stratification.AgeBucket;
import io.mdpath.core.stratification.Gender;
import io.mdpath.core.stratification.StratificationKey;
import io.mdpath.core.stratification.TumorGrade;
import io.mdpath.core.stratification.TumorLocation;
import io.mdpath.core.validation.WarningType;
import io.mdpath.core.visit.PatientRecord;
import io.mdpath.core.visit.RawVisit;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MdpathPipeline")
class MdpathPipelineTest {

    private static final StratificationKey YOUNG_FEMALE_CONVEXITY =
            new StratificationKey(
                    AgeBucket.UNDER_50, Gender.F, TumorGrade.GRADE_1, TumorLocation.CONVEXITY);

    private MdpathPipeline pipeline;

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
    }

    private static PatientRecord patient(String id, RawVisit... visits) {
        return PatientRecord.builder()
                .patientId(id)
                .ageAtDiagnosis(45.0)
                .gender("F")
                .location("left frontal convexity")
                .visits(List.of(visits))
                .build();
    }

    private static RawVisit.Builder at(double months) {
        return RawVisit.builder().monthsSinceDiagnosis(months);
    }

    // Surgery visit is unmeasured: 4.0 cm times the GTR factor 0.5 lands in small.
    private static PatientRecord resectedPatient(String id) {
        return patient(
                id,
                at(0).tumorSizeCm(4.0).symptomsText("asymptomatic").build(),
                at(6).surgeryPerformed(true).surgeryType("GTR").build(),
                at(18).tumorSizeCm(2.0).build());
    }

    @Nested
    @DisplayName("single patient with gross total resection")
    class Resection {

        @Test
        void shouldProduceSurgeryThenObservationEdges() {
            // Given
            pipeline = MdpathFactory.createPipeline(MdpathConfig.builder().threadPoolSize(1).build());

            // When
            PipelineResult result = pipeline.run(List.of(resectedPatient("p1")));

            // Then
            MdpGraph graph = result.graph(YOUNG_FEMALE_CONVEXITY);
            assertThat(graph.getEdges())
                    .extracting(Transition::toString)
                    .containsExactlyInAnyOrder(
                            "<50|F|grade_1|convexity:medium|none|stable|naive --surgery_gtr--> "
                                    + "<50|F|grade_1|convexity:small|none|stable|early_postop (n=1)",
                            "<50|F|grade_1|convexity:small|none|stable|early_postop --observe_long--> "
                                    + "<50|F|grade_1|convexity:small|none|stable|late_postop (n=1)");
            assertThat(graph.getNodes()).hasSize(3);
            assertThat(result.errors()).isEmpty();
            assertThat(result.warnings()).isEmpty();
        }

        @Test
        void shouldLeaveEveryOtherGraphEmpty() {
            pipeline = MdpathFactory.createPipeline(MdpathConfig.builder().threadPoolSize(1).build());

            PipelineResult result = pipeline.run(List.of(resectedPatient("p1")));

            assertThat(result.graphs()).hasSize(90);
            assertThat(result.registry().nonEmpty())
                    .extracting(MdpGraph::getKey)
                    .containsExactly(YOUNG_FEMALE_CONVEXITY);
            assertThat(result.statistics().populatedGraphs()).isEqualTo(1);
            assertThat(result.statistics().rawTransitions()).isEqualTo(2);
            assertThat(result.statistics().visits()).isEqualTo(3);
            assertThat(result.statistics().duration().isNegative()).isFalse();
        }
    }

    @Test
    void shouldSkipPatientWithoutBaselineMeasurement() {
        // Given
        pipeline = MdpathFactory.createPipeline(MdpathConfig.builder().threadPoolSize(1).build());
        PatientRecord noBaseline = patient("p2", at(0).build(), at(6).tumorSizeCm(3.0).build());

        // When
        PipelineResult result = pipeline.run(List.of(noBaseline, resectedPatient("p1")));

        // Then
        assertThat(result.errors())
                .singleElement()
                .satisfies(
                        error -> {
                            assertThat(error.patientId()).isEqualTo("p2");
                            assertThat(error.errorType()).isEqualTo("MissingBaseline");
                            assertThat(error.partial()).isFalse();
                        });
        assertThat(result.statistics().failedPatients()).isEqualTo(1);
        assertThat(result.statistics().rawTransitions()).isEqualTo(2);
        assertThat(
                        result.registry().getGraphs().stream()
                                .flatMap(g -> g.getTransitions().stream())
                                .flatMap(t -> t.getPatientIds().stream()))
                .doesNotContain("p2");
    }

    @Test
    void shouldLinkGradeUpgradeAcrossGraphs() {
        // Given
        pipeline = MdpathFactory.createPipeline(MdpathConfig.builder().threadPoolSize(1).build());
        PatientRecord upgraded =
                patient(
                        "p3",
                        at(0).tumorSizeCm(3.0).build(),
                        at(6).tumorSizeCm(3.0).build(),
                        at(12).tumorSizeCm(3.0).build(),
                        at(18).tumorSizeCm(3.0).gradeFromPathology("atypical, WHO grade II").build(),
                        at(24).tumorSizeCm(3.0).build());

        // When
        PipelineResult result = pipeline.run(List.of(upgraded));

        // Then
        StratificationKey gradeTwo = YOUNG_FEMALE_CONVEXITY.withGrade(TumorGrade.GRADE_2);
        MdpGraph source = result.graph(YOUNG_FEMALE_CONVEXITY);
        MdpGraph target = result.graph(gradeTwo);

        // the two grade 1 observation steps share one edge
        assertThat(source.getEdges())
                .singleElement()
                .satisfies(edge -> assertThat(edge.getCount()).isEqualTo(2));
        assertThat(source.getOutgoingCrossGraph())
                .singleElement()
                .satisfies(
                        edge -> {
                            assertThat(edge.getToGraph()).isEqualTo(gradeTwo);
                            assertThat(edge.getAction()).isEqualTo(Action.OBSERVE_MEDIUM);
                            assertThat(edge.getChangedFactors()).containsExactly("tumor_grade");
                            assertThat(edge.getAssumedGradeCount()).isEqualTo(1);
                        });
        assertThat(target.getIncomingCrossGraph()).hasSize(1);
        assertThat(target.getEdges()).hasSize(1);
        assertThat(result.statistics().crossGraphTransitions()).isEqualTo(1);
    }

    @Test
    void shouldReportOutOfOrderVisitsButStillProcessThem() {
        pipeline = MdpathFactory.createPipeline(MdpathConfig.builder().threadPoolSize(1).build());
        PatientRecord shuffled =
                patient("p4", at(12).tumorSizeCm(3.0).build(), at(0).tumorSizeCm(3.0).build());

        PipelineResult result = pipeline.run(List.of(shuffled));

        assertThat(result.warningsOf(WarningType.NON_MONOTONIC_TIMESTAMPS)).hasSize(1);
        assertThat(result.statistics().rawTransitions()).isEqualTo(1);
    }

    @Test
    void shouldProduceSameGraphsWithParallelProcessing() {
        // Given
        List<PatientRecord> cohort = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            cohort.add(resectedPatient("r" + i));
            cohort.add(
                    patient(
                            "g" + i,
                            at(0).tumorSizeCm(2.5 + i * 0.1).build(),
                            at(4 + i % 6).tumorSizeCm(3.0 + i * 0.1).build(),
                            at(16).radiationPerformed(true).radiationType("SRS").build(),
                            at(30).tumorSizeCm(2.0).gradeFromPathology(i % 3 == 0 ? "grade 3" : null).build()));
        }

        // When
        PipelineResult sequential;
        try (MdpathPipeline single =
                MdpathFactory.createPipeline(MdpathConfig.builder().threadPoolSize(1).build())) {
            sequential = single.run(cohort);
        }
        pipeline =
                MdpathFactory.createPipeline(
                        MdpathConfig.builder().threadPoolSize(4).parallelAggregation(true).build());
        PipelineResult parallel = pipeline.run(cohort);

        // Then
        assertThat(parallel.registry()).isEqualTo(sequential.registry());
        assertThat(parallel.errors()).isEqualTo(sequential.errors());
        assertThat(parallel.warnings()).isEqualTo(sequential.warnings());
    }
}
