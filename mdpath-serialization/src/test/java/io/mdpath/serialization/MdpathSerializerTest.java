package io.mdpath.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.mdpath.core.MdpathConfig;
import io.mdpath.core.MdpathFactory;
import io.mdpath.core.pipeline.MdpathPipeline;
import io.mdpath.core.pipeline.PipelineResult;
import io.mdpath.core.visit.PatientRecord;
import io.mdpath.core.visit.RawVisit;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MdpathSerializer")
class MdpathSerializerTest {

    private static List<PatientRecord> loadCohort() throws Exception {
        try (InputStream in =
                MdpathSerializerTest.class.getResourceAsStream("/fixtures/cohort.json")) {
            assertThat(in).as("cohort fixture").isNotNull();
            return MdpathSerializer.readPatients(in);
        }
    }

    private static PipelineResult run(List<PatientRecord> records) {
        try (MdpathPipeline pipeline =
                MdpathFactory.createPipeline(MdpathConfig.builder().threadPoolSize(1).build())) {
            return pipeline.run(records);
        }
    }

    @Nested
    @DisplayName("reading patients")
    class Reading {

        @Test
        void shouldReadSnakeCaseAndCamelCaseRecords() throws Exception {
            // When
            List<PatientRecord> records = loadCohort();

            // Then
            assertThat(records)
                    .extracting(PatientRecord::getPatientId)
                    .containsExactly("MEN-001", "MEN-002", "MEN-003");

            PatientRecord first = records.get(0);
            assertThat(first.getAgeAtDiagnosis()).isEqualTo(45.0);
            assertThat(first.getGender()).isEqualTo("female");
            assertThat(first.getVisits()).hasSize(3);

            RawVisit surgery = first.getVisits().get(1);
            assertThat(surgery.isSurgeryPerformed()).isTrue();
            assertThat(surgery.getSurgeryType()).startsWith("Gross total");
            assertThat(surgery.getTumorSizeCm()).isEqualTo(2.0);

            RawVisit dimensions = records.get(1).getVisits().get(0);
            assertThat(dimensions.getTumorDimensionsCm()).containsExactly(2.1, 2.8, 2.4);
            assertThat(records.get(1).getVisits().get(1).isRadiationPerformed()).isTrue();
        }

        @Test
        void shouldAcceptTopLevelArray() {
            String json =
                    """
                    [{"patient_id": "p1", "age_at_diagnosis": 50, "gender": "M",
                      "visits": [{"months_since_diagnosis": 0, "tumor_size_cm": 3.2}]}]
                    """;

            List<PatientRecord> records = MdpathSerializer.readPatients(json);

            assertThat(records).singleElement().satisfies(r -> assertThat(r.getVisits()).hasSize(1));
            assertThat(records.get(0).getLocation()).isNull();
        }

        @Test
        void shouldBindVisitDatesAndLeaveAbsentNumbersUnset() {
            String json =
                    """
                    [{"patient_id": "p1", "gender": "F", "diagnosis_date": "2020-01-01",
                      "visits": [{"visit_date": "2020-01-15", "tumor_size_cm": 3.0},
                                 {"visitDate": "2020-09-15", "tumor_size_cm": 3.4}]}]
                    """;

            PatientRecord record = MdpathSerializer.readPatients(json).get(0);

            assertThat(record.getAgeAtDiagnosis()).isNull();
            assertThat(record.getDiagnosisDate()).isEqualTo(LocalDate.of(2020, 1, 1));
            assertThat(record.getVisits())
                    .extracting(RawVisit::getVisitDate)
                    .containsExactly(LocalDate.of(2020, 1, 15), LocalDate.of(2020, 9, 15));
            assertThat(record.getVisits())
                    .extracting(RawVisit::getMonthsSinceDiagnosis)
                    .containsOnlyNulls();
        }

        @Test
        void shouldReportMissingAgeAndBuildTransitionsFromDates() {
            String json =
                    """
                    [{"patient_id": "no-age", "gender": "F", "location": "convexity",
                      "visits": [{"visit_date": "2020-01-15", "tumor_size_cm": 3.0},
                                 {"visit_date": "2020-09-15", "tumor_size_cm": 3.4}]},
                     {"patient_id": "dated", "age_at_diagnosis": 40, "gender": "F",
                      "location": "convexity",
                      "visits": [{"visit_date": "2020-01-15", "tumor_size_cm": 3.0},
                                 {"visit_date": "2020-09-15", "tumor_size_cm": 3.4}]}]
                    """;

            PipelineResult result = run(MdpathSerializer.readPatients(json));

            assertThat(result.errors())
                    .singleElement()
                    .satisfies(
                            error -> {
                                assertThat(error.patientId()).isEqualTo("no-age");
                                assertThat(error.errorType()).isEqualTo("MissingField");
                            });
            assertThat(result.statistics().rawTransitions()).isEqualTo(1);
        }

        @Test
        void shouldTreatMissingVisitsAsEmptyTimeline() {
            List<PatientRecord> records =
                    MdpathSerializer.readPatients("{\"patients\": [{\"patient_id\": \"p1\"}]}");

            assertThat(records.get(0).getVisits()).isEmpty();
        }

        @Test
        void shouldRejectDocumentWithoutPatients() {
            assertThatThrownBy(() -> MdpathSerializer.readPatients("{\"cohort\": []}"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("patients");
        }

        @Test
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> MdpathSerializer.readPatients("[{\"patient_id\": "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Failed to deserialize");
        }

        @Test
        void shouldRejectRecordWithoutPatientId() {
            assertThatThrownBy(() -> MdpathSerializer.readPatients("[{\"gender\": \"F\"}]"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("writing results")
    class Writing {

        @Test
        void shouldWriteAllGraphsWithStatisticsAndErrors() throws Exception {
            // Given
            PipelineResult result = run(loadCohort());

            // When
            JsonNode tree = MdpathSerializer.toJsonTree(result);

            // Then
            assertThat(tree.get("graphs")).hasSize(90);
            assertThat(tree.at("/statistics/patients").asInt()).isEqualTo(3);
            assertThat(tree.at("/statistics/failed_patients").asInt()).isEqualTo(1);
            assertThat(tree.at("/statistics/started_at").isTextual()).isTrue();
            assertThat(tree.at("/errors/0/patient_id").asText()).isEqualTo("MEN-003");
            assertThat(tree.at("/errors/0/error_type").asText()).isEqualTo("MissingBaseline");
        }

        @Test
        void shouldWriteEdgeDetailsUnderGraphId() throws Exception {
            // Given
            PipelineResult result = run(loadCohort());

            // When
            JsonNode tree = MdpathSerializer.toJsonTree(result);
            JsonNode graph = findGraph(tree, "<50|F|grade_1|convexity");

            // Then
            assertThat(graph).isNotNull();
            assertThat(graph.at("/stratification/tumor_grade").asText()).isEqualTo("grade_1");
            assertThat(graph.get("nodes")).hasSize(3);

            JsonNode surgery = findEdge(graph.get("edges"), "surgery_gtr");
            assertThat(surgery).isNotNull();
            assertThat(surgery.get("from_state").asText()).isEqualTo("medium|none|stable|naive");
            assertThat(surgery.get("to_state").asText()).isEqualTo("small|none|stable|early_postop");
            assertThat(surgery.get("count").asInt()).isEqualTo(1);
            assertThat(surgery.get("mean_elapsed_months").asDouble()).isEqualTo(6.0);
            assertThat(surgery.at("/outcome_counts/shrank").asInt()).isEqualTo(1);
            assertThat(surgery.at("/outcome_counts/unchanged").asInt()).isZero();
            assertThat(surgery.at("/outcome_counts/grew").isInt()).isTrue();
            assertThat(surgery.get("patient_ids").get(0).asText()).isEqualTo("MEN-001");
            assertThat(surgery.get("is_cross_graph").asBoolean()).isFalse();
            assertThat(surgery.get("assumed_grade_count").asInt()).isEqualTo(1);
        }

        @Test
        void shouldProducePrettyPrintedText() throws Exception {
            String json = MdpathSerializer.toJson(run(loadCohort()));

            assertThat(json).contains("\"graph_id\"").contains(System.lineSeparator());
        }

        private JsonNode findGraph(JsonNode tree, String id) {
            for (JsonNode graph : tree.get("graphs")) {
                if (id.equals(graph.get("graph_id").asText())) {
                    return graph;
                }
            }
            return null;
        }

        private JsonNode findEdge(JsonNode edges, String action) {
            for (JsonNode edge : edges) {
                if (action.equals(edge.get("action").asText())) {
                    return edge;
                }
            }
            return null;
        }
    }
}
