package io.mdpath.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.mdpath.core.visit.RawVisit;
import java.time.LocalDate;
import java.util.List;

/// Jackson mixin for `RawVisit.Builder` mapping the extraction service's snake_case fields
/// onto the builder methods.
///
/// Camel-case names are accepted as aliases. Dates are ISO-8601 (`2021-03-14`).
///
/// @see RawVisitMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class RawVisitBuilderMixin {

    @JsonProperty("months_since_diagnosis")
    @JsonAlias("monthsSinceDiagnosis")
    abstract RawVisit.Builder monthsSinceDiagnosis(Double monthsSinceDiagnosis);

    @JsonProperty("visit_date")
    @JsonAlias("visitDate")
    abstract RawVisit.Builder visitDate(LocalDate visitDate);

    @JsonProperty("tumor_size_cm")
    @JsonAlias("tumorSizeCm")
    abstract RawVisit.Builder tumorSizeCm(Double tumorSizeCm);

    @JsonProperty("tumor_volume_cm3")
    @JsonAlias("tumorVolumeCm3")
    abstract RawVisit.Builder tumorVolumeCm3(Double tumorVolumeCm3);

    @JsonProperty("tumor_dimensions_cm")
    @JsonAlias("tumorDimensionsCm")
    abstract RawVisit.Builder tumorDimensionsCm(List<Double> tumorDimensionsCm);

    @JsonProperty("symptoms_text")
    @JsonAlias("symptomsText")
    abstract RawVisit.Builder symptomsText(String symptomsText);

    @JsonProperty("surgery_performed")
    @JsonAlias("surgeryPerformed")
    abstract RawVisit.Builder surgeryPerformed(boolean surgeryPerformed);

    @JsonProperty("surgery_type")
    @JsonAlias("surgeryType")
    abstract RawVisit.Builder surgeryType(String surgeryType);

    @JsonProperty("surgery_months")
    @JsonAlias("surgeryMonths")
    abstract RawVisit.Builder surgeryMonths(Double surgeryMonths);

    @JsonProperty("radiation_performed")
    @JsonAlias("radiationPerformed")
    abstract RawVisit.Builder radiationPerformed(boolean radiationPerformed);

    @JsonProperty("radiation_type")
    @JsonAlias("radiationType")
    abstract RawVisit.Builder radiationType(String radiationType);

    @JsonProperty("radiation_months")
    @JsonAlias("radiationMonths")
    abstract RawVisit.Builder radiationMonths(Double radiationMonths);

    @JsonProperty("supportive_care_only")
    @JsonAlias("supportiveCareOnly")
    abstract RawVisit.Builder supportiveCareOnly(boolean supportiveCareOnly);

    @JsonProperty("grade_from_pathology")
    @JsonAlias("gradeFromPathology")
    abstract RawVisit.Builder gradeFromPathology(String gradeFromPathology);

    @JsonProperty("recurrence_noted")
    @JsonAlias("recurrenceNoted")
    abstract RawVisit.Builder recurrenceNoted(boolean recurrenceNoted);
}
