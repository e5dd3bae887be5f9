package io.mdpath.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.mdpath.core.visit.PatientRecord;
import io.mdpath.core.visit.RawVisit;
import java.time.LocalDate;
import java.util.List;

/// Jackson mixin for `PatientRecord.Builder` mapping snake_case patient fields.
///
/// @see PatientRecordMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class PatientRecordBuilderMixin {

    @JsonProperty("patient_id")
    @JsonAlias("patientId")
    abstract PatientRecord.Builder patientId(String patientId);

    @JsonProperty("age_at_diagnosis")
    @JsonAlias("ageAtDiagnosis")
    abstract PatientRecord.Builder ageAtDiagnosis(Double ageAtDiagnosis);

    @JsonProperty("diagnosis_date")
    @JsonAlias("diagnosisDate")
    abstract PatientRecord.Builder diagnosisDate(LocalDate diagnosisDate);

    @JsonProperty("gender")
    abstract PatientRecord.Builder gender(String gender);

    @JsonProperty("location")
    abstract PatientRecord.Builder location(String location);

    @JsonProperty("visits")
    abstract PatientRecord.Builder visits(List<RawVisit> visits);
}
