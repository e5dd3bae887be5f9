package io.mdpath.core.visit;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/// One patient's static demographics and raw visit sequence, as supplied by the external
/// extraction service.
///
/// Visits are kept in input order. The pipeline sorts them chronologically before
/// imputation; the validator reports input that was not strictly increasing.
///
/// @implNote Immutable and thread-safe after construction.
public final class PatientRecord {

    private final String patientId;
    private final Double ageAtDiagnosis;
    private final LocalDate diagnosisDate;
    private final String gender;
    private final String location;
    private final List<RawVisit> visits;

    private PatientRecord(Builder builder) {
        this.patientId = Objects.requireNonNull(builder.patientId, "Patient ID required");
        this.ageAtDiagnosis = builder.ageAtDiagnosis;
        this.diagnosisDate = builder.diagnosisDate;
        this.gender = builder.gender;
        this.location = builder.location;
        this.visits = List.copyOf(builder.visits);
    }

    public String getPatientId() {
        return patientId;
    }

    /// Returns the age at diagnosis.
    ///
    /// @return age in years, or null if the extraction did not supply it
    public Double getAgeAtDiagnosis() {
        return ageAtDiagnosis;
    }

    /// Returns the date of diagnosis, the origin for date-keyed visits.
    ///
    /// @return diagnosis date, or null if not supplied
    public LocalDate getDiagnosisDate() {
        return diagnosisDate;
    }

    /// Returns the raw gender text.
    ///
    /// @return gender text as extracted, may be null
    public String getGender() {
        return gender;
    }

    /// Returns the raw location text.
    ///
    /// @return location text as extracted, may be null
    public String getLocation() {
        return location;
    }

    /// Returns the visits in input order.
    ///
    /// @return unmodifiable list, never null
    public List<RawVisit> getVisits() {
        return visits;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder pre-populated with this record's fields.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder()
                .patientId(patientId)
                .ageAtDiagnosis(ageAtDiagnosis)
                .diagnosisDate(diagnosisDate)
                .gender(gender)
                .location(location)
                .visits(visits);
    }

    /// Builder for constructing immutable PatientRecord instances.
    ///
    /// Required fields: `patientId`
    public static final class Builder {
        private String patientId;
        private Double ageAtDiagnosis;
        private LocalDate diagnosisDate;
        private String gender;
        private String location;
        private List<RawVisit> visits = List.of();

        private Builder() {}

        public Builder patientId(String patientId) {
            this.patientId = patientId;
            return this;
        }

        public Builder ageAtDiagnosis(Double ageAtDiagnosis) {
            this.ageAtDiagnosis = ageAtDiagnosis;
            return this;
        }

        public Builder diagnosisDate(LocalDate diagnosisDate) {
            this.diagnosisDate = diagnosisDate;
            return this;
        }

        public Builder gender(String gender) {
            this.gender = gender;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder visits(List<RawVisit> visits) {
            this.visits = visits != null ? visits : List.of();
            return this;
        }

        /// Builds the immutable record.
        ///
        /// @return new PatientRecord, never null
        /// @throws NullPointerException if patientId is null
        public PatientRecord build() {
            return new PatientRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PatientRecord that)) return false;
        return Objects.equals(patientId, that.patientId) && Objects.equals(visits, that.visits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(patientId, visits);
    }

    @Override
    public String toString() {
        return "PatientRecord{id='" + patientId + "', visits=" + visits.size() + "}";
    }
}
