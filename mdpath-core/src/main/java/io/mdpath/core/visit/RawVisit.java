package io.mdpath.core.visit;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/// One encounter as supplied by the external extraction service.
///
/// Every field is optional at binding time. The visit time is given either as
/// `monthsSinceDiagnosis` or as a calendar `visitDate`; {@link VisitTimeResolver} turns
/// dates into months and rejects visits carrying neither. Free-text fields
/// (`symptomsText`, `surgeryType`, `radiationType`, `gradeFromPathology`) are classified
/// by the engine, never trusted as labels.
///
/// @implNote Immutable and thread-safe after construction.
/// @see PatientRecord for the owning patient
public final class RawVisit {

    private final Double monthsSinceDiagnosis;
    private final LocalDate visitDate;
    private final Double tumorSizeCm;
    private final Double tumorVolumeCm3;
    private final List<Double> tumorDimensionsCm;
    private final String symptomsText;
    private final boolean surgeryPerformed;
    private final String surgeryType;
    private final Double surgeryMonths;
    private final boolean radiationPerformed;
    private final String radiationType;
    private final Double radiationMonths;
    private final boolean supportiveCareOnly;
    private final String gradeFromPathology;
    private final boolean recurrenceNoted;

    private RawVisit(Builder builder) {
        this.monthsSinceDiagnosis = builder.monthsSinceDiagnosis;
        this.visitDate = builder.visitDate;
        this.tumorSizeCm = builder.tumorSizeCm;
        this.tumorVolumeCm3 = builder.tumorVolumeCm3;
        this.tumorDimensionsCm =
                builder.tumorDimensionsCm != null ? List.copyOf(builder.tumorDimensionsCm) : List.of();
        this.symptomsText = builder.symptomsText;
        this.surgeryPerformed = builder.surgeryPerformed;
        this.surgeryType = builder.surgeryType;
        this.surgeryMonths = builder.surgeryMonths;
        this.radiationPerformed = builder.radiationPerformed;
        this.radiationType = builder.radiationType;
        this.radiationMonths = builder.radiationMonths;
        this.supportiveCareOnly = builder.supportiveCareOnly;
        this.gradeFromPathology = builder.gradeFromPathology;
        this.recurrenceNoted = builder.recurrenceNoted;

        if (monthsSinceDiagnosis != null
                && (monthsSinceDiagnosis.isNaN() || monthsSinceDiagnosis.isInfinite())) {
            throw new IllegalArgumentException("monthsSinceDiagnosis must be finite");
        }
    }

    /// Returns the visit time.
    ///
    /// Never null once the owning record has passed through {@link VisitTimeResolver}.
    ///
    /// @return months since diagnosis, or null if only a date was supplied
    public Double getMonthsSinceDiagnosis() {
        return monthsSinceDiagnosis;
    }

    /// Returns the calendar date of the visit.
    ///
    /// @return visit date, or null if not supplied
    public LocalDate getVisitDate() {
        return visitDate;
    }

    /// Checks whether the visit carries either form of timestamp.
    ///
    /// @return `true` if months or a date are present
    public boolean hasTime() {
        return monthsSinceDiagnosis != null || visitDate != null;
    }

    /// Returns the recorded largest diameter.
    ///
    /// @return diameter in cm, or null if not measured
    public Double getTumorSizeCm() {
        return tumorSizeCm;
    }

    /// Returns the recorded volume.
    ///
    /// @return volume in cm³, or null if not measured
    public Double getTumorVolumeCm3() {
        return tumorVolumeCm3;
    }

    /// Returns per-axis dimensions.
    ///
    /// @return unmodifiable list in cm, empty if not measured
    public List<Double> getTumorDimensionsCm() {
        return tumorDimensionsCm;
    }

    public String getSymptomsText() {
        return symptomsText;
    }

    public boolean isSurgeryPerformed() {
        return surgeryPerformed;
    }

    public String getSurgeryType() {
        return surgeryType;
    }

    /// Returns the time of surgery when it differs from the visit time.
    ///
    /// @return months since diagnosis, or null to use the visit time
    public Double getSurgeryMonths() {
        return surgeryMonths;
    }

    public boolean isRadiationPerformed() {
        return radiationPerformed;
    }

    public String getRadiationType() {
        return radiationType;
    }

    /// Returns the time of radiation when it differs from the visit time.
    ///
    /// @return months since diagnosis, or null to use the visit time
    public Double getRadiationMonths() {
        return radiationMonths;
    }

    public boolean isSupportiveCareOnly() {
        return supportiveCareOnly;
    }

    public String getGradeFromPathology() {
        return gradeFromPathology;
    }

    public boolean isRecurrenceNoted() {
        return recurrenceNoted;
    }

    /// Checks whether any size measurement was recorded.
    ///
    /// @return `true` if diameter, volume or dimensions are present
    public boolean hasMeasurement() {
        return tumorSizeCm != null || tumorVolumeCm3 != null || !tumorDimensionsCm.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder pre-populated with this visit's fields.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder()
                .monthsSinceDiagnosis(monthsSinceDiagnosis)
                .visitDate(visitDate)
                .tumorSizeCm(tumorSizeCm)
                .tumorVolumeCm3(tumorVolumeCm3)
                .tumorDimensionsCm(tumorDimensionsCm)
                .symptomsText(symptomsText)
                .surgeryPerformed(surgeryPerformed)
                .surgeryType(surgeryType)
                .surgeryMonths(surgeryMonths)
                .radiationPerformed(radiationPerformed)
                .radiationType(radiationType)
                .radiationMonths(radiationMonths)
                .supportiveCareOnly(supportiveCareOnly)
                .gradeFromPathology(gradeFromPathology)
                .recurrenceNoted(recurrenceNoted);
    }

    /// Builder for constructing immutable RawVisit instances.
    public static final class Builder {
        private Double monthsSinceDiagnosis;
        private LocalDate visitDate;
        private Double tumorSizeCm;
        private Double tumorVolumeCm3;
        private List<Double> tumorDimensionsCm;
        private String symptomsText;
        private boolean surgeryPerformed;
        private String surgeryType;
        private Double surgeryMonths;
        private boolean radiationPerformed;
        private String radiationType;
        private Double radiationMonths;
        private boolean supportiveCareOnly;
        private String gradeFromPathology;
        private boolean recurrenceNoted;

        private Builder() {}

        public Builder monthsSinceDiagnosis(Double monthsSinceDiagnosis) {
            this.monthsSinceDiagnosis = monthsSinceDiagnosis;
            return this;
        }

        public Builder visitDate(LocalDate visitDate) {
            this.visitDate = visitDate;
            return this;
        }

        public Builder tumorSizeCm(Double tumorSizeCm) {
            this.tumorSizeCm = tumorSizeCm;
            return this;
        }

        public Builder tumorVolumeCm3(Double tumorVolumeCm3) {
            this.tumorVolumeCm3 = tumorVolumeCm3;
            return this;
        }

        public Builder tumorDimensionsCm(List<Double> tumorDimensionsCm) {
            this.tumorDimensionsCm = tumorDimensionsCm;
            return this;
        }

        public Builder symptomsText(String symptomsText) {
            this.symptomsText = symptomsText;
            return this;
        }

        public Builder surgeryPerformed(boolean surgeryPerformed) {
            this.surgeryPerformed = surgeryPerformed;
            return this;
        }

        public Builder surgeryType(String surgeryType) {
            this.surgeryType = surgeryType;
            return this;
        }

        public Builder surgeryMonths(Double surgeryMonths) {
            this.surgeryMonths = surgeryMonths;
            return this;
        }

        public Builder radiationPerformed(boolean radiationPerformed) {
            this.radiationPerformed = radiationPerformed;
            return this;
        }

        public Builder radiationType(String radiationType) {
            this.radiationType = radiationType;
            return this;
        }

        public Builder radiationMonths(Double radiationMonths) {
            this.radiationMonths = radiationMonths;
            return this;
        }

        public Builder supportiveCareOnly(boolean supportiveCareOnly) {
            this.supportiveCareOnly = supportiveCareOnly;
            return this;
        }

        public Builder gradeFromPathology(String gradeFromPathology) {
            this.gradeFromPathology = gradeFromPathology;
            return this;
        }

        public Builder recurrenceNoted(boolean recurrenceNoted) {
            this.recurrenceNoted = recurrenceNoted;
            return this;
        }

        /// Builds the immutable visit.
        ///
        /// @return new RawVisit, never null
        /// @throws IllegalArgumentException if the timestamp is not finite
        public RawVisit build() {
            return new RawVisit(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawVisit that)) return false;
        return Objects.equals(monthsSinceDiagnosis, that.monthsSinceDiagnosis)
                && Objects.equals(visitDate, that.visitDate)
                && surgeryPerformed == that.surgeryPerformed
                && radiationPerformed == that.radiationPerformed
                && supportiveCareOnly == that.supportiveCareOnly
                && recurrenceNoted == that.recurrenceNoted
                && Objects.equals(tumorSizeCm, that.tumorSizeCm)
                && Objects.equals(tumorVolumeCm3, that.tumorVolumeCm3)
                && Objects.equals(tumorDimensionsCm, that.tumorDimensionsCm)
                && Objects.equals(symptomsText, that.symptomsText)
                && Objects.equals(surgeryType, that.surgeryType)
                && Objects.equals(surgeryMonths, that.surgeryMonths)
                && Objects.equals(radiationType, that.radiationType)
                && Objects.equals(radiationMonths, that.radiationMonths)
                && Objects.equals(gradeFromPathology, that.gradeFromPathology);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                monthsSinceDiagnosis, visitDate, tumorSizeCm, symptomsText, gradeFromPathology, recurrenceNoted);
    }

    @Override
    public String toString() {
        return "RawVisit{months="
                + monthsSinceDiagnosis
                + ", date="
                + visitDate
                + ", sizeCm="
                + tumorSizeCm
                + "}";
    }
}
