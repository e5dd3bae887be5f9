package io.mdpath.core.visit;

import io.mdpath.core.imputation.ImputedVisit;
import io.mdpath.core.state.GrowthVelocity;
import io.mdpath.core.state.SymptomStatus;
import io.mdpath.core.state.TreatmentPhase;
import io.mdpath.core.state.TumorSize;
import io.mdpath.core.stratification.TumorGrade;
import java.util.Objects;

/// One observation in a patient's timeline with all derived bucket fields populated.
///
/// Built once per pipeline run from an {@link ImputedVisit} and its treatment phase.
///
/// @param index position in the chronologically sorted timeline
/// @param raw the source record, not null
/// @param sizeCm resolved or imputed diameter in cm
/// @param sizeImputed `true` if the size was not measured at this visit
/// @param size size bucket, not null
/// @param symptoms symptom status, not null
/// @param velocity growth velocity, not null
/// @param phase treatment phase, not null
/// @param grade tumor grade, not null
/// @param gradeAssumed `true` if the grade is the pre-pathology default
public record Visit(
        int index,
        RawVisit raw,
        double sizeCm,
        boolean sizeImputed,
        TumorSize size,
        SymptomStatus symptoms,
        GrowthVelocity velocity,
        TreatmentPhase phase,
        TumorGrade grade,
        boolean gradeAssumed) {

    public Visit {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(symptoms, "symptoms");
        Objects.requireNonNull(velocity, "velocity");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(grade, "grade");
    }

    /// Completes an imputed visit with its phase.
    ///
    /// @param imputed the imputed visit, not null
    /// @param phase the derived phase, not null
    /// @return new visit, never null
    public static Visit of(ImputedVisit imputed, TreatmentPhase phase) {
        return new Visit(
                imputed.index(),
                imputed.raw(),
                imputed.sizeCm(),
                imputed.sizeImputed(),
                imputed.size(),
                imputed.symptoms(),
                imputed.velocity(),
                phase,
                imputed.grade(),
                imputed.gradeAssumed());
    }

    public double months() {
        return raw.getMonthsSinceDiagnosis();
    }
}
