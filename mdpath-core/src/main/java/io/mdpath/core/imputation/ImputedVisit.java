package io.mdpath.core.imputation;

import io.mdpath.core.state.GrowthVelocity;
import io.mdpath.core.state.SymptomStatus;
import io.mdpath.core.state.TumorSize;
import io.mdpath.core.stratification.TumorGrade;
import io.mdpath.core.visit.RawVisit;
import java.util.Objects;

/// A visit after gap filling, before phase derivation.
///
/// @param index position in the chronologically sorted timeline
/// @param raw the source record, not null
/// @param sizeCm resolved or imputed diameter in cm
/// @param sizeImputed `true` if `sizeCm` was not measured at this visit
/// @param size bucket of `sizeCm`, not null
/// @param symptoms symptom status, not null
/// @param velocity growth velocity, not null
/// @param grade tumor grade, not null
/// @param gradeAssumed `true` if no confirmed pathology existed at or before this visit
public record ImputedVisit(
        int index,
        RawVisit raw,
        double sizeCm,
        boolean sizeImputed,
        TumorSize size,
        SymptomStatus symptoms,
        GrowthVelocity velocity,
        TumorGrade grade,
        boolean gradeAssumed) {

    public ImputedVisit {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(symptoms, "symptoms");
        Objects.requireNonNull(velocity, "velocity");
        Objects.requireNonNull(grade, "grade");
    }

    public double months() {
        return raw.getMonthsSinceDiagnosis();
    }
}
