package io.mdpath.core.phase;

import io.mdpath.core.imputation.ImputedVisit;
import io.mdpath.core.state.TreatmentPhase;
import io.mdpath.core.visit.RawVisit;
import java.util.ArrayList;
import java.util.List;

/// Derives the treatment phase of every visit in a timeline.
///
/// The phase of a visit is a pure function of its time, the first surgery time, the first
/// radiation time and whether recurrence has been noted at or before it. Priority:
/// 1. **Recurrence** noted at or before this visit → `RECURRENT` (terminal)
/// 2. **Surgery** occurred → `EARLY_POSTOP` while `visit − surgery ≤ window`, else `LATE_POSTOP`
/// 3. **Radiation** occurred → `EARLY_POSTRAD` / `LATE_POSTRAD` with the same split
/// 4. Otherwise `NAIVE`
///
/// Intervention times come from `surgeryMonths`/`radiationMonths` when recorded, else from
/// the time of the visit carrying the flag. Only the first occurrence counts.
///
/// @implNote Immutable and thread-safe.
public final class TreatmentPhaseMachine {

    private final double earlyWindowMonths;

    /// Creates a phase machine.
    ///
    /// @param earlyWindowMonths window after an intervention counted as early, positive
    public TreatmentPhaseMachine(double earlyWindowMonths) {
        if (earlyWindowMonths <= 0) {
            throw new IllegalArgumentException("Early window must be positive");
        }
        this.earlyWindowMonths = earlyWindowMonths;
    }

    /// Computes the phase of a single visit.
    ///
    /// @param visitMonths time of the visit
    /// @param firstSurgeryMonths time of the first surgery, null if none yet
    /// @param firstRadiationMonths time of the first radiation, null if none yet
    /// @param recurrenceDetected whether recurrence was noted at or before this visit
    /// @return the phase, never null
    public TreatmentPhase phaseAt(
            double visitMonths,
            Double firstSurgeryMonths,
            Double firstRadiationMonths,
            boolean recurrenceDetected) {
        if (recurrenceDetected) {
            return TreatmentPhase.RECURRENT;
        }
        if (firstSurgeryMonths != null) {
            return visitMonths - firstSurgeryMonths <= earlyWindowMonths
                    ? TreatmentPhase.EARLY_POSTOP
                    : TreatmentPhase.LATE_POSTOP;
        }
        if (firstRadiationMonths != null) {
            return visitMonths - firstRadiationMonths <= earlyWindowMonths
                    ? TreatmentPhase.EARLY_POSTRAD
                    : TreatmentPhase.LATE_POSTRAD;
        }
        return TreatmentPhase.NAIVE;
    }

    /// Derives phases for a whole timeline.
    ///
    /// Once recurrence has been noted, every later visit is `RECURRENT`.
    ///
    /// @param visits imputed visits in chronological order, not null
    /// @return one phase per visit, same order, never null
    public List<TreatmentPhase> derive(List<ImputedVisit> visits) {
        List<TreatmentPhase> phases = new ArrayList<>(visits.size());
        Double firstSurgery = null;
        Double firstRadiation = null;
        boolean recurrence = false;

        for (ImputedVisit visit : visits) {
            RawVisit raw = visit.raw();
            if (raw.isSurgeryPerformed()) {
                firstSurgery = earliest(firstSurgery, raw.getSurgeryMonths(), visit.months());
            }
            if (raw.isRadiationPerformed()) {
                firstRadiation = earliest(firstRadiation, raw.getRadiationMonths(), visit.months());
            }
            recurrence = recurrence || raw.isRecurrenceNoted();
            phases.add(phaseAt(visit.months(), firstSurgery, firstRadiation, recurrence));
        }
        return phases;
    }

    private static Double earliest(Double current, Double reported, double visitMonths) {
        double at = reported != null ? reported : visitMonths;
        return current == null ? at : Math.min(current, at);
    }
}
