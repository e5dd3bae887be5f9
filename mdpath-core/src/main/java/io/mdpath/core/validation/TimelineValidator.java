package io.mdpath.core.validation;

import io.mdpath.core.action.Action;
import io.mdpath.core.action.ActionAvailability;
import io.mdpath.core.graph.GraphRegistry;
import io.mdpath.core.graph.MdpGraph;
import io.mdpath.core.graph.Transition;
import io.mdpath.core.state.StateId;
import io.mdpath.core.state.TreatmentPhase;
import io.mdpath.core.state.TumorSize;
import io.mdpath.core.transition.PatientTimeline;
import io.mdpath.core.transition.RawTransition;
import io.mdpath.core.visit.PatientRecord;
import io.mdpath.core.visit.RawVisit;
import io.mdpath.core.visit.Visit;
import java.util.ArrayList;
import java.util.List;

/// Read-only consistency checks over assembled timelines and transitions.
///
/// Produces advisory {@link ValidationWarning}s and never modifies its inputs:
/// - `ACTION_UNAVAILABLE`: action not in the availability table of the from-state's phase
/// - `SURGERY_NOT_EARLY_POSTOP`: surgical action whose destination is neither
///   `early_postop` nor `recurrent`
/// - `SIZE_DROP_WITHOUT_SURGERY`: `large → small` without a surgical action
/// - `NON_MONOTONIC_TIMESTAMPS`: input visits not strictly increasing in time
/// - `PHASE_SKIP`: `naive → late_postop`
/// - `RECURRENCE_WITHOUT_TREATMENT`: recurrence with no earlier treated phase and no
///   intervention at or before it
///
/// @implNote Stateless and thread-safe.
public final class TimelineValidator {

    /// Validates one patient's timeline against its input record.
    ///
    /// @param record the input record in its original order, not null
    /// @param timeline the processed timeline, not null
    /// @return warnings in timeline order, never null
    public List<ValidationWarning> validate(PatientRecord record, PatientTimeline timeline) {
        List<ValidationWarning> warnings = new ArrayList<>();
        warnings.addAll(checkTimestamps(record));
        for (RawTransition transition : timeline.transitions()) {
            warnings.addAll(validateTransition(transition));
        }
        warnings.addAll(checkRecurrence(timeline));
        return warnings;
    }

    /// Validates a single raw transition.
    ///
    /// @param transition the transition, not null
    /// @return warnings, empty if consistent, never null
    public List<ValidationWarning> validateTransition(RawTransition transition) {
        List<ValidationWarning> warnings = new ArrayList<>();
        String patientId = transition.patientId();
        StateId from = transition.fromState();
        StateId to = transition.toState();
        Action action = transition.action();
        int index = transition.fromVisitIndex();

        if (!ActionAvailability.isAvailable(from.phase(), action)) {
            warnings.add(
                    new ValidationWarning(
                            patientId,
                            WarningType.ACTION_UNAVAILABLE,
                            index,
                            "Action "
                                    + action.label()
                                    + " is not available in phase "
                                    + from.phase().label()));
        }
        if (action.isSurgical()
                && to.phase() != TreatmentPhase.EARLY_POSTOP
                && to.phase() != TreatmentPhase.RECURRENT) {
            warnings.add(
                    new ValidationWarning(
                            patientId,
                            WarningType.SURGERY_NOT_EARLY_POSTOP,
                            index,
                            "Surgery led to phase " + to.phase().label() + " instead of early_postop"));
        }
        if (from.size() == TumorSize.LARGE && to.size() == TumorSize.SMALL && !action.isSurgical()) {
            warnings.add(
                    new ValidationWarning(
                            patientId,
                            WarningType.SIZE_DROP_WITHOUT_SURGERY,
                            index,
                            "Tumor went from large to small under " + action.label()));
        }
        if (from.phase() == TreatmentPhase.NAIVE && to.phase() == TreatmentPhase.LATE_POSTOP) {
            warnings.add(
                    new ValidationWarning(
                            patientId,
                            WarningType.PHASE_SKIP,
                            index,
                            "Phase skipped from naive directly to late_postop"));
        }
        return warnings;
    }

    /// Counts aggregated observations that break the global action-availability invariant.
    ///
    /// Per-patient warnings for the same edges are produced by
    /// {@link #validate(PatientRecord, PatientTimeline)}.
    ///
    /// @param registry aggregated graphs, not null
    /// @return summed count of every violating edge, zero if all edges are consistent
    public int countUnavailableActions(GraphRegistry registry) {
        int violations = 0;
        for (MdpGraph graph : registry.getGraphs()) {
            for (Transition edge : graph.getTransitions()) {
                if (!ActionAvailability.isAvailable(edge.getFromState().phase(), edge.getAction())) {
                    violations += edge.getCount();
                }
            }
        }
        return violations;
    }

    private List<ValidationWarning> checkTimestamps(PatientRecord record) {
        List<ValidationWarning> warnings = new ArrayList<>();
        List<RawVisit> visits = record.getVisits();
        for (int i = 1; i < visits.size(); i++) {
            double previous = visits.get(i - 1).getMonthsSinceDiagnosis();
            double current = visits.get(i).getMonthsSinceDiagnosis();
            if (current <= previous) {
                warnings.add(
                        new ValidationWarning(
                                record.getPatientId(),
                                WarningType.NON_MONOTONIC_TIMESTAMPS,
                                i,
                                "Visit at "
                                        + current
                                        + " months follows visit at "
                                        + previous
                                        + " months in input order"));
            }
        }
        return warnings;
    }

    private List<ValidationWarning> checkRecurrence(PatientTimeline timeline) {
        List<Visit> visits = timeline.visits();
        for (int i = 0; i < visits.size(); i++) {
            if (visits.get(i).phase() != TreatmentPhase.RECURRENT) {
                continue;
            }
            for (int j = 0; j <= i; j++) {
                Visit earlier = visits.get(j);
                boolean intervention =
                        earlier.raw().isSurgeryPerformed() || earlier.raw().isRadiationPerformed();
                boolean treatedPhase = j < i && earlier.phase().isTreated();
                if (intervention || treatedPhase) {
                    return List.of();
                }
            }
            return List.of(
                    new ValidationWarning(
                            timeline.patientId(),
                            WarningType.RECURRENCE_WITHOUT_TREATMENT,
                            i,
                            "Recurrence noted without any prior treatment"));
        }
        return List.of();
    }
}
