package io.mdpath.core.assembly;

import io.mdpath.core.action.Action;
import io.mdpath.core.action.ActionAvailability;
import io.mdpath.core.classify.BucketClassifiers;
import io.mdpath.core.state.StateId;
import io.mdpath.core.visit.RadiationType;
import io.mdpath.core.visit.RawVisit;
import io.mdpath.core.visit.SurgeryType;
import io.mdpath.core.visit.Visit;

/// Builds canonical state and action identifiers from visits.
///
/// The action of the step between two consecutive visits is resolved from the
/// interventions recorded on the later visit, by priority:
/// 1. surgery → `SURGERY_GTR` / `SURGERY_STR` (GTR when unspecified)
/// 2. radiation → `RADIATION_SRS` / `RADIATION_FSRT` (SRS when unspecified)
/// 3. supportive care only → `SUPPORTIVE_CARE`
/// 4. otherwise the observation action of the interval between the two visits
///
/// Availability is not enforced here; mismatches are reported by the validator.
///
/// @implNote Stateless and thread-safe.
public final class StateActionAssembler {

    /// Builds the state of a visit from its four bucketed fields.
    ///
    /// @param visit the visit, not null
    /// @return state identifier, never null
    public StateId stateOf(Visit visit) {
        return new StateId(visit.size(), visit.symptoms(), visit.velocity(), visit.phase());
    }

    /// Resolves the action taken between two consecutive visits.
    ///
    /// @param from earlier visit, not null
    /// @param to later visit, not null
    /// @return the action, never null
    public Action actionBetween(Visit from, Visit to) {
        RawVisit step = to.raw();
        if (step.isSurgeryPerformed()) {
            return BucketClassifiers.surgeryType(step.getSurgeryType()) == SurgeryType.STR
                    ? Action.SURGERY_STR
                    : Action.SURGERY_GTR;
        }
        if (step.isRadiationPerformed()) {
            return BucketClassifiers.radiationType(step.getRadiationType()) == RadiationType.FSRT
                    ? Action.RADIATION_FSRT
                    : Action.RADIATION_SRS;
        }
        if (step.isSupportiveCareOnly()) {
            return Action.SUPPORTIVE_CARE;
        }
        return BucketClassifiers.observationAction(to.months() - from.months());
    }

    /// Checks an action against the availability table of the from-visit's phase.
    ///
    /// @param from the visit the action is taken from, not null
    /// @param action the action, not null
    /// @return `true` if the action is available
    public boolean isAvailable(Visit from, Action action) {
        return ActionAvailability.isAvailable(from.phase(), action);
    }
}
