package io.mdpath.core.transition;

import io.mdpath.core.stratification.StratificationKey;
import io.mdpath.core.visit.Visit;
import java.util.List;
import java.util.Objects;

/// A patient's processed timeline: visits, the stratification key in force at each visit,
/// and the raw transitions between consecutive visits.
///
/// @param patientId patient identifier, not null
/// @param visits visits in chronological order, never null
/// @param keys stratification key per visit, same size as `visits`
/// @param transitions one raw transition per consecutive visit pair
public record PatientTimeline(
        String patientId,
        List<Visit> visits,
        List<StratificationKey> keys,
        List<RawTransition> transitions) {

    public PatientTimeline {
        Objects.requireNonNull(patientId, "patientId");
        visits = List.copyOf(visits);
        keys = List.copyOf(keys);
        transitions = List.copyOf(transitions);
        if (keys.size() != visits.size()) {
            throw new IllegalArgumentException(
                    "Expected one key per visit: " + keys.size() + " keys, " + visits.size() + " visits");
        }
    }

    /// Returns the key the patient entered the timeline with.
    ///
    /// @return initial key, null for an empty timeline
    public StratificationKey initialKey() {
        return keys.isEmpty() ? null : keys.get(0);
    }

    public boolean isEmpty() {
        return visits.isEmpty();
    }
}
