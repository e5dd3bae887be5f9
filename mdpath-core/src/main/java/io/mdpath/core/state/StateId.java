package io.mdpath.core.state;

import java.util.Comparator;
import java.util.Objects;

/// One MDP state: (tumor size, symptoms, growth velocity, treatment phase).
///
/// 3 × 2 × 3 × 6 = 108 possible values. Two states are equal iff all four components
/// match.
///
/// @param size tumor size bucket, not null
/// @param symptoms symptom status, not null
/// @param velocity growth velocity bucket, not null
/// @param phase treatment phase, not null
public record StateId(
        TumorSize size, SymptomStatus symptoms, GrowthVelocity velocity, TreatmentPhase phase)
        implements Comparable<StateId> {

    public static final int CARDINALITY =
            TumorSize.values().length
                    * SymptomStatus.values().length
                    * GrowthVelocity.values().length
                    * TreatmentPhase.values().length;

    private static final Comparator<StateId> ORDER =
            Comparator.comparing(StateId::size)
                    .thenComparing(StateId::symptoms)
                    .thenComparing(StateId::velocity)
                    .thenComparing(StateId::phase);

    public StateId {
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(symptoms, "symptoms");
        Objects.requireNonNull(velocity, "velocity");
        Objects.requireNonNull(phase, "phase");
    }

    /// Returns the canonical identifier, e.g. `medium|none|stable|naive`.
    ///
    /// @return identifier string, never null
    public String id() {
        return size.label()
                + "|"
                + symptoms.label()
                + "|"
                + velocity.label()
                + "|"
                + phase.label();
    }

    @Override
    public int compareTo(StateId o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return id();
    }
}
