package io.mdpath.core.action;

/// Clinical decision taken between two consecutive visits.
///
/// Observation actions are inferred from the interval to the next visit. Intervention
/// actions come from the surgery and radiation recorded for the step.
///
/// @see ActionAvailability for the per-phase table
public enum Action {
    OBSERVE_SHORT("observe_short", Kind.OBSERVATION),
    OBSERVE_MEDIUM("observe_medium", Kind.OBSERVATION),
    OBSERVE_LONG("observe_long", Kind.OBSERVATION),
    SURGERY_GTR("surgery_gtr", Kind.SURGERY),
    SURGERY_STR("surgery_str", Kind.SURGERY),
    RADIATION_SRS("radiation_srs", Kind.RADIATION),
    RADIATION_FSRT("radiation_fsrt", Kind.RADIATION),
    SUPPORTIVE_CARE("supportive_care", Kind.SUPPORTIVE);

    /// Coarse family of an action.
    public enum Kind {
        OBSERVATION,
        SURGERY,
        RADIATION,
        SUPPORTIVE
    }

    private final String label;
    private final Kind kind;

    Action(String label, Kind kind) {
        this.label = label;
        this.kind = kind;
    }

    public String label() {
        return label;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isSurgical() {
        return kind == Kind.SURGERY;
    }
}
