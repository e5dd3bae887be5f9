package io.mdpath.core.state;

/// Time-derived treatment phase of a visit.
///
/// @see io.mdpath.core.phase.TreatmentPhaseMachine for derivation rules
public enum TreatmentPhase {

    /// No surgery, radiation or recurrence yet.
    NAIVE("naive"),

    /// Within the early window after the first surgery.
    EARLY_POSTOP("early_postop"),

    /// Beyond the early window after the first surgery.
    LATE_POSTOP("late_postop"),

    /// Within the early window after the first radiation, no surgery.
    EARLY_POSTRAD("early_postrad"),

    /// Beyond the early window after the first radiation, no surgery.
    LATE_POSTRAD("late_postrad"),

    /// Recurrence has been noted. Terminal.
    RECURRENT("recurrent");

    private final String label;

    TreatmentPhase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /// Returns whether any treatment has been delivered in this phase.
    ///
    /// @return `false` only for {@link #NAIVE}
    public boolean isTreated() {
        return this != NAIVE;
    }
}
