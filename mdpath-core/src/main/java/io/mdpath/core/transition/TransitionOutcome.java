package io.mdpath.core.transition;

import io.mdpath.core.state.TumorSize;

/// Change of the tumor size bucket across one transition.
public enum TransitionOutcome {
    SHRANK("shrank"),
    UNCHANGED("unchanged"),
    GREW("grew");

    private final String label;

    TransitionOutcome(String label) {
        this.label = label;
    }

    /// Returns the name used in serialized output.
    ///
    /// @return lowercase label, never null
    public String label() {
        return label;
    }

    /// Compares two size buckets.
    ///
    /// @param from size before the step, not null
    /// @param to size after the step, not null
    /// @return the outcome, never null
    public static TransitionOutcome of(TumorSize from, TumorSize to) {
        int delta = Integer.compare(to.ordinal(), from.ordinal());
        if (delta < 0) {
            return SHRANK;
        }
        return delta == 0 ? UNCHANGED : GREW;
    }
}
