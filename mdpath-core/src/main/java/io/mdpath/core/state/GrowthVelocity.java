package io.mdpath.core.state;

/// Growth rate between two consecutive measurements, in cm per year.
///
/// Shrinking tumors are always {@link #STABLE}.
public enum GrowthVelocity {
    STABLE("stable"),
    SLOW_GROWTH("slow_growth"),
    FAST_GROWTH("fast_growth");

    private final String label;

    GrowthVelocity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
