package io.mdpath.core.stratification;

/// Age at diagnosis, bucketed on half-open intervals `[0, 50)`, `[50, 65)`, `[65, ∞)`.
///
/// A boundary value belongs to the higher bucket: 50 is `50-65`, 65 is `≥65`.
public enum AgeBucket {
    UNDER_50("<50"),
    FROM_50_TO_65("50-65"),
    AT_LEAST_65("≥65");

    private final String label;

    AgeBucket(String label) {
        this.label = label;
    }

    /// Returns the canonical label used in graph identifiers.
    ///
    /// @return label, never null
    public String label() {
        return label;
    }
}
