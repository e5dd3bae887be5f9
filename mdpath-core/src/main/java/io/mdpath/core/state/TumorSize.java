package io.mdpath.core.state;

/// Largest tumor diameter, bucketed on half-open intervals at 3.0 cm and 5.0 cm.
public enum TumorSize {
    SMALL("small"),
    MEDIUM("medium"),
    LARGE("large");

    private final String label;

    TumorSize(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
