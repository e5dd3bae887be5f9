package io.mdpath.core.stratification;

public enum TumorLocation {
    CONVEXITY("convexity"),
    SKULL_BASE("skull_base"),
    PARASAGITTAL("parasagittal"),
    SPHENOID_WING("sphenoid_wing"),
    OTHER("other");

    private final String label;

    TumorLocation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
