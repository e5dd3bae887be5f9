package io.mdpath.core.state;

public enum SymptomStatus {
    NONE("none"),
    PRESENT("present");

    private final String label;

    SymptomStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
