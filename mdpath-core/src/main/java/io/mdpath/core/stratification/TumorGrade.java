package io.mdpath.core.stratification;

/// WHO pathology grade of the tumor.
///
/// Grade is the only stratification factor that may change along a patient's timeline.
/// A change produces a cross-graph transition.
public enum TumorGrade {
    GRADE_1("grade_1"),
    GRADE_2("grade_2"),
    GRADE_3("grade_3");

    private final String label;

    TumorGrade(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
