package io.mdpath.core.exception;

import java.io.Serial;

/// Thrown when a categorical input cannot be mapped to a closed label set.
public class UnrecognizedCategoryException extends PatientProcessingException {

    @Serial private static final long serialVersionUID = 7791360344318806315L;

    private final String category;
    private final String value;

    /// Creates exception for a patient-level category.
    ///
    /// @param category name of the field, e.g. `gender`
    /// @param value the raw value that did not match, may be null
    public UnrecognizedCategoryException(String category, String value) {
        super("Unrecognized " + category + " value: '" + value + "'", -1);
        this.category = category;
        this.value = value;
    }

    public String getCategory() {
        return category;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String getErrorType() {
        return "UnrecognizedCategory";
    }
}
