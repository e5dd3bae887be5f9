package io.mdpath.core.exception;

import java.io.Serial;

/// Thrown when a field the engine cannot do without was not supplied, such as the age at
/// diagnosis or a visit's timestamp.
public class MissingFieldException extends PatientProcessingException {

    @Serial private static final long serialVersionUID = 2946175830412297718L;

    private final String field;

    /// Creates exception for an absent field.
    ///
    /// @param field input field name, e.g. `age_at_diagnosis`
    /// @param visitIndex index of the visit in input order, `-1` for patient-level fields
    public MissingFieldException(String field, int visitIndex) {
        super(
                visitIndex < 0
                        ? "Missing required field '" + field + "'"
                        : "Missing required field '" + field + "' on visit " + visitIndex,
                visitIndex);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public String getErrorType() {
        return "MissingField";
    }
}
