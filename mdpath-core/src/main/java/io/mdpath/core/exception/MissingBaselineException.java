package io.mdpath.core.exception;

import java.io.Serial;

/// Thrown when the first visit of a timeline has no tumor measurement.
public class MissingBaselineException extends PatientProcessingException {

    @Serial private static final long serialVersionUID = -2145687730985511320L;

    public MissingBaselineException(String message) {
        super(message, 0);
    }

    @Override
    public String getErrorType() {
        return "MissingBaseline";
    }
}
