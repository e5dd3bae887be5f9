package io.mdpath.core.exception;

import java.io.Serial;

/// Fatal condition that aborts processing of a single patient.
///
/// The pipeline catches it per patient, records a
/// {@link io.mdpath.core.pipeline.PatientError} and continues with the other patients.
///
/// @see MissingBaselineException
/// @see UnrecognizedCategoryException
/// @see InvalidIntervalException
/// @see MissingFieldException
public abstract class PatientProcessingException extends Exception {

    @Serial private static final long serialVersionUID = 3318790521064925842L;

    private final int visitIndex;

    /// Creates exception with message and the offending visit.
    ///
    /// @param message description of the failure
    /// @param visitIndex index of the visit in the sorted timeline, `-1` for patient-level
    protected PatientProcessingException(String message, int visitIndex) {
        super(message);
        this.visitIndex = visitIndex;
    }

    /// Returns the index of the visit that triggered the failure.
    ///
    /// @return visit index, or `-1` when the failure concerns patient-level data
    public int getVisitIndex() {
        return visitIndex;
    }

    /// Returns the error type label reported in pipeline output.
    ///
    /// @return error type, never null
    public abstract String getErrorType();
}
