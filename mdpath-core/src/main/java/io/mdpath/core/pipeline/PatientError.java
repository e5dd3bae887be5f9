package io.mdpath.core.pipeline;

import io.mdpath.core.exception.PatientProcessingException;
import java.util.Objects;

/// Fatal failure reported for one patient.
///
/// @param patientId the failed patient, not null
/// @param errorType error category, e.g. `MissingBaseline`, not null
/// @param visitIndex visit that triggered the failure, `-1` for patient-level data
/// @param message human-readable detail, not null
/// @param partial `true` if the timeline before the failure still contributed
public record PatientError(
        String patientId, String errorType, int visitIndex, String message, boolean partial) {

    public PatientError {
        Objects.requireNonNull(patientId, "patientId");
        Objects.requireNonNull(errorType, "errorType");
        Objects.requireNonNull(message, "message");
    }

    public static PatientError of(
            String patientId, PatientProcessingException e, boolean partial) {
        return new PatientError(
                patientId, e.getErrorType(), e.getVisitIndex(), e.getMessage(), partial);
    }
}
