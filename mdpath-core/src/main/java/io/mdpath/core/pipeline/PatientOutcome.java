package io.mdpath.core.pipeline;

import io.mdpath.core.transition.PatientTimeline;
import io.mdpath.core.validation.ValidationWarning;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Result of processing one patient.
///
/// @param patientId the patient, not null
/// @param timeline processed timeline, empty when the patient failed before any visit
/// @param warnings imputation and validation warnings, never null
/// @param error fatal failure, may be null
public record PatientOutcome(
        String patientId,
        PatientTimeline timeline,
        List<ValidationWarning> warnings,
        PatientError error) {

    public PatientOutcome {
        Objects.requireNonNull(patientId, "patientId");
        Objects.requireNonNull(timeline, "timeline");
        warnings = List.copyOf(warnings);
    }

    public Optional<PatientError> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
