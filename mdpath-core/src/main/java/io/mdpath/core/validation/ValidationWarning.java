package io.mdpath.core.validation;

import java.util.Objects;

/// Advisory finding about one patient's timeline or one transition.
///
/// @param patientId patient the warning refers to, not null
/// @param type warning category, not null
/// @param visitIndex index of the visit concerned in the sorted timeline, `-1` if none
/// @param message human-readable detail, not null
public record ValidationWarning(
        String patientId, WarningType type, int visitIndex, String message) {

    public ValidationWarning {
        Objects.requireNonNull(patientId, "patientId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(message, "message");
    }
}
