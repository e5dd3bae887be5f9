package io.mdpath.core.imputation;

import io.mdpath.core.exception.PatientProcessingException;
import io.mdpath.core.validation.ValidationWarning;
import java.util.List;

/// Output of imputing one patient's timeline.
///
/// When a fatal condition is met partway through the timeline, `visits` holds the resolvable
/// prefix and `failure` the condition that stopped imputation.
///
/// @param visits imputed visits in timeline order, never null
/// @param warnings recoverable findings, never null
/// @param failure condition that truncated the timeline, may be null
public record ImputationResult(
        List<ImputedVisit> visits,
        List<ValidationWarning> warnings,
        PatientProcessingException failure) {

    public ImputationResult {
        visits = List.copyOf(visits);
        warnings = List.copyOf(warnings);
    }

    public boolean isTruncated() {
        return failure != null;
    }
}
