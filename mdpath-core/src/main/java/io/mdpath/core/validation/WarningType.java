package io.mdpath.core.validation;

/// Categories of advisory warnings attached to pipeline output.
///
/// None of them halts processing.
public enum WarningType {

    /// A post-surgery measurement exceeded the pre-surgery one and was capped.
    CONTRADICTORY_POST_SURGERY_SIZE,

    /// Interval too short for a reliable growth velocity; previous value carried forward.
    SHORT_VELOCITY_INTERVAL,

    /// The action of a transition is not available in the from-state's phase.
    ACTION_UNAVAILABLE,

    /// A surgical action did not lead to the early post-operative phase.
    SURGERY_NOT_EARLY_POSTOP,

    /// Tumor went from large to small without a surgical action.
    SIZE_DROP_WITHOUT_SURGERY,

    /// Visit timestamps were not strictly increasing in the input order.
    NON_MONOTONIC_TIMESTAMPS,

    /// Phase jumped from naive straight to late post-operative.
    PHASE_SKIP,

    /// Recurrence was noted before any treatment in the timeline.
    RECURRENCE_WITHOUT_TREATMENT
}
