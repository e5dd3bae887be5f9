package io.mdpath.core.pipeline;

import java.time.Duration;
import java.time.Instant;

/// Counters of one pipeline run.
///
/// @param patients patients in the input
/// @param failedPatients patients with a fatal error, including partially processed ones
/// @param visits visits that made it into timelines
/// @param rawTransitions transitions built before deduplication
/// @param crossGraphTransitions raw transitions that changed graph
/// @param edges deduplicated edges across all graphs
/// @param populatedGraphs graphs with at least one observation
/// @param startedAt run start, not null
/// @param completedAt run end, not null
public record RunStatistics(
        int patients,
        int failedPatients,
        int visits,
        int rawTransitions,
        int crossGraphTransitions,
        int edges,
        int populatedGraphs,
        Instant startedAt,
        Instant completedAt) {

    public Duration duration() {
        return Duration.between(startedAt, completedAt);
    }
}
